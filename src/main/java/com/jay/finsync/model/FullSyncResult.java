package com.jay.finsync.model;

import java.util.Map;

/**
 * Outcome of a full company sync.
 *
 * @param status           completed | completed_with_errors | failed
 * @param steps            step name to "success", "no_data" or "failed: reason", in run order
 * @param totalApiCalls    FMP calls that returned without error
 * @param totalTimeSeconds wall time of the whole run
 */
public record FullSyncResult(
    String symbol,
    String status,
    Map<String, String> steps,
    int totalApiCalls,
    double totalTimeSeconds
) {
    public static final String COMPLETED = "completed";
    public static final String COMPLETED_WITH_ERRORS = "completed_with_errors";
    public static final String FAILED = "failed";
}
