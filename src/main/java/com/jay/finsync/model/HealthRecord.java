package com.jay.finsync.model;

import com.jay.finsync.model.enums.HealthStatus;
import lombok.Builder;
import lombok.Value;

/**
 * One evaluated row of the financial health report.
 * Produced by BenchmarkEvaluator; persisted by FinancialHealthSyncService.
 */
@Value
@Builder
public class HealthRecord {
    String section;
    String metric;
    String benchmark;     // display text, e.g. "> 0.4", "1.0–2.0", "See insight"
    String value;         // raw value as text, "" when missing
    HealthStatus status;
    String insight;
}
