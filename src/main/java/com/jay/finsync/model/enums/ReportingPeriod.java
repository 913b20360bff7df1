package com.jay.finsync.model.enums;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Reporting periods accepted by the FMP statement and metrics endpoints. */
public enum ReportingPeriod {
    ANNUAL("annual"),
    QUARTER("quarter"),
    Q1("Q1"),
    Q2("Q2"),
    Q3("Q3"),
    Q4("Q4"),
    FY("FY");

    private final String apiValue;

    ReportingPeriod(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }

    public static ReportingPeriod fromApiValue(String value) {
        for (ReportingPeriod p : values()) {
            if (p.apiValue.equals(value)) return p;
        }
        throw new IllegalArgumentException("Period must be one of: " + Arrays.stream(values())
            .map(ReportingPeriod::apiValue).collect(Collectors.joining(", ")));
    }
}
