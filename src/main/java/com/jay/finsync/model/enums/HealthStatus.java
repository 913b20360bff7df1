package com.jay.finsync.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY("healthy"),
    WARNING("warning"),
    NEUTRAL("neutral");     // no data, no benchmark, or not evaluable

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
