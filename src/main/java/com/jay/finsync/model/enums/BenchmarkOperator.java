package com.jay.finsync.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;

/**
 * Comparison applied by a benchmark rule.
 * Configuration may use either the enum name or the display symbol.
 */
public enum BenchmarkOperator {
    GT(">"),
    LT("<"),
    GTE(">="),
    LTE("<="),
    APPROX("~"),
    RANGE("range"),
    CUSTOM("custom");

    private final String symbol;

    BenchmarkOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static BenchmarkOperator fromText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Benchmark operator is missing");
        }
        String trimmed = text.trim();
        for (BenchmarkOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown benchmark operator: '" + text + "'. Expected one of "
            + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }
}
