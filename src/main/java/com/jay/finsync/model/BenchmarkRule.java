package com.jay.finsync.model;

import com.jay.finsync.model.enums.BenchmarkOperator;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * How to judge one named metric.
 * threshold is used by GT/LT/GTE/LTE/APPROX, low/high by RANGE, CUSTOM uses neither.
 * Numbers keep the scale they were configured with so "1.0" prints as "1.0".
 */
public record BenchmarkRule(
    String metricName,
    BenchmarkOperator operator,
    BigDecimal threshold,
    BigDecimal low,
    BigDecimal high,
    String unit,
    String insight
) {
    public BenchmarkRule {
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(operator, "operator");
        unit = unit == null ? "" : unit;
        insight = insight == null ? "" : insight;
    }

    public static BenchmarkRule threshold(String metricName, BenchmarkOperator operator,
                                          BigDecimal threshold, String unit, String insight) {
        return new BenchmarkRule(metricName, operator, threshold, null, null, unit, insight);
    }

    public static BenchmarkRule range(String metricName, BigDecimal low, BigDecimal high,
                                      String unit, String insight) {
        return new BenchmarkRule(metricName, BenchmarkOperator.RANGE, null, low, high, unit, insight);
    }

    public static BenchmarkRule custom(String metricName, String insight) {
        return new BenchmarkRule(metricName, BenchmarkOperator.CUSTOM, null, null, null, "", insight);
    }

    /** True when the rule carries the numbers its operator needs. */
    public boolean isEvaluable() {
        return switch (operator) {
            case GT, LT, GTE, LTE, APPROX -> threshold != null;
            case RANGE -> low != null && high != null;
            case CUSTOM -> true;
        };
    }
}
