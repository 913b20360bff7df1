package com.jay.finsync.layer2_health;

import com.jay.finsync.model.BenchmarkRule;
import com.jay.finsync.model.HealthRecord;
import com.jay.finsync.model.MetricRef;
import com.jay.finsync.model.SectionMetricMap;
import com.jay.finsync.model.enums.HealthStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoublePredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layer 2: Financial Health Benchmark Evaluator.
 * Judges raw metric values against benchmark rules and lays the results out
 * as the sectioned health report.
 *
 * Stateless: every method is a pure function of its arguments, so one instance
 * is shared by all callers. A metric that cannot be judged (no value, no rule,
 * unparsable text, rule missing its numbers) is reported as NEUTRAL and never
 * stops the rest of the report.
 */
@Component
public class BenchmarkEvaluator {

    /** Unit decorations removed before the number is read. Plain substring removal. */
    static final List<String> DECORATIONS = List.of("%", "×", "$", "days", "B");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");
    private static final double APPROX_TOLERANCE = 0.15;
    private static final String CUSTOM_BENCHMARK_TEXT = "See insight";

    // ── Evaluation ─────────────────────────────────────────────────────────────

    /**
     * Compares a value with a rule.
     *
     * @param value a Number, a String holding a (possibly decorated) number, or null
     * @param rule  the benchmark for the metric, or null when none is defined
     */
    public HealthStatus evaluate(Object value, BenchmarkRule rule) {
        if (value == null || rule == null) return HealthStatus.NEUTRAL;

        OptionalDouble parsed = parseNumber(value);
        if (parsed.isEmpty()) return HealthStatus.NEUTRAL;
        double v = parsed.getAsDouble();

        return switch (rule.operator()) {
            case GT     -> againstThreshold(rule.threshold(), t -> v > t);
            case LT     -> againstThreshold(rule.threshold(), t -> v < t);
            case GTE    -> againstThreshold(rule.threshold(), t -> v >= t);
            case LTE    -> againstThreshold(rule.threshold(), t -> v <= t);
            case APPROX -> approximately(v, rule.threshold());
            case RANGE  -> within(v, rule.low(), rule.high());
            case CUSTOM -> HealthStatus.NEUTRAL;
        };
    }

    private HealthStatus againstThreshold(BigDecimal threshold, DoublePredicate healthyWhen) {
        if (threshold == null) return HealthStatus.NEUTRAL;
        return verdict(healthyWhen.test(threshold.doubleValue()));
    }

    private HealthStatus approximately(double v, BigDecimal threshold) {
        if (threshold == null || threshold.signum() == 0) return HealthStatus.NEUTRAL;
        double t = threshold.doubleValue();
        return verdict(Math.abs(v - t) / t < APPROX_TOLERANCE);
    }

    private HealthStatus within(double v, BigDecimal low, BigDecimal high) {
        if (low == null || high == null) return HealthStatus.NEUTRAL;
        return verdict(low.doubleValue() <= v && v <= high.doubleValue());
    }

    private static HealthStatus verdict(boolean healthy) {
        return healthy ? HealthStatus.HEALTHY : HealthStatus.WARNING;
    }

    /**
     * Strips unit decorations and reads the first signed decimal in the text.
     * Empty when the text holds no number.
     */
    OptionalDouble parseNumber(Object value) {
        String text = toText(value);
        for (String decoration : DECORATIONS) {
            text = text.replace(decoration, "");
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(m.group()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    // ── Display ────────────────────────────────────────────────────────────────

    /** Human-readable form of a rule: "> 0.4", "~1.0×", "1.0–2.0", "See insight". */
    public String formatBenchmark(BenchmarkRule rule) {
        if (rule == null) return "";
        String unit = rule.unit();
        return switch (rule.operator()) {
            case RANGE  -> number(rule.low()) + "–" + number(rule.high()) + unit;
            case APPROX -> "~" + number(rule.threshold()) + unit;
            case CUSTOM -> CUSTOM_BENCHMARK_TEXT;
            case GT, LT, GTE, LTE -> rule.operator().symbol() + " " + number(rule.threshold()) + unit;
        };
    }

    private static String number(BigDecimal n) {
        return n == null ? "" : n.toPlainString();
    }

    /**
     * Renders a raw value as plain text. Floating point values never use exponent
     * form so the number survives parseNumber unchanged.
     */
    static String toText(Object value) {
        if (value instanceof BigDecimal bd) return bd.toPlainString();
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) return String.valueOf(d);
            return BigDecimal.valueOf(d).toPlainString();
        }
        return String.valueOf(value);
    }

    // ── Report ─────────────────────────────────────────────────────────────────

    /**
     * Evaluates every (section, metric) pair of the layout, in layout order.
     * The result always has exactly {@link SectionMetricMap#metricCount()} rows,
     * whatever keys the metrics map holds.
     *
     * @param metrics    raw values keyed by data key (e.g. "current_ratio")
     * @param sectionMap report layout
     * @param benchmarks rules keyed by metric name; metrics without a rule come out NEUTRAL
     */
    public List<HealthRecord> buildHealthRecords(Map<String, ?> metrics,
                                                 SectionMetricMap sectionMap,
                                                 Map<String, BenchmarkRule> benchmarks) {
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(sectionMap, "sectionMap");
        Map<String, BenchmarkRule> rules = benchmarks != null ? benchmarks : Map.of();

        List<HealthRecord> records = new ArrayList<>(sectionMap.metricCount());
        for (Map.Entry<String, List<MetricRef>> section : sectionMap.sections().entrySet()) {
            for (MetricRef ref : section.getValue()) {
                Object value = metrics.get(ref.dataKey());
                BenchmarkRule rule = rules.get(ref.metricName());
                records.add(HealthRecord.builder()
                    .section(section.getKey())
                    .metric(ref.metricName())
                    .benchmark(formatBenchmark(rule))
                    .value(value != null ? toText(value) : "")
                    .status(evaluate(value, rule))
                    .insight(rule != null ? rule.insight() : "")
                    .build());
            }
        }
        return records;
    }
}
