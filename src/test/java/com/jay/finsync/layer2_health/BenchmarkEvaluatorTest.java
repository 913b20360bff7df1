package com.jay.finsync.layer2_health;

import com.jay.finsync.model.BenchmarkRule;
import com.jay.finsync.model.HealthRecord;
import com.jay.finsync.model.SectionMetricMap;
import com.jay.finsync.model.enums.BenchmarkOperator;
import com.jay.finsync.model.enums.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

@DisplayName("BenchmarkEvaluator")
class BenchmarkEvaluatorTest {

    private final BenchmarkEvaluator evaluator = new BenchmarkEvaluator();

    private static BenchmarkRule rule(BenchmarkOperator op, String threshold) {
        return BenchmarkRule.threshold("Metric", op, new BigDecimal(threshold), "", "insight");
    }

    private static BenchmarkRule range(String low, String high) {
        return BenchmarkRule.range("Metric", new BigDecimal(low), new BigDecimal(high), "", "insight");
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        void percentTextAgainstGreaterThan() {
            BenchmarkRule gt10 = rule(BenchmarkOperator.GT, "10");
            assertThat(evaluator.evaluate("15%", gt10)).isEqualTo(HealthStatus.HEALTHY);
            assertThat(evaluator.evaluate("5%", gt10)).isEqualTo(HealthStatus.WARNING);
        }

        @Test
        void nullValueOrNullRuleIsNeutral() {
            assertThat(evaluator.evaluate(null, rule(BenchmarkOperator.GT, "1"))).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate(null, range("1", "2"))).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate(1.5, null)).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate("abc", null)).isEqualTo(HealthStatus.NEUTRAL);
        }

        @Test
        void textWithoutNumberIsNeutral() {
            assertThat(evaluator.evaluate("abc", rule(BenchmarkOperator.GT, "1"))).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate("", range("1", "2"))).isEqualTo(HealthStatus.NEUTRAL);
        }

        @ParameterizedTest(name = "{0} in [1.0, 2.0] -> {1}")
        @CsvSource({
            "1.0,  HEALTHY",
            "1.5,  HEALTHY",
            "2.0,  HEALTHY",
            "0.99, WARNING",
            "2.01, WARNING",
            "-1,   WARNING"
        })
        void rangeIsInclusive(double value, HealthStatus expected) {
            assertThat(evaluator.evaluate(value, range("1.0", "2.0"))).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} ~ 1.0 -> {1}")
        @CsvSource({
            "1.0,  HEALTHY",
            "1.1,  HEALTHY",
            "0.9,  HEALTHY",
            "1.2,  WARNING",
            "0.8,  WARNING",
            "1.16, WARNING"
        })
        void approxWithinFifteenPercent(String value, HealthStatus expected) {
            assertThat(evaluator.evaluate(value, rule(BenchmarkOperator.APPROX, "1.0"))).isEqualTo(expected);
        }

        @Test
        void approxAgainstZeroThresholdIsNeutral() {
            assertThat(evaluator.evaluate(0.0, rule(BenchmarkOperator.APPROX, "0"))).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate(5, rule(BenchmarkOperator.APPROX, "0.0"))).isEqualTo(HealthStatus.NEUTRAL);
        }

        @ParameterizedTest(name = "{0} {1} {2} -> {3}")
        @CsvSource({
            "45,  LT,  45, WARNING",
            "45,  LTE, 45, HEALTHY",
            "45,  GTE, 45, HEALTHY",
            "45,  GT,  45, WARNING",
            "-3.5, LT, 0,  HEALTHY",
            "3,   GT,  -1, HEALTHY"
        })
        void comparisonOperatorsAtTheBoundary(String value, BenchmarkOperator op, String threshold,
                                              HealthStatus expected) {
            assertThat(evaluator.evaluate(value, rule(op, threshold))).isEqualTo(expected);
        }

        @Test
        void unitDecorationsAreStrippedBeforeParsing() {
            assertThat(evaluator.evaluate("$1.2B", rule(BenchmarkOperator.GT, "1"))).isEqualTo(HealthStatus.HEALTHY);
            assertThat(evaluator.evaluate("30 days", rule(BenchmarkOperator.LT, "45"))).isEqualTo(HealthStatus.HEALTHY);
            assertThat(evaluator.evaluate("2.5×", rule(BenchmarkOperator.LTE, "2.5"))).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        void smallDoublesAreReadWithoutExponent() {
            // 1.0E-5 would otherwise be read as 1.0
            assertThat(evaluator.evaluate(1.0E-5, rule(BenchmarkOperator.LT, "0.001"))).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        void customIsAlwaysNeutral() {
            BenchmarkRule custom = BenchmarkRule.custom("Graham Number", "compare with price");
            assertThat(evaluator.evaluate(10, custom)).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate("-4", custom)).isEqualTo(HealthStatus.NEUTRAL);
        }

        @Test
        void ruleMissingItsNumbersIsNeutral() {
            BenchmarkRule noThreshold = new BenchmarkRule("M", BenchmarkOperator.GT, null, null, null, "", "");
            BenchmarkRule halfRange = new BenchmarkRule("M", BenchmarkOperator.RANGE, null, BigDecimal.ONE, null, "", "");
            assertThat(evaluator.evaluate(5, noThreshold)).isEqualTo(HealthStatus.NEUTRAL);
            assertThat(evaluator.evaluate(5, halfRange)).isEqualTo(HealthStatus.NEUTRAL);
        }
    }

    @Nested
    @DisplayName("formatBenchmark")
    class FormatBenchmark {

        @Test
        void rangeUsesEnDashAndKeepsConfiguredScale() {
            assertThat(evaluator.formatBenchmark(range("1", "2"))).isEqualTo("1–2");
            assertThat(evaluator.formatBenchmark(range("1.0", "2.0"))).isEqualTo("1.0–2.0");
            assertThat(evaluator.formatBenchmark(
                BenchmarkRule.range("DPO", new BigDecimal("30"), new BigDecimal("90"), " days", "")))
                .isEqualTo("30–90 days");
        }

        @Test
        void comparisonAndApprox() {
            assertThat(evaluator.formatBenchmark(rule(BenchmarkOperator.GT, "0.4"))).isEqualTo("> 0.4");
            assertThat(evaluator.formatBenchmark(
                BenchmarkRule.threshold("D/E", BenchmarkOperator.LT, new BigDecimal("1.0"), "×", "")))
                .isEqualTo("< 1.0×");
            assertThat(evaluator.formatBenchmark(rule(BenchmarkOperator.GTE, "1"))).isEqualTo(">= 1");
            assertThat(evaluator.formatBenchmark(rule(BenchmarkOperator.LTE, "2.5"))).isEqualTo("<= 2.5");
            assertThat(evaluator.formatBenchmark(
                BenchmarkRule.threshold("PEG", BenchmarkOperator.APPROX, new BigDecimal("1.0"), "×", "")))
                .isEqualTo("~1.0×");
        }

        @Test
        void customNullAndIncompleteRules() {
            assertThat(evaluator.formatBenchmark(BenchmarkRule.custom("R&D", "x"))).isEqualTo("See insight");
            assertThat(evaluator.formatBenchmark(null)).isEmpty();
            assertThat(evaluator.formatBenchmark(new BenchmarkRule("M", BenchmarkOperator.GT, null, null, null, "", "")))
                .isEqualTo("> ");
        }
    }

    @Nested
    @DisplayName("buildHealthRecords")
    class BuildHealthRecords {

        private final SectionMetricMap layout = SectionMetricMap.builder()
            .metric("Profitability", "Return on Equity", "return_on_equity")
            .metric("Profitability", "Net Profit Margin", "net_profit_margin")
            .metric("Liquidity", "Current Ratio", "current_ratio")
            .metric("Liquidity", "Quick Ratio", "quick_ratio")
            .metric("Cost Structure", "Graham Number", "graham_number")
            .build();

        private final Map<String, BenchmarkRule> rules = Map.of(
            "Return on Equity", rule(BenchmarkOperator.GT, "0.15"),
            "Current Ratio", range("1.0", "2.0"),
            "Graham Number", BenchmarkRule.custom("Graham Number", "compare with price"));

        @Test
        void currentRatioInsideRangeIsHealthy() {
            SectionMetricMap liquidity = SectionMetricMap.builder()
                .metric("Liquidity", "Current Ratio", "current_ratio").build();
            BenchmarkRule currentRatio = BenchmarkRule.range("Current Ratio",
                new BigDecimal("1.0"), new BigDecimal("2.0"), "", "Between 1 and 2 is comfortable.");

            List<HealthRecord> records = evaluator.buildHealthRecords(
                Map.of("current_ratio", 1.5), liquidity, Map.of("Current Ratio", currentRatio));

            assertThat(records).singleElement().satisfies(r -> {
                assertThat(r.getSection()).isEqualTo("Liquidity");
                assertThat(r.getMetric()).isEqualTo("Current Ratio");
                assertThat(r.getBenchmark()).isEqualTo("1.0–2.0");
                assertThat(r.getValue()).isEqualTo("1.5");
                assertThat(r.getStatus()).isEqualTo(HealthStatus.HEALTHY);
                assertThat(r.getInsight()).isEqualTo("Between 1 and 2 is comfortable.");
            });
        }

        @Test
        void oneRecordPerLayoutEntryWhateverTheMetricsHold() {
            assertThat(evaluator.buildHealthRecords(Map.of(), layout, rules)).hasSize(5);

            Map<String, Object> many = new HashMap<>();
            many.put("return_on_equity", 0.3);
            many.put("current_ratio", 3);
            many.put("unrelated_key", 42);
            many.put("another", "x");
            many.put("and_more", null);
            many.put("yet_more", 1);
            assertThat(evaluator.buildHealthRecords(many, layout, rules)).hasSize(5);
        }

        @Test
        void recordsFollowLayoutOrderOnEveryCall() {
            Map<String, Object> metrics = Map.of("return_on_equity", 0.3, "current_ratio", 3, "quick_ratio", 1.1);

            List<HealthRecord> first = evaluator.buildHealthRecords(metrics, layout, rules);
            List<HealthRecord> second = evaluator.buildHealthRecords(metrics, layout, rules);

            assertThat(first).extracting(HealthRecord::getMetric).containsExactly(
                "Return on Equity", "Net Profit Margin", "Current Ratio", "Quick Ratio", "Graham Number");
            assertThat(first).extracting(HealthRecord::getSection).containsExactly(
                "Profitability", "Profitability", "Liquidity", "Liquidity", "Cost Structure");
            assertThat(second).isEqualTo(first);
        }

        @Test
        void missingValuesAndRulesComeOutNeutral() {
            List<HealthRecord> records = evaluator.buildHealthRecords(
                Map.of("return_on_equity", 0.3, "current_ratio", 3, "quick_ratio", 1.1), layout, rules);

            assertThat(records).extracting(HealthRecord::getStatus).containsExactly(
                HealthStatus.HEALTHY,  // ROE 0.3 > 0.15
                HealthStatus.NEUTRAL,  // no value
                HealthStatus.WARNING,  // 3 outside 1.0–2.0
                HealthStatus.NEUTRAL,  // no rule
                HealthStatus.NEUTRAL); // custom, no value

            HealthRecord netMargin = records.get(1);
            assertThat(netMargin.getValue()).isEmpty();
            assertThat(netMargin.getBenchmark()).isEmpty();
            assertThat(netMargin.getInsight()).isEmpty();

            HealthRecord quickRatio = records.get(3);
            assertThat(quickRatio.getValue()).isEqualTo("1.1");
            assertThat(quickRatio.getBenchmark()).isEmpty();
        }

        @Test
        void nullBenchmarksActLikeNoRules() {
            assertThat(evaluator.buildHealthRecords(Map.of("current_ratio", 1.5), layout, null))
                .extracting(HealthRecord::getStatus)
                .containsOnly(HealthStatus.NEUTRAL);
        }

        @Test
        void nullMetricsOrLayoutIsRejected() {
            assertThatNullPointerException().isThrownBy(() -> evaluator.buildHealthRecords(null, layout, rules));
            assertThatNullPointerException().isThrownBy(() -> evaluator.buildHealthRecords(Map.of(), null, rules));
        }
    }

    @Test
    void valuesRenderAsPlainText() {
        assertThat(BenchmarkEvaluator.toText(5)).isEqualTo("5");
        assertThat(BenchmarkEvaluator.toText(1.5)).isEqualTo("1.5");
        assertThat(BenchmarkEvaluator.toText(new BigDecimal("1.50"))).isEqualTo("1.50");
        assertThat(BenchmarkEvaluator.toText(1.0E-5)).doesNotContain("E");
        assertThat(BenchmarkEvaluator.toText("12%")).isEqualTo("12%");
    }
}
