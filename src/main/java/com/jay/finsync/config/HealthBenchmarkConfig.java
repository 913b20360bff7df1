package com.jay.finsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.finsync.model.BenchmarkRule;
import com.jay.finsync.model.SectionMetricMap;
import com.jay.finsync.model.enums.BenchmarkOperator;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the financial health benchmark table and section layout from financial-health.yaml.
 * Read once at startup into immutable structures shared by every health evaluation.
 *
 * Unlike config.yaml there are no defaults to fall back on: a missing or malformed file
 * (including an unknown operator) stops the application from starting.
 */
@Slf4j
@Component
public class HealthBenchmarkConfig {

    private final String healthFile;

    private Map<String, BenchmarkRule> benchmarks = Map.of();
    private SectionMetricMap sections = SectionMetricMap.builder().build();

    public HealthBenchmarkConfig(@Value("${finsync.health-file:financial-health.yaml}") String healthFile) {
        this.healthFile = healthFile;
    }

    @PostConstruct
    public void load() {
        InputStream is = getClass().getClassLoader().getResourceAsStream(healthFile);
        if (is == null) {
            throw new IllegalStateException("Health benchmark file '" + healthFile + "' not found on classpath");
        }
        try (is) {
            HealthFile file = new ObjectMapper(new YAMLFactory()).readValue(is, HealthFile.class);
            this.benchmarks = toRules(file.getBenchmarks());
            this.sections = toSections(file.getSections());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read health benchmark file '" + healthFile + "'", e);
        }
        log.info("Loaded {} benchmark rules and {} metrics in {} sections from '{}'",
            benchmarks.size(), sections.metricCount(), sections.sections().size(), healthFile);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Map<String, BenchmarkRule> benchmarks() { return benchmarks; }
    public SectionMetricMap sections()             { return sections; }

    // ── Conversion ────────────────────────────────────────────────────────────

    static Map<String, BenchmarkRule> toRules(List<RuleEntry> entries) {
        Map<String, BenchmarkRule> rules = new LinkedHashMap<>();
        for (RuleEntry entry : entries) {
            if (entry.getMetric() == null || entry.getOperator() == null) {
                throw new IllegalStateException("Benchmark entry needs both 'metric' and 'operator': " + entry);
            }
            BenchmarkRule rule = new BenchmarkRule(entry.getMetric(), entry.getOperator(),
                entry.getThreshold(), entry.getLow(), entry.getHigh(), entry.getUnit(), entry.getInsight());
            if (!rule.isEvaluable()) {
                log.warn("Benchmark '{}' ({}) is missing its numbers and will always evaluate neutral",
                    rule.metricName(), rule.operator());
            }
            // First definition wins
            if (rules.putIfAbsent(rule.metricName(), rule) != null) {
                log.warn("Duplicate benchmark for '{}' ignored", rule.metricName());
            }
        }
        return Collections.unmodifiableMap(rules);
    }

    static SectionMetricMap toSections(List<SectionEntry> entries) {
        SectionMetricMap.Builder builder = SectionMetricMap.builder();
        Set<String> seen = new HashSet<>();
        for (SectionEntry section : entries) {
            for (MetricEntry metric : section.getMetrics()) {
                // (section, metric) is the stored row's key
                if (!seen.add(section.getName() + "|" + metric.getMetric())) {
                    throw new IllegalStateException("Metric '" + metric.getMetric()
                        + "' is listed twice in section '" + section.getName() + "'");
                }
                builder.metric(section.getName(), metric.getMetric(), metric.getKey());
            }
        }
        return builder.build();
    }

    // ── File POJOs ────────────────────────────────────────────────────────────

    @Data public static class HealthFile {
        private List<RuleEntry> benchmarks = new ArrayList<>();
        private List<SectionEntry> sections = new ArrayList<>();
    }

    @Data public static class RuleEntry {
        private String metric;
        private BenchmarkOperator operator;
        private BigDecimal threshold;
        private BigDecimal low;
        private BigDecimal high;
        private String unit = "";
        private String insight = "";
    }

    @Data public static class SectionEntry {
        private String name;
        private List<MetricEntry> metrics = new ArrayList<>();
    }

    @Data public static class MetricEntry {
        private String metric;
        private String key;
    }
}
