package com.jay.finsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered section → metric layout of the financial health report.
 * Iteration order is the order sections and metrics were added; instances are immutable.
 */
public final class SectionMetricMap {

    private final Map<String, List<MetricRef>> sections;

    private SectionMetricMap(Map<String, List<MetricRef>> sections) {
        this.sections = sections;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<MetricRef>> sections() {
        return sections;
    }

    public int metricCount() {
        return sections.values().stream().mapToInt(List::size).sum();
    }

    public static final class Builder {
        private final Map<String, List<MetricRef>> sections = new LinkedHashMap<>();

        public Builder metric(String section, String metricName, String dataKey) {
            sections.computeIfAbsent(section, s -> new ArrayList<>())
                .add(new MetricRef(metricName, dataKey));
            return this;
        }

        public SectionMetricMap build() {
            Map<String, List<MetricRef>> copy = new LinkedHashMap<>();
            sections.forEach((name, metrics) -> copy.put(name, List.copyOf(metrics)));
            return new SectionMetricMap(Collections.unmodifiableMap(copy));
        }
    }
}
