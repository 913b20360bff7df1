package com.jay.finsync.model;

/** A metric shown in a health section and the key its raw value is stored under. */
public record MetricRef(String metricName, String dataKey) {}
