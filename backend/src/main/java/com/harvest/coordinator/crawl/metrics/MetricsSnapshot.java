package com.harvest.coordinator.crawl.metrics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time values of every metric, keyed by {@link MetricName#key()}.
 */
public record MetricsSnapshot(String jobId, Instant capturedAt, Map<String, Double> values) {

    public static MetricsSnapshot empty(String jobId, Instant at) {
        Map<String, Double> zeros = new LinkedHashMap<>();
        for (MetricName name : MetricName.values()) {
            zeros.put(name.key(), 0.0);
        }
        return new MetricsSnapshot(jobId, at, zeros);
    }

    public double value(MetricName name) {
        Double value = values.get(name.key());
        return value == null ? 0.0 : value;
    }
}
