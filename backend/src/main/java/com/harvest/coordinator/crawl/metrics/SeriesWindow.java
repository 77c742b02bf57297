package com.harvest.coordinator.crawl.metrics;

import java.time.Duration;

public enum SeriesWindow {
    FIVE_MINUTES("5m", Duration.ofMinutes(5), Duration.ofSeconds(10)),
    ONE_HOUR("1h", Duration.ofHours(1), Duration.ofMinutes(1)),
    ONE_DAY("24h", Duration.ofHours(24), Duration.ofMinutes(15));

    private final String label;
    private final Duration span;
    private final Duration bucket;

    SeriesWindow(String label, Duration span, Duration bucket) {
        this.label = label;
        this.span = span;
        this.bucket = bucket;
    }

    public String label() {
        return label;
    }

    public Duration span() {
        return span;
    }

    public Duration bucket() {
        return bucket;
    }

    public int bucketCount() {
        return (int) (span.getSeconds() / bucket.getSeconds());
    }

    public static SeriesWindow parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIVE_MINUTES;
        }
        for (SeriesWindow window : values()) {
            if (window.label.equalsIgnoreCase(raw.trim()) || window.name().equalsIgnoreCase(raw.trim())) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown series window: " + raw + " (expected 5m, 1h or 24h)");
    }
}
