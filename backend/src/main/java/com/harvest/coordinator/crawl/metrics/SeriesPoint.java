package com.harvest.coordinator.crawl.metrics;

import java.time.Instant;

public record SeriesPoint(Instant bucketStart, double value, long samples) {
}
