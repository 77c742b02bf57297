package com.harvest.coordinator.crawl.metrics;

import java.time.Duration;
import java.time.Instant;

public record CompletionEstimate(
    String jobId,
    boolean known,
    long remainingPages,
    double pagesPerSecond,
    Duration remaining,
    Instant estimatedCompletion,
    String reason
) {
    public static CompletionEstimate unknown(String jobId, String reason) {
        return new CompletionEstimate(jobId, false, -1, 0.0, null, null, reason);
    }
}
