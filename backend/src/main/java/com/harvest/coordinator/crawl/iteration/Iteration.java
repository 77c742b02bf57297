package com.harvest.coordinator.crawl.iteration;

import java.time.Instant;

/**
 * One execution pass over a lineage. Iteration 0 is the baseline; {@code parentIteration} is the
 * completed iteration this one is compared against, or {@code null} for a baseline.
 */
public record Iteration(
    String lineageId,
    int iterationNumber,
    String jobId,
    IterationMode mode,
    Integer parentIteration,
    Instant startedAt,
    Instant completedAt,
    ComparisonSummary summary
) {
    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isBaseline() {
        return parentIteration == null;
    }
}
