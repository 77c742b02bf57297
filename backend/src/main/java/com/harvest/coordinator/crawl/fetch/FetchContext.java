package com.harvest.coordinator.crawl.fetch;

import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import com.harvest.coordinator.crawl.iteration.IterationMode;

/**
 * Iteration context handed to a worker with each fetch. {@code previous} holds the parent
 * iteration's validators so the worker can issue a conditional request; it is empty for a baseline.
 */
public record FetchContext(
    String jobId,
    int iterationNumber,
    IterationMode mode,
    ResourceValidators previous,
    boolean document
) {
    public FetchContext {
        previous = previous == null ? ResourceValidators.none() : previous;
    }
}
