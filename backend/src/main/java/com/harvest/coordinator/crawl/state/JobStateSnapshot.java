package com.harvest.coordinator.crawl.state;

import java.time.Instant;
import java.util.List;

public record JobStateSnapshot(
    String jobId,
    CrawlState currentState,
    CrawlSubstate substate,
    String error,
    JobCounters counters,
    List<StateTransition> history,
    CrawlState pausedFrom,
    CrawlSubstate pausedSubstate,
    Instant startedAt,
    Instant pausedAt,
    Instant completedAt
) {
    public JobStateSnapshot {
        history = history == null ? List.of() : List.copyOf(history);
        counters = counters == null ? JobCounters.zero() : counters;
    }
}
