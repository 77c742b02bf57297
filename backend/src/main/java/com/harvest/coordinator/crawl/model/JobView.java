package com.harvest.coordinator.crawl.model;

import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import com.harvest.coordinator.crawl.state.JobCounters;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;
import com.harvest.coordinator.crawl.state.StateTransition;

import java.time.Instant;
import java.util.List;

public record JobView(
    String jobId,
    String lineageId,
    String parentJobId,
    List<String> targets,
    IterationMode mode,
    int iterationNumber,
    CrawlState state,
    CrawlSubstate substate,
    String error,
    JobCounters counters,
    List<StateTransition> history,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    boolean live
) {
    public static JobView of(CrawlJob job, JobStateSnapshot state, boolean live) {
        return new JobView(
            job.jobId(),
            job.lineageId(),
            job.parentJobId(),
            job.targets(),
            job.mode(),
            job.iterationNumber(),
            state.currentState(),
            state.substate(),
            state.error(),
            state.counters(),
            state.history(),
            job.createdAt(),
            state.startedAt(),
            state.completedAt(),
            live
        );
    }
}
