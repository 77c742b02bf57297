package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.checkpoint.CheckpointPayload;
import com.harvest.coordinator.crawl.checkpoint.CheckpointSource;
import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs live in this process, keyed by job id.
 *
 * <p>Capturing a checkpoint holds the job lock so counters and frontier are read between two
 * outcomes, never across one. The lock is reentrant and every transition already holds it, so a
 * {@code STATE_CHANGE} handler running inside a transition can capture too.
 */
@Component
public class JobRegistry implements CheckpointSource {
    private final Map<String, JobContext> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobRegistry(Clock clock) {
        this.clock = clock;
    }

    /** @return the registered context, which is an earlier one if the id was already taken */
    public JobContext register(JobContext context) {
        JobContext existing = jobs.putIfAbsent(context.jobId(), context);
        return existing == null ? context : existing;
    }

    public Optional<JobContext> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public JobContext require(String jobId) {
        JobContext context = jobs.get(jobId);
        if (context == null) {
            throw new JobNotFoundException(jobId);
        }
        return context;
    }

    public void remove(String jobId) {
        jobs.remove(jobId);
    }

    public List<JobContext> all() {
        return List.copyOf(jobs.values());
    }

    public List<String> activeJobIds() {
        return jobs.values().stream()
            .filter(context -> !context.machine().isTerminal())
            .map(JobContext::jobId)
            .sorted()
            .toList();
    }

    @Override
    public Optional<CheckpointPayload> capture(String jobId) {
        JobContext context = jobs.get(jobId);
        if (context == null) {
            return Optional.empty();
        }
        CrawlJob job = context.job();
        JobStateSnapshot state;
        Frontier.Snapshot frontier;
        context.lock().lock();
        try {
            state = context.machine().snapshot();
            frontier = context.frontier().snapshot();
        } finally {
            context.lock().unlock();
        }
        return Optional.of(new CheckpointPayload(
            job.jobId(),
            job.lineageId(),
            job.iterationNumber(),
            state,
            frontier.pending(),
            frontier.pendingDocuments(),
            frontier.completed(),
            frontier.failed(),
            clock.instant()
        ));
    }
}
