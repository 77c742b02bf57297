package com.harvest.coordinator.crawl.model;

import com.harvest.coordinator.crawl.iteration.IterationMode;

import java.time.Instant;
import java.util.List;

/**
 * One logical crawl request. {@code lineageId} is the id of the first job of the lineage and groups
 * every iteration run against the same targets.
 */
public record CrawlJob(
    String jobId,
    String lineageId,
    String parentJobId,
    List<String> targets,
    CrawlJobConfig config,
    IterationMode mode,
    int iterationNumber,
    Instant createdAt
) {
    public CrawlJob {
        targets = targets == null ? List.of() : List.copyOf(targets);
        config = config == null ? CrawlJobConfig.defaults() : config;
    }

    public boolean isLineageRoot() {
        return jobId.equals(lineageId);
    }
}
