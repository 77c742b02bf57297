package com.harvest.coordinator.crawl.state;

import java.time.Duration;
import java.time.Instant;

/**
 * One entry of a job's state history. The first entry of every history has a {@code null} source
 * state and records the job entering {@code QUEUED}. {@code duration} is the time spent in
 * {@code from}.
 */
public record StateTransition(
    CrawlState from,
    CrawlState to,
    Instant at,
    Duration duration
) {
}
