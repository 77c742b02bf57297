package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.crawl.state.CrawlState;

import java.time.Instant;
import java.util.Map;

public record CheckpointStatistics(
    String jobId,
    int total,
    Map<CheckpointType, Integer> byType,
    long totalBytes,
    String latestCheckpointId,
    CrawlState latestState,
    Instant latestAt
) {
}
