package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;

import java.time.Instant;

public record CheckpointRecord(
    String checkpointId,
    String jobId,
    int checkpointNumber,
    CheckpointType type,
    Instant createdAt,
    CrawlState state,
    CrawlSubstate substate,
    int payloadSize
) {
    public static String idFor(String jobId, int checkpointNumber) {
        return jobId + "_ckpt_" + checkpointNumber;
    }
}
