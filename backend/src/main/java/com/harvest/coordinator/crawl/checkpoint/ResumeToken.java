package com.harvest.coordinator.crawl.checkpoint;

import java.time.Instant;

/**
 * Proof that a checkpoint was decoded for resumption. The checkpoint cannot be pruned until the
 * token is released through {@link CheckpointManager#release(ResumeToken)}.
 */
public record ResumeToken(
    String jobId,
    String checkpointId,
    CheckpointType type,
    CheckpointPayload payload,
    Instant issuedAt
) {
}
