package com.harvest.coordinator.crawl.checkpoint;

import java.util.Optional;

/**
 * Supplies a consistent snapshot of a live job. Empty when the job is not running in this process.
 */
public interface CheckpointSource {

    Optional<CheckpointPayload> capture(String jobId);
}
