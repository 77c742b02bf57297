package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.crawl.model.FrontierEntry;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to continue a job: its lifecycle record and the frontier split into pending
 * work and finished URIs. In-flight URIs are captured as pending.
 */
public record CheckpointPayload(
    String jobId,
    String lineageId,
    int iterationNumber,
    JobStateSnapshot state,
    List<FrontierEntry> pending,
    List<FrontierEntry> pendingDocuments,
    List<String> completed,
    List<String> failed,
    Instant capturedAt
) {
    public CheckpointPayload {
        pending = pending == null ? List.of() : List.copyOf(pending);
        pendingDocuments = pendingDocuments == null ? List.of() : List.copyOf(pendingDocuments);
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }
}
