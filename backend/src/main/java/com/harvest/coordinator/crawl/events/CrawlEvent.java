package com.harvest.coordinator.crawl.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one notable occurrence in a job. {@code sequence} is assigned by the bus and
 * increases by one per published event of the same job.
 */
public record CrawlEvent(
    String eventId,
    String jobId,
    long sequence,
    EventKind kind,
    EventSeverity severity,
    Instant timestamp,
    EventPayload payload
) {
    public CrawlEvent {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (!kind.accepts(payload)) {
            throw new IllegalArgumentException(
                kind + " expects " + kind.payloadType().getSimpleName()
                    + " but got " + payload.getClass().getSimpleName()
            );
        }
        severity = severity == null ? kind.defaultSeverity() : severity;
    }

    public EventFamily family() {
        return kind.family();
    }

    public <T extends EventPayload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
