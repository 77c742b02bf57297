package com.harvest.coordinator.crawl.fingerprint;

import java.time.Instant;
import java.util.Objects;

public record ResourceFingerprint(
    String uri,
    int iterationNumber,
    String contentHash,
    String etag,
    String lastModified,
    long contentLength,
    Instant recordedAt
) {
    public ResourceValidators validators() {
        return new ResourceValidators(etag, lastModified, contentHash);
    }

    /** Same content and validators, ignoring iteration and timestamps. */
    public boolean sameAs(ResourceFingerprint other) {
        return other != null
            && Objects.equals(contentHash, other.contentHash)
            && Objects.equals(etag, other.etag)
            && Objects.equals(lastModified, other.lastModified);
    }

    public ResourceFingerprint forIteration(int iteration) {
        return new ResourceFingerprint(uri, iteration, contentHash, etag, lastModified, contentLength, recordedAt);
    }
}
