package com.harvest.coordinator.crawl.fetch;

import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record FetchOutcome(
    String uri,
    int statusCode,
    byte[] content,
    String contentType,
    String etag,
    String lastModified,
    String contentHash,
    List<String> links,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public FetchOutcome {
        links = links == null ? List.of() : List.copyOf(links);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static FetchOutcome error(String uri, String errorCode, String errorMessage, Duration duration) {
        return new FetchOutcome(uri, 0, null, null, null, null, null, List.of(), duration, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNotModified() {
        return statusCode == 304 && errorCode == null;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public long contentLength() {
        return content == null ? 0 : content.length;
    }

    public ResourceValidators validators() {
        return new ResourceValidators(etag, lastModified, contentHash);
    }

    public ResourceFingerprint toFingerprint(int iterationNumber, Instant recordedAt) {
        return new ResourceFingerprint(uri, iterationNumber, contentHash, etag, lastModified, contentLength(), recordedAt);
    }

    /** Short reason used in PAGE_FAILED events. */
    public String failureReason() {
        if (errorCode != null) {
            return errorCode;
        }
        return "http_" + statusCode;
    }
}
