package com.harvest.coordinator.crawl.fingerprint;

/**
 * Cheap-to-obtain change indicators of a resource. Any field may be {@code null}.
 */
public record ResourceValidators(String etag, String lastModified, String contentHash) {

    public static ResourceValidators none() {
        return new ResourceValidators(null, null, null);
    }

    public boolean isEmpty() {
        return isBlank(etag) && isBlank(lastModified) && isBlank(contentHash);
    }

    public boolean hasEtag() {
        return !isBlank(etag);
    }

    public boolean hasLastModified() {
        return !isBlank(lastModified);
    }

    public boolean hasContentHash() {
        return !isBlank(contentHash);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
