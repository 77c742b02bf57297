package com.harvest.coordinator.crawl.fingerprint;

import com.harvest.coordinator.crawl.iteration.ChangeType;

/**
 * Compares a resource's current validators against its previous fingerprint, cheapest signal first:
 * ETag, then Last-Modified, then content hash. The first signal present on both sides decides.
 */
public final class ChangeDetector {

    public static final String BASIS_NO_PRIOR = "no_prior";
    public static final String BASIS_ETAG = "etag";
    public static final String BASIS_LAST_MODIFIED = "last_modified";
    public static final String BASIS_CONTENT_HASH = "content_hash";
    public static final String BASIS_NONE = "none";

    private ChangeDetector() {
    }

    public record Verdict(ChangeType change, String basis) {
        /** True when a fetch is needed to know whether the resource changed. */
        public boolean undecided() {
            return BASIS_NONE.equals(basis);
        }
    }

    public static Verdict compare(ResourceFingerprint previous, ResourceValidators current) {
        if (previous == null) {
            return new Verdict(ChangeType.NEW, BASIS_NO_PRIOR);
        }
        ResourceValidators before = previous.validators();
        ResourceValidators now = current == null ? ResourceValidators.none() : current;
        if (before.hasEtag() && now.hasEtag()) {
            return new Verdict(sameOrModified(before.etag(), now.etag()), BASIS_ETAG);
        }
        if (before.hasLastModified() && now.hasLastModified()) {
            return new Verdict(sameOrModified(before.lastModified().trim(), now.lastModified().trim()), BASIS_LAST_MODIFIED);
        }
        if (before.hasContentHash() && now.hasContentHash()) {
            return new Verdict(sameOrModified(before.contentHash(), now.contentHash()), BASIS_CONTENT_HASH);
        }
        return new Verdict(ChangeType.MODIFIED, BASIS_NONE);
    }

    /** Classification used by iteration comparisons, where both sides carry a content hash. */
    public static ChangeType compareContent(ResourceFingerprint previous, ResourceFingerprint current) {
        if (previous == null) {
            return ChangeType.NEW;
        }
        if (current == null) {
            return ChangeType.DELETED;
        }
        if (previous.contentHash() != null && current.contentHash() != null) {
            return sameOrModified(previous.contentHash(), current.contentHash());
        }
        return compare(previous, current.validators()).change();
    }

    private static ChangeType sameOrModified(String before, String after) {
        return before.equals(after) ? ChangeType.UNCHANGED : ChangeType.MODIFIED;
    }
}
