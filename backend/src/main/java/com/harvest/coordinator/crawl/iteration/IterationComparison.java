package com.harvest.coordinator.crawl.iteration;

import java.util.Set;

/**
 * Classification of every URI present in either of two iterations. The four sets are disjoint and
 * their union is the union of both iterations' URIs.
 */
public record IterationComparison(
    String lineageId,
    int baselineIteration,
    int currentIteration,
    Set<String> newUris,
    Set<String> modifiedUris,
    Set<String> unchangedUris,
    Set<String> deletedUris
) {
    public IterationComparison {
        newUris = Set.copyOf(newUris);
        modifiedUris = Set.copyOf(modifiedUris);
        unchangedUris = Set.copyOf(unchangedUris);
        deletedUris = Set.copyOf(deletedUris);
    }

    public ComparisonSummary summary() {
        return new ComparisonSummary(newUris.size(), modifiedUris.size(), unchangedUris.size(), deletedUris.size());
    }

    public ChangeType changeOf(String uri) {
        if (newUris.contains(uri)) {
            return ChangeType.NEW;
        }
        if (modifiedUris.contains(uri)) {
            return ChangeType.MODIFIED;
        }
        if (unchangedUris.contains(uri)) {
            return ChangeType.UNCHANGED;
        }
        if (deletedUris.contains(uri)) {
            return ChangeType.DELETED;
        }
        return null;
    }
}
