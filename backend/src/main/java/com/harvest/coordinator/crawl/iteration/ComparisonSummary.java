package com.harvest.coordinator.crawl.iteration;

public record ComparisonSummary(int newCount, int modifiedCount, int unchangedCount, int deletedCount) {

    public static ComparisonSummary empty() {
        return new ComparisonSummary(0, 0, 0, 0);
    }

    public int total() {
        return newCount + modifiedCount + unchangedCount + deletedCount;
    }

    public int changed() {
        return newCount + modifiedCount + deletedCount;
    }
}
