package com.harvest.coordinator.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable crawl parameters of a job. Zero means unbounded for the numeric limits; {@code null}
 * thresholds fall back to the coordinator defaults.
 */
public record CrawlJobConfig(
    int maxPages,
    int maxDocuments,
    int maxDurationMinutes,
    int maxDepth,
    int concurrency,
    Double failureRateThreshold,
    Integer checkpointIntervalPages,
    boolean pauseAtLimit,
    boolean respectRobotsTxt,
    boolean followDocuments,
    BudgetConfig budget,
    List<LimitAction> limitPrecedence,
    Map<String, String> labels
) {
    public CrawlJobConfig {
        maxPages = Math.max(0, maxPages);
        maxDocuments = Math.max(0, maxDocuments);
        maxDurationMinutes = Math.max(0, maxDurationMinutes);
        maxDepth = Math.max(0, maxDepth);
        concurrency = Math.max(0, concurrency);
        budget = budget == null ? BudgetConfig.unlimited() : budget;
        limitPrecedence = limitPrecedence == null ? List.of() : List.copyOf(limitPrecedence);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public static CrawlJobConfig defaults() {
        return new CrawlJobConfig(0, 0, 0, 0, 0, null, null, false, false, true, null, null, null);
    }

    public CrawlJobConfig withMaxPages(int pages) {
        return new CrawlJobConfig(
            pages,
            maxDocuments,
            maxDurationMinutes,
            maxDepth,
            concurrency,
            failureRateThreshold,
            checkpointIntervalPages,
            pauseAtLimit,
            respectRobotsTxt,
            followDocuments,
            budget,
            limitPrecedence,
            labels
        );
    }

    public boolean hasPageBound() {
        return maxPages > 0;
    }
}
