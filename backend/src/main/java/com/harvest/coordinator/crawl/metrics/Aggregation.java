package com.harvest.coordinator.crawl.metrics;

/** How samples falling into one series bucket are combined. */
public enum Aggregation {
    SUM,
    AVERAGE
}
