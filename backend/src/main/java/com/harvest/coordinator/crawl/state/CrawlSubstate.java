package com.harvest.coordinator.crawl.state;

import java.util.Arrays;
import java.util.List;

public enum CrawlSubstate {
    DISCOVERING_URLS(CrawlState.CRAWLING),
    DOWNLOADING_PAGES(CrawlState.CRAWLING),
    DOWNLOADING_DOCUMENTS(CrawlState.CRAWLING),
    PDF_EXTRACTION(CrawlState.EXTRACTING),
    OCR(CrawlState.EXTRACTING),
    TABLE_DETECTION(CrawlState.EXTRACTING),
    METADATA_EXTRACTION(CrawlState.PROCESSING),
    QUALITY_SCORING(CrawlState.PROCESSING),
    DEDUPLICATION(CrawlState.PROCESSING),
    CURATION(CrawlState.PROCESSING);

    private final CrawlState owner;

    CrawlSubstate(CrawlState owner) {
        this.owner = owner;
    }

    public CrawlState owner() {
        return owner;
    }

    public boolean belongsTo(CrawlState state) {
        return owner == state;
    }

    /** Substates of {@code state} in execution order; empty for states without substates. */
    public static List<CrawlSubstate> of(CrawlState state) {
        return Arrays.stream(values())
            .filter(substate -> substate.owner == state)
            .toList();
    }
}
