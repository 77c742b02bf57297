package com.harvest.coordinator.crawl.state;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a crawl job.
 *
 * <p>The main path is {@code QUEUED -> INITIALIZING -> CRAWLING -> EXTRACTING -> PROCESSING -> COMPLETED}.
 * {@code PAUSED}, {@code FAILED} and {@code CANCELLED} are reachable from every non-terminal state, and a
 * paused job returns to the working state it was paused in.
 */
public enum CrawlState {
    QUEUED,
    INITIALIZING,
    CRAWLING,
    EXTRACTING,
    PROCESSING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<CrawlState, Set<CrawlState>> EDGES = new EnumMap<>(CrawlState.class);

    static {
        EDGES.put(QUEUED, EnumSet.of(INITIALIZING, PAUSED, FAILED, CANCELLED));
        EDGES.put(INITIALIZING, EnumSet.of(CRAWLING, PAUSED, FAILED, CANCELLED));
        EDGES.put(CRAWLING, EnumSet.of(EXTRACTING, PAUSED, FAILED, CANCELLED));
        EDGES.put(EXTRACTING, EnumSet.of(PROCESSING, PAUSED, FAILED, CANCELLED));
        EDGES.put(PROCESSING, EnumSet.of(COMPLETED, PAUSED, FAILED, CANCELLED));
        EDGES.put(PAUSED, EnumSet.of(INITIALIZING, CRAWLING, EXTRACTING, PROCESSING, FAILED, CANCELLED));
        EDGES.put(COMPLETED, EnumSet.noneOf(CrawlState.class));
        EDGES.put(FAILED, EnumSet.noneOf(CrawlState.class));
        EDGES.put(CANCELLED, EnumSet.noneOf(CrawlState.class));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(CrawlState target) {
        return target != null && EDGES.get(this).contains(target);
    }

    public Set<CrawlState> successors() {
        return Collections.unmodifiableSet(EDGES.get(this));
    }
}
