package com.harvest.coordinator.crawl.iteration;

public enum IterationMode {
    /** First pass of a lineage; fetches everything. */
    BASELINE,
    /** Fetches only resources whose validators differ from the parent iteration. */
    INCREMENTAL,
    /** Refetches everything but still compares against the parent iteration. */
    FULL
}
