package com.harvest.coordinator.crawl.iteration;

public enum ChangeType {
    NEW,
    MODIFIED,
    UNCHANGED,
    DELETED
}
