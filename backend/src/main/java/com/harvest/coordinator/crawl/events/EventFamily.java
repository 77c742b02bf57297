package com.harvest.coordinator.crawl.events;

public enum EventFamily {
    LIFECYCLE,
    STATE,
    DISCOVERY,
    PROCESSING,
    DIAGNOSTIC
}
