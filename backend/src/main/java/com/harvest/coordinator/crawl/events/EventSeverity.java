package com.harvest.coordinator.crawl.events;

public enum EventSeverity {
    INFO,
    WARNING,
    ERROR
}
