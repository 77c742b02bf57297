package com.harvest.coordinator.crawl.model;

/**
 * Outcome of a tripped job limit. Which action wins when several limits trip at once is decided by
 * the job's precedence list, falling back to {@code coordinator.limits.precedence}.
 */
public enum LimitAction {
    CANCEL,
    STOP,
    PAUSE,
    WARN
}
