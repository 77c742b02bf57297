package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.model.LimitAction;

/** A job limit that tripped, identified by {@code limit} so it fires only once per job. */
public record LimitBreach(String limit, LimitAction action, String reason) {
    public static final String MAX_PAGES = "max_pages";
    public static final String MAX_DOCUMENTS = "max_documents";
    public static final String MAX_DURATION = "max_duration";
    public static final String BUDGET_EXHAUSTED = "budget_exhausted";
    public static final String BUDGET_PAUSE = "budget_pause";
    public static final String BUDGET_WARN = "budget_warn";
}
