package com.harvest.coordinator.crawl.model;

import com.harvest.coordinator.crawl.state.JobStateSnapshot;

public record StoredJob(CrawlJob job, JobStateSnapshot state) {
}
