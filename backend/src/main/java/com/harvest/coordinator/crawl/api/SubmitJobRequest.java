package com.harvest.coordinator.crawl.api;

import com.harvest.coordinator.crawl.model.CrawlJobConfig;

import java.util.List;

public record SubmitJobRequest(
    List<String> targets,
    String mode,
    CrawlJobConfig config
) {
}
