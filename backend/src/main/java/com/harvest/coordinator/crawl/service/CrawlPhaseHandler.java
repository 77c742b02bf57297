package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.state.CrawlSubstate;

import java.util.List;

/**
 * Work done in the extraction and processing substates. A thrown exception fails the job.
 */
public interface CrawlPhaseHandler {

    /**
     * @param completedUris URIs fetched successfully so far, in completion order
     * @param events sink for the processing events of this job
     */
    void handle(CrawlJob job, CrawlSubstate substate, List<String> completedUris, PhaseEvents events);
}
