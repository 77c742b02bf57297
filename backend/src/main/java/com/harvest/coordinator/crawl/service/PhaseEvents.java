package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;

import java.util.Map;

/** Processing-family events a {@link CrawlPhaseHandler} reports for one job. */
public final class PhaseEvents {
    private final CrawlEventBus eventBus;
    private final String jobId;

    public PhaseEvents(CrawlEventBus eventBus, String jobId) {
        this.eventBus = eventBus;
        this.jobId = jobId;
    }

    public void extractionCompleted(String uri, boolean success, int textLength) {
        eventBus.publish(jobId, EventKind.EXTRACTION_COMPLETE, new EventPayload.ExtractionCompleted(uri, success, textLength));
    }

    public void qualityAssessed(String uri, double score) {
        eventBus.publish(jobId, EventKind.QUALITY_ASSESSED, new EventPayload.QualityAssessed(uri, score));
    }

    public void metadataExtracted(String uri, Map<String, String> fields) {
        eventBus.publish(jobId, EventKind.METADATA_EXTRACTED, new EventPayload.MetadataExtracted(uri, Map.copyOf(fields)));
    }

    public void duplicateFound(String uri, String duplicateOf) {
        eventBus.publish(jobId, EventKind.DUPLICATE_FOUND, new EventPayload.DuplicateFound(uri, duplicateOf));
    }
}
