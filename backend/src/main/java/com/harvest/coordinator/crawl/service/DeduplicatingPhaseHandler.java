package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.fingerprint.FingerprintStore;
import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Default handler. Extraction lives outside the coordinator, so every substate but DEDUPLICATION
 * only passes through. Deduplication reports each completed URI whose content hash matches an
 * earlier completed URI of the same iteration.
 */
@Component
public class DeduplicatingPhaseHandler implements CrawlPhaseHandler {
    private static final Logger log = LoggerFactory.getLogger(DeduplicatingPhaseHandler.class);

    private final FingerprintStore fingerprints;

    public DeduplicatingPhaseHandler(FingerprintStore fingerprints) {
        this.fingerprints = fingerprints;
    }

    @Override
    public void handle(CrawlJob job, CrawlSubstate substate, List<String> completedUris, PhaseEvents events) {
        if (substate != CrawlSubstate.DEDUPLICATION) {
            log.debug("Job {} passed {} with {} completed URIs", job.jobId(), substate, completedUris.size());
            return;
        }
        Map<String, ResourceFingerprint> current = fingerprints.effectiveSet(job.lineageId(), job.iterationNumber());
        Map<String, String> firstByHash = new HashMap<>();
        int duplicates = 0;
        for (String uri : completedUris) {
            ResourceFingerprint fingerprint = current.get(uri);
            if (fingerprint == null || fingerprint.contentHash() == null) {
                continue;
            }
            String original = firstByHash.putIfAbsent(fingerprint.contentHash(), uri);
            if (original != null) {
                events.duplicateFound(uri, original);
                duplicates++;
            }
        }
        log.debug("Job {} deduplicated {} completed URIs, {} duplicates", job.jobId(), completedUris.size(), duplicates);
    }
}
