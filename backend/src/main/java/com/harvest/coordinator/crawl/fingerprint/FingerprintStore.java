package com.harvest.coordinator.crawl.fingerprint;

import com.harvest.coordinator.crawl.persistence.FingerprintRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the effective fingerprint set of an iteration: the fingerprints recorded in it plus the
 * carryovers that point back at the iteration holding an unchanged resource's fingerprint.
 */
@Service
public class FingerprintStore {
    private final FingerprintRepository repository;
    private final Clock clock;

    public FingerprintStore(FingerprintRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void record(String lineageId, ResourceFingerprint fingerprint) {
        repository.upsert(lineageId, fingerprint);
    }

    public void carryOver(String lineageId, int iteration, String uri, int sourceIteration) {
        repository.upsertCarryover(lineageId, iteration, uri, sourceIteration, clock.instant());
    }

    public Optional<ResourceFingerprint> effective(String lineageId, int iteration, String uri) {
        Optional<ResourceFingerprint> direct = repository.find(lineageId, iteration, uri);
        if (direct.isPresent()) {
            return direct;
        }
        return repository.findCarryoverSource(lineageId, iteration, uri)
            .flatMap(source -> repository.find(lineageId, source, uri));
    }

    /** URI to fingerprint; carried-over entries keep the iteration number of their source. */
    public Map<String, ResourceFingerprint> effectiveSet(String lineageId, int iteration) {
        Map<String, ResourceFingerprint> result = new LinkedHashMap<>();
        for (ResourceFingerprint fingerprint : repository.findByIteration(lineageId, iteration)) {
            result.put(fingerprint.uri(), fingerprint);
        }
        Map<Integer, Map<String, ResourceFingerprint>> sources = new HashMap<>();
        repository.findCarryovers(lineageId, iteration).forEach((uri, source) -> {
            if (result.containsKey(uri)) {
                return;
            }
            Map<String, ResourceFingerprint> sourceSet = sources.computeIfAbsent(source, n -> byUri(lineageId, n));
            ResourceFingerprint fingerprint = sourceSet.get(uri);
            if (fingerprint != null) {
                result.put(uri, fingerprint);
            }
        });
        return result;
    }

    public int countRecorded(String lineageId, int iteration) {
        return repository.countByIteration(lineageId, iteration);
    }

    private Map<String, ResourceFingerprint> byUri(String lineageId, int iteration) {
        Map<String, ResourceFingerprint> byUri = new HashMap<>();
        for (ResourceFingerprint fingerprint : repository.findByIteration(lineageId, iteration)) {
            byUri.put(fingerprint.uri(), fingerprint);
        }
        return byUri;
    }
}
