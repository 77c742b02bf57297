package com.harvest.coordinator.crawl.fetch;

import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;

/**
 * Produces raw fetch outcomes for the coordinator. Implementations must be safe to call from many
 * threads at once.
 */
public interface FetchWorker {

    /**
     * Fetches one resource. Transport and HTTP errors should be reported through the outcome's error
     * fields; a thrown {@link FetchFailureException} is treated the same way.
     */
    FetchOutcome fetch(String uri, FetchContext context);

    /**
     * Returns the resource's current validators without downloading its body. Workers that cannot
     * probe return empty validators, which forces a fetch.
     */
    default ResourceValidators probe(String uri) {
        return ResourceValidators.none();
    }

    /** Robots rules for the origin ({@code scheme://host[:port]}) of a seed. */
    default RobotsRules robots(String origin) {
        return RobotsRules.allowAll();
    }
}
