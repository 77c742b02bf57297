package com.harvest.coordinator.crawl.model;

/**
 * A URI waiting to be fetched. Seeds have depth 0 and no source.
 */
public record FrontierEntry(String uri, int depth, String sourceUri, boolean document) {

    public static FrontierEntry seed(String uri) {
        return new FrontierEntry(uri, 0, null, false);
    }
}
