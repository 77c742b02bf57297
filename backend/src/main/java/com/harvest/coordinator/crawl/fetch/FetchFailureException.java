package com.harvest.coordinator.crawl.fetch;

public class FetchFailureException extends RuntimeException {
    private final String uri;

    public FetchFailureException(String uri, String message) {
        super(message);
        this.uri = uri;
    }

    public FetchFailureException(String uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
