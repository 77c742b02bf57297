package com.harvest.coordinator.crawl.state;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {
    private final String jobId;
    private final CrawlState from;
    private final CrawlState to;

    public InvalidTransitionException(String jobId, CrawlState from, CrawlState to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(String jobId, CrawlState from, CrawlState to, String message) {
        super(message);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public CrawlState getFrom() {
        return from;
    }

    public CrawlState getTo() {
        return to;
    }
}
