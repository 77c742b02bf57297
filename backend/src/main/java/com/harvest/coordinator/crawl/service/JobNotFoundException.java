package com.harvest.coordinator.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " does not exist");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
