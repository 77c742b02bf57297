package com.harvest.coordinator.crawl.iteration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NoBaselineException extends RuntimeException {
    public NoBaselineException(String lineageId) {
        super("No completed iteration exists for lineage " + lineageId + "; run a BASELINE first");
    }
}
