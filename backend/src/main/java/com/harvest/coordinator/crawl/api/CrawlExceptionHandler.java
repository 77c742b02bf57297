package com.harvest.coordinator.crawl.api;

import com.harvest.coordinator.crawl.checkpoint.CheckpointCorruptException;
import com.harvest.coordinator.crawl.fetch.FetchFailureException;
import com.harvest.coordinator.crawl.iteration.NoBaselineException;
import com.harvest.coordinator.crawl.service.ActiveJobException;
import com.harvest.coordinator.crawl.service.JobNotFoundException;
import com.harvest.coordinator.crawl.state.InvalidTransitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class CrawlExceptionHandler {

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidTransitionException ex) {
        return body(HttpStatus.CONFLICT, "invalid_transition", ex.getMessage());
    }

    @ExceptionHandler(NoBaselineException.class)
    public ResponseEntity<Map<String, String>> handleNoBaseline(NoBaselineException ex) {
        return body(HttpStatus.CONFLICT, "no_baseline", ex.getMessage());
    }

    @ExceptionHandler(CheckpointCorruptException.class)
    public ResponseEntity<Map<String, String>> handleCorruptCheckpoint(CheckpointCorruptException ex) {
        return body(HttpStatus.CONFLICT, "checkpoint_corrupt", ex.getMessage());
    }

    @ExceptionHandler(ActiveJobException.class)
    public ResponseEntity<Map<String, String>> handleActiveJob(ActiveJobException ex) {
        return body(HttpStatus.CONFLICT, "active_job", ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
    }

    @ExceptionHandler(FetchFailureException.class)
    public ResponseEntity<Map<String, String>> handleFetchFailure(FetchFailureException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "fetch_failure", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
            .body(Map.of("error", error, "message", message == null ? "" : message));
    }
}
