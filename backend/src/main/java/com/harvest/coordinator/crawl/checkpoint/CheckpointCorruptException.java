package com.harvest.coordinator.crawl.checkpoint;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CheckpointCorruptException extends RuntimeException {
    private final String checkpointId;

    public CheckpointCorruptException(String checkpointId, String message) {
        super("Checkpoint " + checkpointId + " is unusable: " + message);
        this.checkpointId = checkpointId;
    }

    public CheckpointCorruptException(String checkpointId, String message, Throwable cause) {
        super("Checkpoint " + checkpointId + " is unusable: " + message, cause);
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
