package com.harvest.coordinator.crawl.checkpoint;

public enum CheckpointType {
    AUTO,
    MANUAL,
    PAUSE,
    ERROR
}
