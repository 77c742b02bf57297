package com.harvest.coordinator.crawl.checkpoint;

public record StoredCheckpoint(CheckpointRecord record, byte[] payload, String payloadSha256) {
}
