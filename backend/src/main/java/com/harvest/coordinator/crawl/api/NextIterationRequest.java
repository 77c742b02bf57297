package com.harvest.coordinator.crawl.api;

public record NextIterationRequest(String mode) {
}
