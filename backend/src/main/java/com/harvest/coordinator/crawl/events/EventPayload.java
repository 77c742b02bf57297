package com.harvest.coordinator.crawl.events;

import com.harvest.coordinator.crawl.iteration.ChangeType;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Kind-specific event body. Each {@link EventKind} accepts exactly one of these shapes.
 */
public sealed interface EventPayload {

    record CrawlStarted(List<String> targets, IterationMode mode, int iterationNumber, long maxPages)
        implements EventPayload {
    }

    record CrawlCompleted(long urlsCrawled, long urlsFailed, long documentsFound, Duration elapsed)
        implements EventPayload {
    }

    record CrawlPaused(CrawlState pausedFrom, String reason) implements EventPayload {
    }

    record CrawlResumed(CrawlState resumedInto, String checkpointId, int pendingUris) implements EventPayload {
    }

    record CrawlCancelled(CrawlState cancelledFrom, String reason) implements EventPayload {
    }

    record CrawlFailed(CrawlState failedFrom, String error) implements EventPayload {
    }

    record StateChanged(CrawlState from, CrawlState to, Duration timeInPreviousState) implements EventPayload {
    }

    record SubstateChanged(CrawlState state, CrawlSubstate from, CrawlSubstate to) implements EventPayload {
    }

    record ProgressUpdated(long completed, long total, double percent) implements EventPayload {
    }

    record UrlDiscovered(String uri, String sourceUri, int depth) implements EventPayload {
    }

    record PageCrawled(String uri, int statusCode, long bytes, long durationMs, ChangeType change, boolean fetched)
        implements EventPayload {
    }

    record PageFailed(String uri, String reason, int statusCode) implements EventPayload {
    }

    record DocumentFound(String uri, String sourceUri, String documentType) implements EventPayload {
    }

    record DocumentDownloaded(String uri, long bytes, long durationMs) implements EventPayload {
    }

    record ExtractionCompleted(String uri, boolean success, int textLength) implements EventPayload {
    }

    record QualityAssessed(String uri, double score) implements EventPayload {
    }

    record MetadataExtracted(String uri, Map<String, String> fields) implements EventPayload {
    }

    record DuplicateFound(String uri, String duplicateOf) implements EventPayload {
    }

    record Message(String message, String detail) implements EventPayload {
    }

    record MetricsSample(double cpuPercent, double memoryMb, double diskFreeMb, int threadCount)
        implements EventPayload {
    }

    record RobotsChecked(String host, boolean fetched, int disallowedSeeds) implements EventPayload {
    }

    record RateLimitHit(String uri, int statusCode) implements EventPayload {
    }
}
