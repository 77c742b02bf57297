package com.harvest.coordinator.crawl.events;

import com.harvest.coordinator.crawl.events.EventPayload.CrawlCancelled;
import com.harvest.coordinator.crawl.events.EventPayload.CrawlCompleted;
import com.harvest.coordinator.crawl.events.EventPayload.CrawlFailed;
import com.harvest.coordinator.crawl.events.EventPayload.CrawlPaused;
import com.harvest.coordinator.crawl.events.EventPayload.CrawlResumed;
import com.harvest.coordinator.crawl.events.EventPayload.CrawlStarted;
import com.harvest.coordinator.crawl.events.EventPayload.DocumentDownloaded;
import com.harvest.coordinator.crawl.events.EventPayload.DocumentFound;
import com.harvest.coordinator.crawl.events.EventPayload.DuplicateFound;
import com.harvest.coordinator.crawl.events.EventPayload.ExtractionCompleted;
import com.harvest.coordinator.crawl.events.EventPayload.Message;
import com.harvest.coordinator.crawl.events.EventPayload.MetadataExtracted;
import com.harvest.coordinator.crawl.events.EventPayload.MetricsSample;
import com.harvest.coordinator.crawl.events.EventPayload.PageCrawled;
import com.harvest.coordinator.crawl.events.EventPayload.PageFailed;
import com.harvest.coordinator.crawl.events.EventPayload.ProgressUpdated;
import com.harvest.coordinator.crawl.events.EventPayload.QualityAssessed;
import com.harvest.coordinator.crawl.events.EventPayload.RateLimitHit;
import com.harvest.coordinator.crawl.events.EventPayload.RobotsChecked;
import com.harvest.coordinator.crawl.events.EventPayload.StateChanged;
import com.harvest.coordinator.crawl.events.EventPayload.SubstateChanged;
import com.harvest.coordinator.crawl.events.EventPayload.UrlDiscovered;

/**
 * Every event kind with its family, default severity and the payload shape it carries.
 */
public enum EventKind {
    CRAWL_START(EventFamily.LIFECYCLE, EventSeverity.INFO, CrawlStarted.class),
    CRAWL_COMPLETE(EventFamily.LIFECYCLE, EventSeverity.INFO, CrawlCompleted.class),
    CRAWL_PAUSED(EventFamily.LIFECYCLE, EventSeverity.INFO, CrawlPaused.class),
    CRAWL_RESUMED(EventFamily.LIFECYCLE, EventSeverity.INFO, CrawlResumed.class),
    CRAWL_CANCELLED(EventFamily.LIFECYCLE, EventSeverity.WARNING, CrawlCancelled.class),
    CRAWL_FAILED(EventFamily.LIFECYCLE, EventSeverity.ERROR, CrawlFailed.class),

    STATE_CHANGE(EventFamily.STATE, EventSeverity.INFO, StateChanged.class),
    SUBSTATE_CHANGE(EventFamily.STATE, EventSeverity.INFO, SubstateChanged.class),
    PROGRESS_UPDATE(EventFamily.STATE, EventSeverity.INFO, ProgressUpdated.class),

    URL_DISCOVERED(EventFamily.DISCOVERY, EventSeverity.INFO, UrlDiscovered.class),
    PAGE_CRAWLED(EventFamily.DISCOVERY, EventSeverity.INFO, PageCrawled.class),
    PAGE_FAILED(EventFamily.DISCOVERY, EventSeverity.WARNING, PageFailed.class),
    DOCUMENT_FOUND(EventFamily.DISCOVERY, EventSeverity.INFO, DocumentFound.class),
    DOCUMENT_DOWNLOADED(EventFamily.DISCOVERY, EventSeverity.INFO, DocumentDownloaded.class),

    EXTRACTION_COMPLETE(EventFamily.PROCESSING, EventSeverity.INFO, ExtractionCompleted.class),
    QUALITY_ASSESSED(EventFamily.PROCESSING, EventSeverity.INFO, QualityAssessed.class),
    METADATA_EXTRACTED(EventFamily.PROCESSING, EventSeverity.INFO, MetadataExtracted.class),
    DUPLICATE_FOUND(EventFamily.PROCESSING, EventSeverity.INFO, DuplicateFound.class),

    ERROR(EventFamily.DIAGNOSTIC, EventSeverity.ERROR, Message.class),
    WARNING(EventFamily.DIAGNOSTIC, EventSeverity.WARNING, Message.class),
    INFO(EventFamily.DIAGNOSTIC, EventSeverity.INFO, Message.class),
    DEBUG(EventFamily.DIAGNOSTIC, EventSeverity.INFO, Message.class),
    METRICS_UPDATE(EventFamily.DIAGNOSTIC, EventSeverity.INFO, MetricsSample.class),
    ROBOTS_TXT_CHECKED(EventFamily.DIAGNOSTIC, EventSeverity.INFO, RobotsChecked.class),
    RATE_LIMIT_HIT(EventFamily.DIAGNOSTIC, EventSeverity.WARNING, RateLimitHit.class);

    private final EventFamily family;
    private final EventSeverity defaultSeverity;
    private final Class<? extends EventPayload> payloadType;

    EventKind(EventFamily family, EventSeverity defaultSeverity, Class<? extends EventPayload> payloadType) {
        this.family = family;
        this.defaultSeverity = defaultSeverity;
        this.payloadType = payloadType;
    }

    public EventFamily family() {
        return family;
    }

    public EventSeverity defaultSeverity() {
        return defaultSeverity;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public boolean accepts(EventPayload payload) {
        return payloadType.isInstance(payload);
    }
}
