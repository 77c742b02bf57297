package com.harvest.coordinator.crawl.metrics;

import com.harvest.coordinator.crawl.events.CrawlEvent;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventPayload;
import com.harvest.coordinator.crawl.events.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives per-job metrics purely from bus events. It subscribes to every job asynchronously, so
 * values trail the producers by however long the dispatch queue takes to drain.
 */
@Service
public class MetricsAggregator {
    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final CrawlEventBus eventBus;
    private final Clock clock;
    private final Map<String, JobMetrics> jobs = new ConcurrentHashMap<>();
    private Subscription subscription;

    public MetricsAggregator(CrawlEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @PostConstruct
    void subscribe() {
        subscription = eventBus.subscribeAll(this::onEvent);
    }

    @PreDestroy
    void unsubscribe() {
        eventBus.unsubscribe(subscription);
    }

    void onEvent(CrawlEvent event) {
        JobMetrics metrics = jobs.computeIfAbsent(event.jobId(), JobMetrics::new);
        Instant at = event.timestamp();
        synchronized (metrics) {
            switch (event.kind()) {
                case CRAWL_START -> {
                    EventPayload.CrawlStarted started = event.payloadAs(EventPayload.CrawlStarted.class);
                    metrics.started(at, started.maxPages());
                }
                case URL_DISCOVERED -> metrics.increment(MetricName.URLS_DISCOVERED, 1, at);
                case PAGE_CRAWLED -> {
                    EventPayload.PageCrawled page = event.payloadAs(EventPayload.PageCrawled.class);
                    metrics.increment(MetricName.URLS_CRAWLED, 1, at);
                    metrics.increment(MetricName.BYTES_DOWNLOADED, page.bytes(), at);
                    metrics.refreshRates(at);
                }
                case PAGE_FAILED -> {
                    metrics.increment(MetricName.URLS_FAILED, 1, at);
                    metrics.refreshRates(at);
                }
                case DOCUMENT_FOUND -> metrics.increment(MetricName.DOCUMENTS_FOUND, 1, at);
                case DOCUMENT_DOWNLOADED -> {
                    EventPayload.DocumentDownloaded document = event.payloadAs(EventPayload.DocumentDownloaded.class);
                    metrics.increment(MetricName.DOCUMENTS_DOWNLOADED, 1, at);
                    metrics.increment(MetricName.BYTES_DOWNLOADED, document.bytes(), at);
                    metrics.refreshRates(at);
                }
                case EXTRACTION_COMPLETE -> metrics.extraction(
                    event.payloadAs(EventPayload.ExtractionCompleted.class).success(),
                    at
                );
                case QUALITY_ASSESSED -> metrics.quality(event.payloadAs(EventPayload.QualityAssessed.class).score(), at);
                case DUPLICATE_FOUND -> metrics.increment(MetricName.DUPLICATES_REMOVED, 1, at);
                case RATE_LIMIT_HIT -> metrics.increment(MetricName.RATE_LIMIT_HITS, 1, at);
                case ERROR, CRAWL_FAILED -> metrics.increment(MetricName.ERRORS, 1, at);
                case METRICS_UPDATE -> {
                    EventPayload.MetricsSample sample = event.payloadAs(EventPayload.MetricsSample.class);
                    metrics.gauge(MetricName.CPU_PERCENT, sample.cpuPercent(), at);
                    metrics.gauge(MetricName.MEMORY_MB, sample.memoryMb(), at);
                    metrics.gauge(MetricName.DISK_FREE_MB, sample.diskFreeMb(), at);
                    metrics.gauge(MetricName.THREAD_COUNT, sample.threadCount(), at);
                }
                default -> {
                    // lifecycle and state events carry nothing to aggregate
                }
            }
        }
    }

    public MetricsSnapshot snapshot(String jobId) {
        JobMetrics metrics = jobs.get(jobId);
        Instant now = clock.instant();
        if (metrics == null) {
            return MetricsSnapshot.empty(jobId, now);
        }
        synchronized (metrics) {
            return metrics.snapshot(now);
        }
    }

    public List<SeriesPoint> series(String jobId, MetricName name, SeriesWindow window) {
        JobMetrics metrics = jobs.get(jobId);
        Instant now = clock.instant();
        if (metrics == null) {
            return new RollingSeries(window).points(now, name.aggregation());
        }
        synchronized (metrics) {
            return metrics.series(name, window, now);
        }
    }

    /** Every metric's series for the window, keyed by metric key. */
    public Map<String, List<SeriesPoint>> series(String jobId, SeriesWindow window) {
        Map<String, List<SeriesPoint>> all = new LinkedHashMap<>();
        for (MetricName name : MetricName.values()) {
            all.put(name.key(), series(jobId, name, window));
        }
        return all;
    }

    /**
     * Extrapolates the time left from recent throughput and the job's page bound.
     */
    public CompletionEstimate estimateCompletion(String jobId) {
        JobMetrics metrics = jobs.get(jobId);
        if (metrics == null) {
            return CompletionEstimate.unknown(jobId, "no_metrics");
        }
        Instant now = clock.instant();
        synchronized (metrics) {
            if (metrics.maxPages() <= 0) {
                return CompletionEstimate.unknown(jobId, "unbounded");
            }
            double rate = metrics.pagesPerSecond(now);
            if (rate <= 0.0) {
                return CompletionEstimate.unknown(jobId, "no_throughput");
            }
            long remainingPages = Math.max(0, metrics.maxPages() - (long) metrics.total(MetricName.URLS_CRAWLED));
            Duration remaining = Duration.ofMillis((long) Math.ceil(remainingPages / rate * 1000.0));
            return new CompletionEstimate(jobId, true, remainingPages, rate, remaining, now.plus(remaining), null);
        }
    }

    public void forget(String jobId) {
        if (jobs.remove(jobId) != null) {
            log.debug("Dropped metrics for job {}", jobId);
        }
    }
}
