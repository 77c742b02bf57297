package com.harvest.coordinator.crawl.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running totals, gauges and rolling series of one job. Not thread-safe on its own; the aggregator
 * guards every instance with its monitor.
 */
class JobMetrics {
    private final String jobId;
    private final Map<MetricName, Double> totals = new EnumMap<>(MetricName.class);
    private final Map<MetricName, Double> gauges = new EnumMap<>(MetricName.class);
    private final Map<MetricName, Map<SeriesWindow, RollingSeries>> series = new EnumMap<>(MetricName.class);
    private Instant startedAt;
    private long maxPages;
    private long extractionAttempts;
    private long extractionSuccesses;
    private double qualitySum;
    private long qualityCount;

    JobMetrics(String jobId) {
        this.jobId = jobId;
        for (MetricName name : MetricName.values()) {
            Map<SeriesWindow, RollingSeries> windows = new EnumMap<>(SeriesWindow.class);
            for (SeriesWindow window : SeriesWindow.values()) {
                windows.put(window, new RollingSeries(window));
            }
            series.put(name, windows);
        }
    }

    void started(Instant at, long targetPages) {
        if (startedAt == null) {
            startedAt = at;
        }
        maxPages = Math.max(0, targetPages);
    }

    Instant startedAt() {
        return startedAt;
    }

    long maxPages() {
        return maxPages;
    }

    void increment(MetricName name, double amount, Instant at) {
        if (startedAt == null) {
            startedAt = at;
        }
        totals.merge(name, amount, Double::sum);
        record(name, amount, at);
    }

    void gauge(MetricName name, double value, Instant at) {
        gauges.put(name, value);
        record(name, value, at);
    }

    void extraction(boolean success, Instant at) {
        extractionAttempts++;
        if (success) {
            extractionSuccesses++;
        }
        gauge(MetricName.EXTRACTION_SUCCESS_RATE, (double) extractionSuccesses / extractionAttempts, at);
    }

    void quality(double score, Instant at) {
        qualitySum += score;
        qualityCount++;
        gauge(MetricName.AVERAGE_QUALITY, qualitySum / qualityCount, at);
    }

    /** Recomputes the throughput gauges after a page outcome. */
    void refreshRates(Instant at) {
        gauge(MetricName.PAGES_PER_SECOND, pagesPerSecond(at), at);
        gauge(MetricName.DOWNLOAD_THROUGHPUT, recentRate(MetricName.BYTES_DOWNLOADED, at), at);
        double crawled = total(MetricName.URLS_CRAWLED);
        double attempts = crawled + total(MetricName.URLS_FAILED);
        gauge(MetricName.SUCCESS_RATE, attempts == 0 ? 0.0 : crawled / attempts, at);
    }

    double total(MetricName name) {
        Double value = totals.get(name);
        return value == null ? 0.0 : value;
    }

    /** Pages per second over the last five minutes, or since start if the job is younger. */
    double pagesPerSecond(Instant now) {
        return recentRate(MetricName.URLS_CRAWLED, now);
    }

    MetricsSnapshot snapshot(Instant now) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (MetricName name : MetricName.values()) {
            double value;
            if (name == MetricName.PAGES_PER_SECOND) {
                value = pagesPerSecond(now);
            } else if (name == MetricName.DOWNLOAD_THROUGHPUT) {
                value = recentRate(MetricName.BYTES_DOWNLOADED, now);
            } else if (name.aggregation() == Aggregation.SUM) {
                value = total(name);
            } else {
                Double gauge = gauges.get(name);
                value = gauge == null ? 0.0 : gauge;
            }
            values.put(name.key(), value);
        }
        return new MetricsSnapshot(jobId, now, values);
    }

    List<SeriesPoint> series(MetricName name, SeriesWindow window, Instant now) {
        return series.get(name).get(window).points(now, name.aggregation());
    }

    private double recentRate(MetricName counter, Instant now) {
        if (startedAt == null) {
            return 0.0;
        }
        long windowSeconds = SeriesWindow.FIVE_MINUTES.span().getSeconds();
        long elapsed = Math.max(1, Duration.between(startedAt, now).getSeconds());
        double recent = series.get(counter).get(SeriesWindow.FIVE_MINUTES).total(now);
        return recent / Math.min(windowSeconds, elapsed);
    }

    private void record(MetricName name, double value, Instant at) {
        for (RollingSeries rolling : series.get(name).values()) {
            rolling.add(at, value);
        }
    }
}
