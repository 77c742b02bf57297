package com.harvest.coordinator.crawl.metrics;

public enum MetricName {
    URLS_DISCOVERED("urls_discovered", Aggregation.SUM),
    URLS_CRAWLED("urls_crawled", Aggregation.SUM),
    URLS_FAILED("urls_failed", Aggregation.SUM),
    PAGES_PER_SECOND("pages_per_second", Aggregation.AVERAGE),
    SUCCESS_RATE("success_rate", Aggregation.AVERAGE),
    DOCUMENTS_FOUND("documents_found", Aggregation.SUM),
    DOCUMENTS_DOWNLOADED("documents_downloaded", Aggregation.SUM),
    BYTES_DOWNLOADED("bytes_downloaded", Aggregation.SUM),
    DOWNLOAD_THROUGHPUT("download_throughput", Aggregation.AVERAGE),
    EXTRACTION_SUCCESS_RATE("extraction_success_rate", Aggregation.AVERAGE),
    AVERAGE_QUALITY("average_quality", Aggregation.AVERAGE),
    DUPLICATES_REMOVED("duplicates_removed", Aggregation.SUM),
    RATE_LIMIT_HITS("rate_limit_hits", Aggregation.SUM),
    ERRORS("errors", Aggregation.SUM),
    CPU_PERCENT("cpu_percent", Aggregation.AVERAGE),
    MEMORY_MB("memory_mb", Aggregation.AVERAGE),
    DISK_FREE_MB("disk_free_mb", Aggregation.AVERAGE),
    THREAD_COUNT("thread_count", Aggregation.AVERAGE);

    private final String key;
    private final Aggregation aggregation;

    MetricName(String key, Aggregation aggregation) {
        this.key = key;
        this.aggregation = aggregation;
    }

    public String key() {
        return key;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    public static MetricName fromKey(String key) {
        for (MetricName name : values()) {
            if (name.key.equalsIgnoreCase(key) || name.name().equalsIgnoreCase(key)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + key);
    }
}
