package com.harvest.coordinator.crawl.state;

public record JobCounters(
    long urlsCrawled,
    long urlsFailed,
    long urlsSkipped,
    long documentsFound
) {
    public static JobCounters zero() {
        return new JobCounters(0, 0, 0, 0);
    }

    public long attempts() {
        return urlsCrawled + urlsFailed;
    }

    public double failureRate() {
        long attempts = attempts();
        return attempts == 0 ? 0.0 : (double) urlsFailed / attempts;
    }

    JobCounters plusCrawled(boolean skipped) {
        return new JobCounters(urlsCrawled + 1, urlsFailed, skipped ? urlsSkipped + 1 : urlsSkipped, documentsFound);
    }

    JobCounters plusFailed() {
        return new JobCounters(urlsCrawled, urlsFailed + 1, urlsSkipped, documentsFound);
    }

    JobCounters plusDocument() {
        return new JobCounters(urlsCrawled, urlsFailed, urlsSkipped, documentsFound + 1);
    }
}
