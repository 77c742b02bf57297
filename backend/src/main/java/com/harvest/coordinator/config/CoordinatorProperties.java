package com.harvest.coordinator.config;

import com.harvest.coordinator.crawl.model.LimitAction;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorProperties {
    private static final String DEFAULT_USER_AGENT = "harvest-coordinator/0.1 (+contact)";
    private static final List<LimitAction> DEFAULT_PRECEDENCE =
        List.of(LimitAction.CANCEL, LimitAction.STOP, LimitAction.PAUSE, LimitAction.WARN);

    private int maxConcurrentJobs = 4;
    private Events events = new Events();
    private Checkpoint checkpoint = new Checkpoint();
    private Fetch fetch = new Fetch();
    private Limits limits = new Limits();
    private Metrics metrics = new Metrics();
    private Recovery recovery = new Recovery();
    private Cli cli = new Cli();

    public int getMaxConcurrentJobs() {
        return Math.max(1, maxConcurrentJobs);
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Events {
        private int ringCapacity = 1000;
        private int perKindCapacity = 100;
        private int dispatchThreads = 2;

        public int getRingCapacity() {
            return Math.max(1, ringCapacity);
        }

        public void setRingCapacity(int ringCapacity) {
            this.ringCapacity = Math.max(1, ringCapacity);
        }

        public int getPerKindCapacity() {
            return Math.max(1, perKindCapacity);
        }

        public void setPerKindCapacity(int perKindCapacity) {
            this.perKindCapacity = Math.max(1, perKindCapacity);
        }

        public int getDispatchThreads() {
            return Math.max(1, dispatchThreads);
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = Math.max(1, dispatchThreads);
        }
    }

    public static class Checkpoint {
        private int intervalPages = 100;
        private int keepLast = 5;
        private long retryBackoffMs = 250;
        private boolean autoPrune = true;

        public int getIntervalPages() {
            return Math.max(1, intervalPages);
        }

        public void setIntervalPages(int intervalPages) {
            this.intervalPages = Math.max(1, intervalPages);
        }

        public int getKeepLast() {
            return Math.max(1, keepLast);
        }

        public void setKeepLast(int keepLast) {
            this.keepLast = Math.max(1, keepLast);
        }

        public long getRetryBackoffMs() {
            return Math.max(0, retryBackoffMs);
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = Math.max(0, retryBackoffMs);
        }

        public boolean isAutoPrune() {
            return autoPrune;
        }

        public void setAutoPrune(boolean autoPrune) {
            this.autoPrune = autoPrune;
        }
    }

    public static class Fetch {
        private String userAgent;
        private int concurrency = 4;
        private int requestTimeoutSeconds = 20;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private int perHostDelayMs = 250;
        private int maxBodyBytes = 5_000_000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getMaxBodyBytes() {
            return Math.max(1024, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1024, maxBodyBytes);
        }
    }

    public static class Limits {
        private double failureRateThreshold = 0.5;
        private int minAttemptsForFailureRate = 10;
        private int durationCheckSeconds = 30;
        private List<LimitAction> precedence = new ArrayList<>(DEFAULT_PRECEDENCE);

        public double getFailureRateThreshold() {
            return Math.min(1.0, Math.max(0.0, failureRateThreshold));
        }

        public void setFailureRateThreshold(double failureRateThreshold) {
            this.failureRateThreshold = Math.min(1.0, Math.max(0.0, failureRateThreshold));
        }

        public int getMinAttemptsForFailureRate() {
            return Math.max(1, minAttemptsForFailureRate);
        }

        public void setMinAttemptsForFailureRate(int minAttemptsForFailureRate) {
            this.minAttemptsForFailureRate = Math.max(1, minAttemptsForFailureRate);
        }

        public int getDurationCheckSeconds() {
            return Math.max(1, durationCheckSeconds);
        }

        public void setDurationCheckSeconds(int durationCheckSeconds) {
            this.durationCheckSeconds = Math.max(1, durationCheckSeconds);
        }

        public List<LimitAction> getPrecedence() {
            return completePrecedence(precedence);
        }

        public void setPrecedence(List<LimitAction> precedence) {
            this.precedence = precedence == null ? new ArrayList<>(DEFAULT_PRECEDENCE) : new ArrayList<>(precedence);
        }

        /**
         * Returns the given order with duplicates removed and any missing actions appended in the
         * default order, so every action always has a rank.
         */
        public static List<LimitAction> completePrecedence(List<LimitAction> candidate) {
            LinkedHashSet<LimitAction> ordered = new LinkedHashSet<>();
            if (candidate != null) {
                for (LimitAction action : candidate) {
                    if (action != null) {
                        ordered.add(action);
                    }
                }
            }
            ordered.addAll(DEFAULT_PRECEDENCE);
            return List.copyOf(ordered);
        }
    }

    public static class Metrics {
        private int resourceSampleSeconds = 15;

        public int getResourceSampleSeconds() {
            return Math.max(1, resourceSampleSeconds);
        }

        public void setResourceSampleSeconds(int resourceSampleSeconds) {
            this.resourceSampleSeconds = Math.max(1, resourceSampleSeconds);
        }
    }

    public static class Recovery {
        private boolean autoResume = false;
        private int drainTimeoutSeconds = 30;

        public boolean isAutoResume() {
            return autoResume;
        }

        public void setAutoResume(boolean autoResume) {
            this.autoResume = autoResume;
        }

        public int getDrainTimeoutSeconds() {
            return Math.max(1, drainTimeoutSeconds);
        }

        public void setDrainTimeoutSeconds(int drainTimeoutSeconds) {
            this.drainTimeoutSeconds = Math.max(1, drainTimeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String targets = "";
        private String mode = "BASELINE";
        private int maxPages = 0;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getTargets() {
            return targets;
        }

        public void setTargets(String targets) {
            this.targets = targets == null ? "" : targets;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode == null || mode.isBlank() ? "BASELINE" : mode;
        }

        public int getMaxPages() {
            return Math.max(0, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(0, maxPages);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
