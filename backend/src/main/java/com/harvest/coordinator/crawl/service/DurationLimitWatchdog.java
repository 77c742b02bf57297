package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Sweeps live jobs for exceeded max durations every {@code coordinator.limits.duration-check-seconds}. */
@Service
public class DurationLimitWatchdog {
    private static final Logger log = LoggerFactory.getLogger(DurationLimitWatchdog.class);

    private final CrawlJobOrchestrator orchestrator;
    private final CoordinatorProperties properties;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public DurationLimitWatchdog(
        CrawlJobOrchestrator orchestrator,
        CoordinatorProperties properties,
        @Qualifier("samplerExecutor") ScheduledExecutorService scheduler
    ) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        long period = properties.getLimits().getDurationCheckSeconds();
        task = scheduler.scheduleAtFixedRate(this::sweepSafely, period, period, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        if (task != null) {
            task.cancel(false);
        }
    }

    private void sweepSafely() {
        try {
            List<String> cancelled = orchestrator.enforceDurationLimits();
            if (!cancelled.isEmpty()) {
                log.info("Duration sweep cancelled jobs {}", cancelled);
            }
        } catch (RuntimeException e) {
            log.warn("Duration sweep failed", e);
        }
    }
}
