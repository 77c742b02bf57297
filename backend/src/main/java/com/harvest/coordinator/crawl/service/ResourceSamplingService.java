package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Publishes process resource usage as {@code METRICS_UPDATE} to every active job. */
@Service
public class ResourceSamplingService {
    private static final Logger log = LoggerFactory.getLogger(ResourceSamplingService.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final JobRegistry registry;
    private final CrawlEventBus eventBus;
    private final CoordinatorProperties properties;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public ResourceSamplingService(
        JobRegistry registry,
        CrawlEventBus eventBus,
        CoordinatorProperties properties,
        @Qualifier("samplerExecutor") ScheduledExecutorService scheduler
    ) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        long period = properties.getMetrics().getResourceSampleSeconds();
        task = scheduler.scheduleAtFixedRate(this::publishSafely, period, period, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        if (task != null) {
            task.cancel(false);
        }
    }

    public EventPayload.MetricsSample sample() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage();
        double cpuPercent = load < 0 ? 0.0 : Math.min(100.0, load / Math.max(1, os.getAvailableProcessors()) * 100.0);
        Runtime runtime = Runtime.getRuntime();
        double memoryMb = (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
        double diskFreeMb = new File(".").getUsableSpace() / BYTES_PER_MB;
        int threads = ManagementFactory.getThreadMXBean().getThreadCount();
        return new EventPayload.MetricsSample(cpuPercent, memoryMb, diskFreeMb, threads);
    }

    /** @return number of jobs the sample was published to */
    public int publish() {
        List<String> active = registry.activeJobIds();
        if (active.isEmpty()) {
            return 0;
        }
        EventPayload.MetricsSample sample = sample();
        for (String jobId : active) {
            eventBus.publish(jobId, EventKind.METRICS_UPDATE, sample);
        }
        return active.size();
    }

    private void publishSafely() {
        try {
            publish();
        } catch (RuntimeException e) {
            log.warn("Resource sampling failed", e);
        }
    }
}
