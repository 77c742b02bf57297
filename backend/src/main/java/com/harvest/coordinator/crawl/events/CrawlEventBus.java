package com.harvest.coordinator.crawl.events;

import com.harvest.coordinator.config.CoordinatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe hub for crawl events.
 *
 * <p>Publishing appends to the job's bounded history and hands the event to each matching
 * subscriber's mailbox without waiting for delivery. Inline subscribers are the exception: they run
 * on the publishing thread before {@link #publish} returns.
 */
@Component
public class CrawlEventBus {
    private static final Logger log = LoggerFactory.getLogger(CrawlEventBus.class);

    private final int ringCapacity;
    private final int perKindCapacity;
    private final ExecutorService dispatchExecutor;
    private final Clock clock;
    private final Map<String, JobHistory> histories = new ConcurrentHashMap<>();
    private final Map<String, List<Subscription>> jobSubscribers = new ConcurrentHashMap<>();
    private final List<Subscription> globalSubscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    public CrawlEventBus(
        CoordinatorProperties properties,
        @Qualifier("eventDispatchExecutor") ExecutorService dispatchExecutor,
        Clock clock
    ) {
        this.ringCapacity = properties.getEvents().getRingCapacity();
        this.perKindCapacity = properties.getEvents().getPerKindCapacity();
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    public CrawlEvent publish(String jobId, EventKind kind, EventPayload payload) {
        return publish(jobId, kind, null, payload);
    }

    public CrawlEvent publish(String jobId, EventKind kind, EventSeverity severity, EventPayload payload) {
        JobHistory history = histories.computeIfAbsent(jobId, ignored -> new JobHistory(ringCapacity, perKindCapacity));
        List<Subscription> inline = new ArrayList<>();
        CrawlEvent event;
        synchronized (history) {
            event = new CrawlEvent(
                UUID.randomUUID().toString(),
                jobId,
                history.nextSequence(),
                kind,
                severity,
                clock.instant(),
                payload
            );
            history.append(event);
            for (Subscription subscription : subscribersFor(jobId)) {
                if (subscription.isInline()) {
                    inline.add(subscription);
                } else {
                    subscription.enqueue(event);
                }
            }
        }
        for (Subscription subscription : inline) {
            subscription.deliverInline(event);
        }
        return event;
    }

    public Subscription subscribe(String jobId, Consumer<CrawlEvent> handler) {
        return register(jobId, handler, false);
    }

    public Subscription subscribeAll(Consumer<CrawlEvent> handler) {
        return register(null, handler, false);
    }

    /**
     * Registers a handler that runs synchronously on the publishing thread. Use only for work that
     * must finish before the publisher moves on; a {@code null} job id listens to every job.
     */
    public Subscription subscribeInline(String jobId, Consumer<CrawlEvent> handler) {
        return register(jobId, handler, true);
    }

    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return false;
        }
        subscription.deactivate();
        if (subscription.jobId() == null) {
            return globalSubscribers.remove(subscription);
        }
        List<Subscription> subscribers = jobSubscribers.get(subscription.jobId());
        return subscribers != null && subscribers.remove(subscription);
    }

    public List<CrawlEvent> history(String jobId) {
        JobHistory history = histories.get(jobId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history.events);
        }
    }

    /** The most recent {@code limit} events, oldest first. */
    public List<CrawlEvent> recent(String jobId, int limit) {
        List<CrawlEvent> all = history(jobId);
        int safeLimit = Math.max(0, limit);
        if (all.size() <= safeLimit) {
            return all;
        }
        return all.subList(all.size() - safeLimit, all.size());
    }

    public List<CrawlEvent> byKind(String jobId, EventKind kind, int limit) {
        JobHistory history = histories.get(jobId);
        if (history == null) {
            return List.of();
        }
        List<CrawlEvent> events;
        synchronized (history) {
            Deque<CrawlEvent> ofKind = history.byKind.get(kind);
            events = ofKind == null ? List.of() : List.copyOf(ofKind);
        }
        int safeLimit = Math.max(0, limit);
        if (events.size() <= safeLimit) {
            return events;
        }
        return events.subList(events.size() - safeLimit, events.size());
    }

    public List<CrawlEvent> since(String jobId, Instant since) {
        return history(jobId).stream()
            .filter(event -> since == null || event.timestamp().isAfter(since))
            .toList();
    }

    /** Drops the job's history and its job-scoped subscriptions. */
    public void clear(String jobId) {
        histories.remove(jobId);
        List<Subscription> removed = jobSubscribers.remove(jobId);
        if (removed != null) {
            removed.forEach(Subscription::deactivate);
        }
        log.debug("Cleared event history for job {}", jobId);
    }

    /**
     * Waits until every asynchronous subscriber has drained its mailbox.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (allIdle()) {
                return true;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return allIdle();
    }

    private boolean allIdle() {
        for (Subscription subscription : globalSubscribers) {
            if (!subscription.isIdle()) {
                return false;
            }
        }
        for (List<Subscription> subscribers : jobSubscribers.values()) {
            for (Subscription subscription : subscribers) {
                if (!subscription.isIdle()) {
                    return false;
                }
            }
        }
        return true;
    }

    private Subscription register(String jobId, Consumer<CrawlEvent> handler, boolean inline) {
        Subscription subscription = new Subscription(
            subscriptionIds.incrementAndGet(),
            jobId,
            handler,
            inline,
            dispatchExecutor
        );
        if (jobId == null) {
            globalSubscribers.add(subscription);
        } else {
            jobSubscribers.computeIfAbsent(jobId, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
        }
        return subscription;
    }

    private List<Subscription> subscribersFor(String jobId) {
        List<Subscription> scoped = jobSubscribers.get(jobId);
        if (scoped == null || scoped.isEmpty()) {
            return globalSubscribers;
        }
        List<Subscription> combined = new ArrayList<>(scoped.size() + globalSubscribers.size());
        combined.addAll(scoped);
        combined.addAll(globalSubscribers);
        return combined;
    }

    private static final class JobHistory {
        private final int capacity;
        private final int perKindCapacity;
        private final Deque<CrawlEvent> events = new ArrayDeque<>();
        private final Map<EventKind, Deque<CrawlEvent>> byKind = new EnumMap<>(EventKind.class);
        private long sequence;

        private JobHistory(int capacity, int perKindCapacity) {
            this.capacity = capacity;
            this.perKindCapacity = perKindCapacity;
        }

        private long nextSequence() {
            return ++sequence;
        }

        private void append(CrawlEvent event) {
            events.addLast(event);
            while (events.size() > capacity) {
                events.removeFirst();
            }
            Deque<CrawlEvent> ofKind = byKind.computeIfAbsent(event.kind(), ignored -> new ArrayDeque<>());
            ofKind.addLast(event);
            while (ofKind.size() > perKindCapacity) {
                ofKind.removeFirst();
            }
        }
    }
}
