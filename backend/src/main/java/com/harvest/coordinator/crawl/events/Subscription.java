package com.harvest.coordinator.crawl.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle returned by {@link CrawlEventBus#subscribe}. Asynchronous subscriptions own a mailbox that is
 * drained by at most one dispatch thread at a time, so a subscriber sees events in publish order.
 */
public final class Subscription {
    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final long id;
    private final String jobId;
    private final Consumer<CrawlEvent> handler;
    private final boolean inline;
    private final Executor executor;
    private final Queue<CrawlEvent> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private volatile boolean active = true;

    Subscription(long id, String jobId, Consumer<CrawlEvent> handler, boolean inline, Executor executor) {
        this.id = id;
        this.jobId = jobId;
        this.handler = handler;
        this.inline = inline;
        this.executor = executor;
    }

    public long id() {
        return id;
    }

    /** Job this subscription listens to, or {@code null} for every job. */
    public String jobId() {
        return jobId;
    }

    public boolean isInline() {
        return inline;
    }

    public boolean isActive() {
        return active;
    }

    void enqueue(CrawlEvent event) {
        if (!active) {
            return;
        }
        mailbox.offer(event);
        schedule();
    }

    void deliverInline(CrawlEvent event) {
        if (active) {
            invoke(event);
        }
    }

    void deactivate() {
        active = false;
        mailbox.clear();
    }

    boolean isIdle() {
        return mailbox.isEmpty() && !scheduled.get();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            log.warn("Dropping {} queued events for subscription {}: dispatcher is shut down", mailbox.size(), id);
            mailbox.clear();
        }
    }

    private void drain() {
        try {
            CrawlEvent event;
            while (active && (event = mailbox.poll()) != null) {
                invoke(event);
            }
        } finally {
            scheduled.set(false);
            if (active && !mailbox.isEmpty()) {
                schedule();
            }
        }
    }

    private void invoke(CrawlEvent event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.warn(
                "Subscriber {} failed handling {} #{} for job {}",
                id,
                event.kind(),
                event.sequence(),
                event.jobId(),
                e
            );
        }
    }
}
