package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.state.JobStateMachine;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live, in-process state of a registered job.
 *
 * <p>Lock order is {@link #lock()}, then the state machine's monitor, then the frontier's monitor.
 * Control operations and fetch outcome handling hold {@link #lock()}.
 */
public class JobContext {

    public enum RunSignal {
        NONE,
        PAUSE,
        CANCEL,
        STOP
    }

    private final CrawlJob job;
    private final JobStateMachine machine;
    private final Frontier frontier;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<RunSignal> signal = new AtomicReference<>(RunSignal.NONE);
    private final AtomicInteger pagesSinceCheckpoint = new AtomicInteger();
    private final AtomicBoolean startAnnounced = new AtomicBoolean();
    private final Set<String> firedLimits = ConcurrentHashMap.newKeySet();
    private volatile Future<?> runner;

    public JobContext(CrawlJob job, JobStateMachine machine, Frontier frontier) {
        this.job = job;
        this.machine = machine;
        this.frontier = frontier;
    }

    public CrawlJob job() {
        return job;
    }

    public String jobId() {
        return job.jobId();
    }

    public JobStateMachine machine() {
        return machine;
    }

    public Frontier frontier() {
        return frontier;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public RunSignal signal() {
        return signal.get();
    }

    /** Raises a signal unless a stronger one is already pending. CANCEL outranks PAUSE outranks STOP. */
    public void raise(RunSignal next) {
        signal.updateAndGet(current -> rank(next) > rank(current) ? next : current);
    }

    public void clearSignal() {
        signal.set(RunSignal.NONE);
    }

    /** @return {@code true} only for the first caller, so a resumed run does not announce CRAWL_START again */
    public boolean markStartAnnounced() {
        return startAnnounced.compareAndSet(false, true);
    }

    /** @return {@code true} when the interval boundary was crossed and the counter reset */
    public boolean countPageTowardsCheckpoint(int intervalPages) {
        if (intervalPages <= 0) {
            return false;
        }
        if (pagesSinceCheckpoint.incrementAndGet() >= intervalPages) {
            pagesSinceCheckpoint.set(0);
            return true;
        }
        return false;
    }

    /** Limits fire once per job; a resumed job does not pause again on the same limit. */
    public boolean markLimitFired(String limitKey) {
        return firedLimits.add(limitKey);
    }

    public boolean hasFired(String limitKey) {
        return firedLimits.contains(limitKey);
    }

    public void attachRunner(Future<?> future) {
        this.runner = future;
    }

    public boolean isRunning() {
        Future<?> current = runner;
        return current != null && !current.isDone();
    }

    /**
     * Waits for the dispatch loop to return.
     *
     * @return {@code false} if it is still running after {@code timeout}
     */
    public boolean awaitRunner(Duration timeout) {
        Future<?> current = runner;
        if (current == null) {
            return true;
        }
        try {
            current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | CancellationException e) {
            // the runner records its own failures on the state machine
            return true;
        }
    }

    private static int rank(RunSignal signal) {
        return switch (signal) {
            case NONE -> 0;
            case STOP -> 1;
            case PAUSE -> 2;
            case CANCEL -> 3;
        };
    }
}
