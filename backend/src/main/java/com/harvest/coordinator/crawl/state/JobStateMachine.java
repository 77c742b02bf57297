package com.harvest.coordinator.crawl.state;

import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle record of a single job.
 *
 * <p>All mutations hold the machine's monitor, and the matching {@code STATE_CHANGE} or
 * {@code SUBSTATE_CHANGE} event is published before the monitor is released, so observers never see
 * a history entry without its event or the reverse.
 */
public class JobStateMachine {
    private final String jobId;
    private final CrawlEventBus eventBus;
    private final Clock clock;
    private final List<StateTransition> history = new ArrayList<>();

    private CrawlState current;
    private CrawlSubstate substate;
    private String error;
    private JobCounters counters = JobCounters.zero();
    private CrawlState pausedFrom;
    private CrawlSubstate pausedSubstate;
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;

    public JobStateMachine(String jobId, CrawlEventBus eventBus, Clock clock) {
        this.jobId = jobId;
        this.eventBus = eventBus;
        this.clock = clock;
        this.current = CrawlState.QUEUED;
        this.history.add(new StateTransition(null, CrawlState.QUEUED, clock.instant(), Duration.ZERO));
    }

    /**
     * Rebuilds a machine from a persisted snapshot. No events are published.
     */
    public static JobStateMachine restore(JobStateSnapshot snapshot, CrawlEventBus eventBus, Clock clock) {
        JobStateMachine machine = new JobStateMachine(snapshot.jobId(), eventBus, clock);
        if (!snapshot.history().isEmpty()) {
            machine.history.clear();
            machine.history.addAll(snapshot.history());
        }
        machine.current = snapshot.currentState();
        machine.substate = snapshot.substate();
        machine.error = snapshot.error();
        machine.counters = snapshot.counters();
        machine.pausedFrom = snapshot.pausedFrom();
        machine.pausedSubstate = snapshot.pausedSubstate();
        machine.startedAt = snapshot.startedAt();
        machine.pausedAt = snapshot.pausedAt();
        machine.completedAt = snapshot.completedAt();
        return machine;
    }

    public String jobId() {
        return jobId;
    }

    public synchronized CrawlState current() {
        return current;
    }

    public synchronized CrawlSubstate substate() {
        return substate;
    }

    public synchronized JobCounters counters() {
        return counters;
    }

    public synchronized List<StateTransition> history() {
        return List.copyOf(history);
    }

    public synchronized boolean isTerminal() {
        return current.isTerminal();
    }

    /**
     * Moves the job to {@code target}.
     *
     * @return the appended history entry, or empty when the job is already in {@code target}
     * @throws InvalidTransitionException if {@code target} is not reachable from the current state
     */
    public synchronized Optional<StateTransition> transition(CrawlState target) {
        return transition(target, null);
    }

    public synchronized Optional<StateTransition> transition(CrawlState target, String errorMessage) {
        if (target == current) {
            return Optional.empty();
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(jobId, current, target);
        }
        Instant now = clock.instant();
        StateTransition previous = history.get(history.size() - 1);
        StateTransition entry = new StateTransition(current, target, now, Duration.between(previous.at(), now));
        CrawlState from = current;

        if (target == CrawlState.PAUSED) {
            pausedFrom = from;
            pausedSubstate = substate;
            pausedAt = now;
        } else if (from == CrawlState.PAUSED) {
            pausedAt = null;
        }
        substate = restoredSubstate(from, target);
        if (target != CrawlState.PAUSED && from == CrawlState.PAUSED) {
            pausedFrom = null;
            pausedSubstate = null;
        }
        if (target == CrawlState.INITIALIZING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal()) {
            completedAt = now;
        }
        if (errorMessage != null) {
            error = errorMessage;
        }
        current = target;
        history.add(entry);

        eventBus.publish(jobId, EventKind.STATE_CHANGE, new EventPayload.StateChanged(from, target, entry.duration()));
        return Optional.of(entry);
    }

    /**
     * Annotates the current working state with a substate. Re-setting the current substate is a no-op.
     *
     * @throws InvalidTransitionException if the substate belongs to a different state
     */
    public synchronized boolean setSubstate(CrawlSubstate next) {
        if (next == substate) {
            return false;
        }
        if (next != null && !next.belongsTo(current)) {
            throw new InvalidTransitionException(
                jobId,
                current,
                next.owner(),
                "Substate " + next + " does not belong to " + current + " for job " + jobId
            );
        }
        CrawlSubstate previous = substate;
        substate = next;
        eventBus.publish(jobId, EventKind.SUBSTATE_CHANGE, new EventPayload.SubstateChanged(current, previous, next));
        return true;
    }

    /** The working state a paused job returns to. */
    public synchronized CrawlState resumeTarget() {
        if (current != CrawlState.PAUSED) {
            return current;
        }
        if (pausedFrom == null || pausedFrom == CrawlState.QUEUED) {
            return CrawlState.INITIALIZING;
        }
        return pausedFrom;
    }

    public synchronized void recordCrawled(boolean skipped) {
        counters = counters.plusCrawled(skipped);
    }

    public synchronized void recordFailed() {
        counters = counters.plusFailed();
    }

    public synchronized void recordDocumentFound() {
        counters = counters.plusDocument();
    }

    public synchronized void restoreCounters(JobCounters restored) {
        counters = restored == null ? JobCounters.zero() : restored;
    }

    public synchronized void recordError(String message) {
        error = message;
    }

    public synchronized JobStateSnapshot snapshot() {
        return new JobStateSnapshot(
            jobId,
            current,
            substate,
            error,
            counters,
            history,
            pausedFrom,
            pausedSubstate,
            startedAt,
            pausedAt,
            completedAt
        );
    }

    private CrawlSubstate restoredSubstate(CrawlState from, CrawlState target) {
        if (from == CrawlState.PAUSED && pausedSubstate != null && pausedSubstate.belongsTo(target)) {
            return pausedSubstate;
        }
        return null;
    }
}
