package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.checkpoint.CheckpointManager;
import com.harvest.coordinator.crawl.checkpoint.CheckpointPayload;
import com.harvest.coordinator.crawl.checkpoint.CheckpointRecord;
import com.harvest.coordinator.crawl.checkpoint.CheckpointStatistics;
import com.harvest.coordinator.crawl.checkpoint.CheckpointType;
import com.harvest.coordinator.crawl.checkpoint.ResumeToken;
import com.harvest.coordinator.crawl.events.CrawlEvent;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;
import com.harvest.coordinator.crawl.fetch.FetchWorker;
import com.harvest.coordinator.crawl.iteration.Iteration;
import com.harvest.coordinator.crawl.iteration.IterationComparison;
import com.harvest.coordinator.crawl.iteration.IterationManager;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.metrics.CompletionEstimate;
import com.harvest.coordinator.crawl.metrics.MetricsAggregator;
import com.harvest.coordinator.crawl.metrics.MetricsSnapshot;
import com.harvest.coordinator.crawl.metrics.SeriesPoint;
import com.harvest.coordinator.crawl.metrics.SeriesWindow;
import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.model.CrawlJobConfig;
import com.harvest.coordinator.crawl.model.JobView;
import com.harvest.coordinator.crawl.model.StoredJob;
import com.harvest.coordinator.crawl.persistence.CrawlJobRepository;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.InvalidTransitionException;
import com.harvest.coordinator.crawl.state.JobStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Control surface of the coordinator. Every lifecycle transition of a job goes through here or
 * through the {@link JobRunner} this service dispatches.
 *
 * <p>Control operations on one job serialize on that job's lock; different jobs never contend.
 */
@Service
public class CrawlJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobOrchestrator.class);
    static final String INTERRUPTED_BY_RESTART = "interrupted_by_restart";

    private final JobRegistry registry;
    private final CrawlJobRepository repository;
    private final IterationManager iterations;
    private final CheckpointManager checkpoints;
    private final CrawlEventBus eventBus;
    private final MetricsAggregator metrics;
    private final FetchWorker fetchWorker;
    private final LimitEvaluator limits;
    private final CrawlPhaseHandler phaseHandler;
    private final CoordinatorProperties properties;
    private final ExecutorService jobRunExecutor;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    public CrawlJobOrchestrator(
        JobRegistry registry,
        CrawlJobRepository repository,
        IterationManager iterations,
        CheckpointManager checkpoints,
        CrawlEventBus eventBus,
        MetricsAggregator metrics,
        FetchWorker fetchWorker,
        LimitEvaluator limits,
        CrawlPhaseHandler phaseHandler,
        CoordinatorProperties properties,
        @Qualifier("jobRunExecutor") ExecutorService jobRunExecutor,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        Clock clock
    ) {
        this.registry = registry;
        this.repository = repository;
        this.iterations = iterations;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.fetchWorker = fetchWorker;
        this.limits = limits;
        this.phaseHandler = phaseHandler;
        this.properties = properties;
        this.jobRunExecutor = jobRunExecutor;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * Creates a job in QUEUED as the first iteration of a new lineage and starts it.
     *
     * @throws com.harvest.coordinator.crawl.iteration.NoBaselineException if {@code mode} is INCREMENTAL
     */
    public JobView submit(List<String> targets, IterationMode mode, CrawlJobConfig config) {
        List<String> normalized = normalizeTargets(targets);
        String jobId = newJobId();
        IterationManager.IterationContext iteration = iterations.planNext(jobId, mode == null ? IterationMode.BASELINE : mode);
        CrawlJob job = new CrawlJob(
            jobId,
            jobId,
            null,
            normalized,
            config,
            iteration.mode(),
            iteration.iterationNumber(),
            clock.instant()
        );
        return launch(job, iteration);
    }

    /**
     * Starts the next iteration of the lineage {@code jobId} belongs to, reusing its targets and
     * config.
     *
     * @throws ActiveJobException if another job of the lineage has not finished
     */
    public JobView createNextIteration(String jobId, IterationMode mode) {
        CrawlJob source = requireJob(jobId);
        ensureLineageIdle(source.lineageId());
        IterationManager.IterationContext iteration = iterations.planNext(
            source.lineageId(),
            mode == null ? IterationMode.INCREMENTAL : mode
        );
        CrawlJob job = new CrawlJob(
            newJobId(),
            source.lineageId(),
            source.jobId(),
            source.targets(),
            source.config(),
            iteration.mode(),
            iteration.iterationNumber(),
            clock.instant()
        );
        return launch(job, iteration);
    }

    public JobView pause(String jobId) {
        JobContext context = liveOrRehydrated(jobId);
        context.lock().lock();
        try {
            if (context.machine().current() != CrawlState.PAUSED) {
                pauseLocked(context, "user_request");
            }
            return view(context);
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Resumes a paused job from its newest usable checkpoint. Completed URIs are not dispatched
     * again.
     */
    public JobView resume(String jobId) {
        JobContext context = liveOrRehydrated(jobId);
        CrawlState current = context.machine().current();
        if (current != CrawlState.PAUSED) {
            throw new InvalidTransitionException(
                jobId,
                current,
                context.machine().resumeTarget(),
                "Job " + jobId + " is " + current + ", only a PAUSED job can be resumed"
            );
        }
        awaitDrained(context);
        context.lock().lock();
        ResumeToken token = null;
        try {
            if (context.machine().current() != CrawlState.PAUSED) {
                throw new InvalidTransitionException(jobId, context.machine().current(), CrawlState.CRAWLING);
            }
            token = checkpoints.resumeWithFallback(jobId).orElse(null);
            if (token != null) {
                restore(context, token.payload());
            } else {
                log.warn("No usable checkpoint for paused job {}; resuming from in-memory state", jobId);
            }
            CrawlState target = context.machine().resumeTarget();
            context.clearSignal();
            context.machine().transition(target);
            eventBus.publish(
                jobId,
                EventKind.CRAWL_RESUMED,
                new EventPayload.CrawlResumed(
                    target,
                    token == null ? null : token.checkpointId(),
                    context.frontier().pendingCount()
                )
            );
            persist(context);
            dispatch(context);
            log.info("Resumed job {} into {} from checkpoint {}", jobId, target, token == null ? "-" : token.checkpointId());
            return view(context);
        } finally {
            checkpoints.release(token);
            context.lock().unlock();
        }
    }

    /**
     * Cancels a non-terminal job. Cancelling a job that is already CANCELLED is a no-op.
     *
     * @throws InvalidTransitionException if the job is COMPLETED or FAILED
     */
    public JobView cancel(String jobId) {
        JobContext context = liveOrRehydrated(jobId);
        context.lock().lock();
        try {
            if (context.machine().current() != CrawlState.CANCELLED) {
                cancelLocked(context, "user_request");
            }
            return view(context);
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Continues a job from its newest usable checkpoint.
     *
     * <ul>
     *   <li>PAUSED: same as {@link #resume(String)}.</li>
     *   <li>Non-terminal without a runner in this process (after a restart): the runner is
     *   dispatched again from the checkpointed frontier.</li>
     *   <li>FAILED or CANCELLED: a recovery job takes over the same iteration.</li>
     * </ul>
     *
     * @throws InvalidTransitionException if the job is COMPLETED or already running
     */
    public JobView continueFromCheckpoint(String jobId) {
        JobContext context = liveOrRehydrated(jobId);
        CrawlState current = context.machine().current();
        if (current == CrawlState.PAUSED) {
            return resume(jobId);
        }
        if (current == CrawlState.FAILED || current == CrawlState.CANCELLED) {
            return recover(context);
        }
        if (current == CrawlState.COMPLETED) {
            throw new InvalidTransitionException(
                jobId,
                current,
                CrawlState.CRAWLING,
                "Job " + jobId + " is COMPLETED; start a new iteration instead"
            );
        }
        context.lock().lock();
        try {
            if (context.isRunning()) {
                throw new InvalidTransitionException(
                    jobId,
                    current,
                    current,
                    "Job " + jobId + " is already running in " + current
                );
            }
            context.clearSignal();
            eventBus.publish(
                jobId,
                EventKind.INFO,
                new EventPayload.Message("Continuing job", "from state " + current)
            );
            dispatch(context);
            return view(context);
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Cancels running jobs that are past their max duration. Every fetch outcome checks the limit
     * as well; this sweep catches jobs whose fetches have stalled.
     *
     * @return ids of the jobs cancelled
     */
    public List<String> enforceDurationLimits() {
        List<String> cancelled = new ArrayList<>();
        Instant now = clock.instant();
        for (JobContext context : registry.all()) {
            context.lock().lock();
            try {
                CrawlState state = context.machine().current();
                if (state.isTerminal() || state == CrawlState.PAUSED || context.hasFired(LimitBreach.MAX_DURATION)) {
                    continue;
                }
                Duration elapsed = LimitEvaluator.elapsed(context.machine().snapshot().startedAt(), now);
                Optional<LimitBreach> breach = limits.durationBreach(context.job().config(), elapsed);
                if (breach.isPresent()) {
                    context.markLimitFired(breach.get().limit());
                    log.info("Job {} hit limit {}: {}", context.jobId(), breach.get().limit(), breach.get().reason());
                    cancelLocked(context, breach.get().reason());
                    cancelled.add(context.jobId());
                }
            } finally {
                context.lock().unlock();
            }
        }
        return cancelled;
    }

    /** @return empty if the job is not live in this process or the write failed */
    public Optional<CheckpointRecord> createCheckpoint(String jobId, CheckpointType type) {
        requireJob(jobId);
        return checkpoints.createCheckpoint(jobId, type == null ? CheckpointType.MANUAL : type);
    }

    /**
     * Removes a finished job with its events, metrics and checkpoints. The lineage's fingerprints
     * and iterations stay.
     *
     * @throws ActiveJobException if the job has not reached a terminal state
     */
    public void delete(String jobId) {
        JobView current = get(jobId);
        if (!current.state().isTerminal()) {
            throw new ActiveJobException("Job " + jobId + " is " + current.state() + "; cancel it before deleting");
        }
        registry.remove(jobId);
        iterations.release(jobId);
        checkpoints.deleteAll(jobId);
        repository.delete(jobId);
        eventBus.clear(jobId);
        metrics.forget(jobId);
        log.info("Deleted job {}", jobId);
    }

    public JobView get(String jobId) {
        Optional<JobContext> live = registry.find(jobId);
        if (live.isPresent()) {
            return view(live.get());
        }
        return repository.find(jobId)
            .map(stored -> JobView.of(stored.job(), stored.state(), false))
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<JobView> list(int limit) {
        List<JobView> views = new ArrayList<>();
        for (StoredJob stored : repository.findRecent(limit)) {
            Optional<JobContext> live = registry.find(stored.job().jobId());
            views.add(live.map(this::view).orElseGet(() -> JobView.of(stored.job(), stored.state(), false)));
        }
        return views;
    }

    public List<CrawlEvent> events(String jobId, int limit, EventKind kind) {
        requireJob(jobId);
        if (kind != null) {
            return eventBus.byKind(jobId, kind, limit);
        }
        return eventBus.recent(jobId, limit);
    }

    public List<CrawlEvent> eventsSince(String jobId, Instant since) {
        requireJob(jobId);
        return eventBus.since(jobId, since);
    }

    public MetricsSnapshot metrics(String jobId) {
        requireJob(jobId);
        return metrics.snapshot(jobId);
    }

    public Map<String, List<SeriesPoint>> series(String jobId, SeriesWindow window) {
        requireJob(jobId);
        return metrics.series(jobId, window);
    }

    public CompletionEstimate estimate(String jobId) {
        requireJob(jobId);
        return metrics.estimateCompletion(jobId);
    }

    public List<Iteration> iterations(String jobId) {
        return iterations.iterations(requireJob(jobId).lineageId());
    }

    public List<Iteration> iterationChain(String jobId) {
        CrawlJob job = requireJob(jobId);
        return iterations.chain(job.lineageId(), job.iterationNumber());
    }

    /**
     * Compares two iterations of the job's lineage. Without arguments the job's own iteration is
     * compared with its parent.
     */
    public IterationComparison compare(String jobId, Integer baselineIteration, Integer currentIteration) {
        CrawlJob job = requireJob(jobId);
        int current = currentIteration == null ? job.iterationNumber() : currentIteration;
        Integer parent = iterations.find(job.lineageId(), current).map(Iteration::parentIteration).orElse(null);
        int baseline = baselineIteration != null ? baselineIteration : parent == null ? current : parent;
        return iterations.compare(job.lineageId(), baseline, current);
    }

    public List<CheckpointRecord> checkpoints(String jobId) {
        requireJob(jobId);
        return checkpoints.list(jobId);
    }

    public CheckpointStatistics checkpointStatistics(String jobId) {
        requireJob(jobId);
        return checkpoints.statistics(jobId);
    }

    public int pruneCheckpoints(String jobId, int keepLast) {
        requireJob(jobId);
        return checkpoints.prune(jobId, keepLast);
    }

    /**
     * Waits until the job's runner returns, which happens on completion, failure, cancellation or
     * pause.
     */
    public JobView awaitRunner(String jobId, Duration timeout) {
        registry.find(jobId).ifPresent(context -> context.awaitRunner(timeout));
        return get(jobId);
    }

    public List<String> activeJobIds() {
        return registry.activeJobIds();
    }

    /**
     * Startup handling of a job a previous process left unfinished: a PAUSED job is registered so it
     * can be resumed; any other state is failed with {@value #INTERRUPTED_BY_RESTART}.
     */
    public JobView markInterrupted(String jobId) {
        JobContext context = liveOrRehydrated(jobId);
        context.lock().lock();
        try {
            CrawlState current = context.machine().current();
            if (current != CrawlState.PAUSED && !current.isTerminal()) {
                failLocked(context, INTERRUPTED_BY_RESTART);
            }
            return view(context);
        } finally {
            context.lock().unlock();
        }
    }

    // Called with the job lock held, by control operations and by the runner.

    void pauseLocked(JobContext context, String reason) {
        context.raise(JobContext.RunSignal.PAUSE);
        JobStateMachine machine = context.machine();
        CrawlState from = machine.current();
        machine.transition(CrawlState.PAUSED);
        eventBus.publish(context.jobId(), EventKind.CRAWL_PAUSED, new EventPayload.CrawlPaused(from, reason));
        persist(context);
        log.info("Paused job {} from {}: {}", context.jobId(), from, reason);
    }

    void cancelLocked(JobContext context, String reason) {
        JobStateMachine machine = context.machine();
        CrawlState from = machine.current();
        if (from.isTerminal()) {
            throw new InvalidTransitionException(context.jobId(), from, CrawlState.CANCELLED);
        }
        context.raise(JobContext.RunSignal.CANCEL);
        machine.transition(CrawlState.CANCELLED);
        eventBus.publish(context.jobId(), EventKind.CRAWL_CANCELLED, new EventPayload.CrawlCancelled(from, reason));
        persist(context);
        iterations.release(context.jobId());
        log.info("Cancelled job {} from {}: {}", context.jobId(), from, reason);
    }

    void failLocked(JobContext context, String error) {
        JobStateMachine machine = context.machine();
        CrawlState from = machine.current();
        if (from.isTerminal()) {
            log.debug("Job {} already {}; ignoring failure: {}", context.jobId(), from, error);
            return;
        }
        context.raise(JobContext.RunSignal.CANCEL);
        machine.transition(CrawlState.FAILED, error);
        eventBus.publish(context.jobId(), EventKind.ERROR, new EventPayload.Message("Job failed", error));
        eventBus.publish(context.jobId(), EventKind.CRAWL_FAILED, new EventPayload.CrawlFailed(from, error));
        persist(context);
        iterations.release(context.jobId());
        log.warn("Job {} failed from {}: {}", context.jobId(), from, error);
    }

    void failJob(JobContext context, String error) {
        context.lock().lock();
        try {
            failLocked(context, error);
        } finally {
            context.lock().unlock();
        }
    }

    void persist(JobContext context) {
        try {
            repository.updateState(context.jobId(), context.machine().snapshot());
        } catch (RuntimeException e) {
            log.warn("Unable to persist state of job {}", context.jobId(), e);
        }
    }

    private JobView launch(CrawlJob job, IterationManager.IterationContext iteration) {
        JobStateMachine machine = new JobStateMachine(job.jobId(), eventBus, clock);
        JobContext context = new JobContext(job, machine, new Frontier());
        repository.insert(job, machine.snapshot());
        iterations.start(job.jobId(), iteration);
        registry.register(context);
        log.info(
            "Submitted job {} lineage={} iteration={} mode={} targets={}",
            job.jobId(),
            job.lineageId(),
            job.iterationNumber(),
            job.mode(),
            job.targets().size()
        );
        context.lock().lock();
        try {
            dispatch(context);
            return view(context);
        } finally {
            context.lock().unlock();
        }
    }

    /**
     * Hands a FAILED or CANCELLED job's unfinished iteration to a new job seeded from the newest
     * usable checkpoint, or from the targets when none decodes.
     */
    private JobView recover(JobContext failed) {
        CrawlJob source = failed.job();
        ensureLineageIdle(source.lineageId());
        ResumeToken token = checkpoints.resumeWithFallback(source.jobId()).orElse(null);
        try {
            CrawlJob job = new CrawlJob(
                newJobId(),
                source.lineageId(),
                source.jobId(),
                source.targets(),
                source.config(),
                source.mode(),
                source.iterationNumber(),
                clock.instant()
            );
            JobStateMachine machine = new JobStateMachine(job.jobId(), eventBus, clock);
            JobContext context = new JobContext(job, machine, new Frontier());
            if (token != null) {
                restore(context, token.payload());
            }
            repository.insert(job, machine.snapshot());
            iterations.attach(job.jobId(), source.lineageId(), source.iterationNumber());
            registry.register(context);
            eventBus.publish(
                job.jobId(),
                EventKind.INFO,
                new EventPayload.Message(
                    "Recovery job",
                    "continues job " + source.jobId() + " from " + (token == null ? "its targets" : token.checkpointId())
                )
            );
            log.info(
                "Job {} recovers {} ({}) from checkpoint {}",
                job.jobId(),
                source.jobId(),
                failed.machine().current(),
                token == null ? "-" : token.checkpointId()
            );
            context.lock().lock();
            try {
                dispatch(context);
                return view(context);
            } finally {
                context.lock().unlock();
            }
        } finally {
            checkpoints.release(token);
        }
    }

    private void dispatch(JobContext context) {
        JobRunner runner = new JobRunner(
            this,
            context,
            eventBus,
            iterations,
            checkpoints,
            fetchWorker,
            limits,
            phaseHandler,
            fetchExecutor,
            clock,
            properties.getFetch().getConcurrency(),
            properties.getCheckpoint().getIntervalPages()
        );
        context.attachRunner(jobRunExecutor.submit(runner));
    }

    private void restore(JobContext context, CheckpointPayload payload) {
        context.machine().restoreCounters(payload.state().counters());
        context.frontier().restore(payload.pending(), payload.pendingDocuments(), payload.completed(), payload.failed());
    }

    /**
     * Registers a job a previous process left behind, with counters and frontier taken from its
     * newest usable checkpoint. Nothing is dispatched.
     */
    private JobContext liveOrRehydrated(String jobId) {
        Optional<JobContext> live = registry.find(jobId);
        if (live.isPresent()) {
            return live.get();
        }
        StoredJob stored = repository.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobStateMachine machine = JobStateMachine.restore(stored.state(), eventBus, clock);
        JobContext context = new JobContext(stored.job(), machine, new Frontier());
        if (!stored.state().currentState().isTerminal()) {
            Optional<ResumeToken> token = checkpoints.resumeWithFallback(jobId);
            token.ifPresent(value -> restore(context, value.payload()));
            token.ifPresent(checkpoints::release);
        }
        return registry.register(context);
    }

    private void awaitDrained(JobContext context) {
        Duration timeout = Duration.ofSeconds(properties.getRecovery().getDrainTimeoutSeconds());
        if (!context.awaitRunner(timeout)) {
            throw new ActiveJobException(
                "Job " + context.jobId() + " is still draining in-flight fetches; retry shortly"
            );
        }
    }

    private void ensureLineageIdle(String lineageId) {
        for (StoredJob stored : repository.findByLineage(lineageId)) {
            String jobId = stored.job().jobId();
            CrawlState state = registry.find(jobId)
                .map(context -> context.machine().current())
                .orElse(stored.state().currentState());
            if (!state.isTerminal()) {
                throw new ActiveJobException("Job " + jobId + " of lineage " + lineageId + " is still " + state);
            }
        }
    }

    private CrawlJob requireJob(String jobId) {
        Optional<JobContext> live = registry.find(jobId);
        if (live.isPresent()) {
            return live.get().job();
        }
        return repository.find(jobId).map(StoredJob::job).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobView view(JobContext context) {
        return JobView.of(context.job(), context.machine().snapshot(), true);
    }

    private List<String> normalizeTargets(List<String> targets) {
        if (targets == null) {
            throw new IllegalArgumentException("At least one target is required");
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String target : targets) {
            if (target != null && !target.isBlank()) {
                normalized.add(target.trim());
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one target is required");
        }
        return List.copyOf(normalized);
    }

    private String newJobId() {
        return "job-" + UUID.randomUUID();
    }
}
