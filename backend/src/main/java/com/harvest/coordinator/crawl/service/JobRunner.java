package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.checkpoint.CheckpointManager;
import com.harvest.coordinator.crawl.checkpoint.CheckpointType;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;
import com.harvest.coordinator.crawl.fetch.FetchContext;
import com.harvest.coordinator.crawl.fetch.FetchFailureException;
import com.harvest.coordinator.crawl.fetch.FetchOutcome;
import com.harvest.coordinator.crawl.fetch.FetchWorker;
import com.harvest.coordinator.crawl.fetch.RobotsRules;
import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import com.harvest.coordinator.crawl.iteration.ChangeType;
import com.harvest.coordinator.crawl.iteration.ComparisonSummary;
import com.harvest.coordinator.crawl.iteration.IterationManager;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.model.CrawlJobConfig;
import com.harvest.coordinator.crawl.model.FrontierEntry;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import com.harvest.coordinator.crawl.state.JobCounters;
import com.harvest.coordinator.crawl.state.JobStateMachine;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one job from its current state to COMPLETED, or until a pause, cancel or failure stops it.
 *
 * <p>A run started on a resumed job picks up at the job's current state and substate. Pause and
 * cancel are performed by the orchestrator; the runner only notices the signal at its safe points
 * and returns after draining in-flight fetches.
 */
final class JobRunner implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(
        "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "csv", "zip"
    );

    private final CrawlJobOrchestrator orchestrator;
    private final JobContext context;
    private final CrawlJob job;
    private final JobStateMachine machine;
    private final Frontier frontier;
    private final CrawlEventBus eventBus;
    private final IterationManager iterations;
    private final CheckpointManager checkpoints;
    private final FetchWorker fetchWorker;
    private final LimitEvaluator limits;
    private final CrawlPhaseHandler phaseHandler;
    private final ExecutorService fetchExecutor;
    private final Clock clock;
    private final int fetchConcurrency;
    private final int checkpointInterval;
    private final Map<String, RobotsRules> robotsByOrigin = new ConcurrentHashMap<>();
    private final AtomicReference<Throwable> fetchFailure = new AtomicReference<>();
    private final PhaseEvents phaseEvents;

    JobRunner(
        CrawlJobOrchestrator orchestrator,
        JobContext context,
        CrawlEventBus eventBus,
        IterationManager iterations,
        CheckpointManager checkpoints,
        FetchWorker fetchWorker,
        LimitEvaluator limits,
        CrawlPhaseHandler phaseHandler,
        ExecutorService fetchExecutor,
        Clock clock,
        int defaultConcurrency,
        int defaultCheckpointInterval
    ) {
        this.orchestrator = orchestrator;
        this.context = context;
        this.job = context.job();
        this.machine = context.machine();
        this.frontier = context.frontier();
        this.eventBus = eventBus;
        this.iterations = iterations;
        this.checkpoints = checkpoints;
        this.fetchWorker = fetchWorker;
        this.limits = limits;
        this.phaseHandler = phaseHandler;
        this.phaseEvents = new PhaseEvents(eventBus, job.jobId());
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        CrawlJobConfig config = job.config();
        this.fetchConcurrency = Math.max(1, config.concurrency() > 0 ? config.concurrency() : defaultConcurrency);
        Integer interval = config.checkpointIntervalPages();
        this.checkpointInterval = interval == null ? defaultCheckpointInterval : Math.max(0, interval);
    }

    @Override
    public void run() {
        String jobId = job.jobId();
        log.info("Runner started for job {} in state {}", jobId, machine.current());
        try {
            boolean progressed = true;
            while (progressed) {
                progressed = step(machine.current());
            }
            log.info("Runner for job {} returned in state {}", jobId, machine.current());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.failJob(context, "Runner interrupted");
        } catch (Exception e) {
            log.warn("Job {} failed in state {}", jobId, machine.current(), e);
            orchestrator.failJob(context, describe(e));
        }
    }

    /** @return {@code true} if the job advanced and the next state should run */
    private boolean step(CrawlState state) throws InterruptedException {
        switch (state) {
            case QUEUED:
                return advance(CrawlState.QUEUED, CrawlState.INITIALIZING);
            case INITIALIZING:
                initialize();
                return advance(CrawlState.INITIALIZING, CrawlState.CRAWLING);
            case CRAWLING:
                if (!crawl()) {
                    return false;
                }
                return advance(CrawlState.CRAWLING, CrawlState.EXTRACTING);
            case EXTRACTING:
                if (!runPhases(CrawlState.EXTRACTING)) {
                    return false;
                }
                return advance(CrawlState.EXTRACTING, CrawlState.PROCESSING);
            case PROCESSING:
                if (!runPhases(CrawlState.PROCESSING)) {
                    return false;
                }
                complete();
                return false;
            default:
                return false;
        }
    }

    private void initialize() {
        if (context.markStartAnnounced()) {
            eventBus.publish(
                job.jobId(),
                EventKind.CRAWL_START,
                new EventPayload.CrawlStarted(job.targets(), job.mode(), job.iterationNumber(), job.config().maxPages())
            );
        }
        ensureSeeded();
    }

    private void ensureSeeded() {
        if (frontier.knownCount() > 0) {
            return;
        }
        for (String target : job.targets()) {
            if (frontier.offer(FrontierEntry.seed(target))) {
                eventBus.publish(job.jobId(), EventKind.URL_DISCOVERED, new EventPayload.UrlDiscovered(target, null, 0));
            }
        }
    }

    private boolean crawl() throws InterruptedException {
        ensureSeeded();
        for (CrawlSubstate substate : remaining(CrawlState.CRAWLING)) {
            if (!enter(substate)) {
                return false;
            }
            switch (substate) {
                case DISCOVERING_URLS -> checkRobots();
                case DOWNLOADING_PAGES -> dispatch(false);
                case DOWNLOADING_DOCUMENTS -> {
                    if (job.config().followDocuments()) {
                        dispatch(true);
                    }
                }
                default -> throw new IllegalStateException("Unexpected crawl substate " + substate);
            }
            if (halted()) {
                return false;
            }
        }
        return true;
    }

    private boolean runPhases(CrawlState state) {
        for (CrawlSubstate substate : remaining(state)) {
            if (!enter(substate)) {
                return false;
            }
            phaseHandler.handle(job, substate, frontier.snapshot().completed(), phaseEvents);
        }
        return !halted();
    }

    private void complete() {
        context.lock().lock();
        try {
            if (halted() || machine.current() != CrawlState.PROCESSING) {
                return;
            }
            ComparisonSummary summary = iterations.finalizeIteration(job.jobId());
            machine.transition(CrawlState.COMPLETED);
            JobStateSnapshot snapshot = machine.snapshot();
            JobCounters counters = snapshot.counters();
            Duration elapsed = snapshot.startedAt() == null
                ? Duration.ZERO
                : Duration.between(snapshot.startedAt(), snapshot.completedAt());
            eventBus.publish(
                job.jobId(),
                EventKind.CRAWL_COMPLETE,
                new EventPayload.CrawlCompleted(
                    counters.urlsCrawled(),
                    counters.urlsFailed(),
                    counters.documentsFound(),
                    elapsed
                )
            );
            orchestrator.persist(context);
            iterations.release(job.jobId());
            log.info(
                "Job {} completed iteration {} crawled={} failed={} new={} modified={} unchanged={} deleted={}",
                job.jobId(),
                job.iterationNumber(),
                counters.urlsCrawled(),
                counters.urlsFailed(),
                summary.newCount(),
                summary.modifiedCount(),
                summary.unchangedCount(),
                summary.deletedCount()
            );
        } finally {
            context.lock().unlock();
        }
    }

    private boolean advance(CrawlState expected, CrawlState target) {
        context.lock().lock();
        try {
            if (halted() || machine.current() != expected) {
                return false;
            }
            machine.transition(target);
            orchestrator.persist(context);
            return true;
        } finally {
            context.lock().unlock();
        }
    }

    private boolean enter(CrawlSubstate substate) {
        context.lock().lock();
        try {
            if (halted() || machine.current() != substate.owner()) {
                return false;
            }
            machine.setSubstate(substate);
            return true;
        } finally {
            context.lock().unlock();
        }
    }

    private List<CrawlSubstate> remaining(CrawlState state) {
        List<CrawlSubstate> ordered = CrawlSubstate.of(state);
        CrawlSubstate current = machine.substate();
        int start = current == null ? -1 : ordered.indexOf(current);
        return start < 0 ? ordered : ordered.subList(start, ordered.size());
    }

    /** PAUSE and CANCEL end the run; STOP only ends page dispatch. */
    private boolean halted() {
        JobContext.RunSignal signal = context.signal();
        return signal == JobContext.RunSignal.PAUSE
            || signal == JobContext.RunSignal.CANCEL
            || machine.isTerminal();
    }

    private boolean dispatchStopped() {
        return halted() || context.signal() == JobContext.RunSignal.STOP;
    }

    private void checkRobots() {
        if (!job.config().respectRobotsTxt()) {
            return;
        }
        for (String target : job.targets()) {
            String origin = originOf(target);
            if (origin == null || robotsByOrigin.containsKey(origin)) {
                continue;
            }
            RobotsRules rules = robots(origin);
            long blocked = job.targets().stream()
                .filter(seed -> origin.equals(originOf(seed)))
                .filter(seed -> !rules.allows(seed))
                .count();
            eventBus.publish(
                job.jobId(),
                EventKind.ROBOTS_TXT_CHECKED,
                new EventPayload.RobotsChecked(URI.create(origin).getHost(), rules.isPresent(), (int) blocked)
            );
        }
    }

    private RobotsRules robots(String origin) {
        return robotsByOrigin.computeIfAbsent(origin, fetchWorker::robots);
    }

    /**
     * Feeds queued URIs to the fetch executor, at most {@code fetchConcurrency} at a time, until the
     * queue is empty with nothing in flight or a signal stops dispatch. Always drains before return.
     */
    private void dispatch(boolean documents) throws InterruptedException {
        Semaphore permits = new Semaphore(fetchConcurrency);
        try {
            while (!dispatchStopped()) {
                rethrowFetchFailure();
                if (!documents && pageBoundReached()) {
                    awaitInFlight(permits);
                    if (pageBoundReached()) {
                        break;
                    }
                    continue;
                }
                permits.acquire();
                if (dispatchStopped()) {
                    permits.release();
                    break;
                }
                Optional<FrontierEntry> next = frontier.poll(documents);
                if (next.isEmpty()) {
                    permits.release();
                    awaitInFlight(permits);
                    if (!frontier.hasPending(documents)) {
                        break;
                    }
                    continue;
                }
                FrontierEntry entry = next.get();
                fetchExecutor.submit(() -> {
                    try {
                        process(entry);
                    } catch (RuntimeException e) {
                        frontier.requeue(entry.uri());
                        fetchFailure.compareAndSet(null, e);
                    } finally {
                        permits.release();
                    }
                });
            }
        } finally {
            awaitInFlight(permits);
        }
        rethrowFetchFailure();
    }

    /** Counters move before the frontier releases an entry, so this never under-counts. */
    private boolean pageBoundReached() {
        int maxPages = job.config().maxPages();
        return maxPages > 0 && machine.counters().urlsCrawled() + frontier.inFlightCount() >= maxPages;
    }

    private void awaitInFlight(Semaphore permits) throws InterruptedException {
        permits.acquire(fetchConcurrency);
        permits.release(fetchConcurrency);
    }

    private void rethrowFetchFailure() {
        Throwable failure = fetchFailure.get();
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (failure != null) {
            throw new IllegalStateException(failure);
        }
    }

    private void process(FrontierEntry entry) {
        String uri = entry.uri();
        if (job.config().respectRobotsTxt()) {
            String origin = originOf(uri);
            if (origin != null && !robots(origin).allows(uri)) {
                recordFailure(entry, "ROBOTS_BLOCKED", 0);
                return;
            }
        }
        IterationManager.IterationContext iteration = iterations.context(job.jobId());
        boolean incremental = iteration.mode() == IterationMode.INCREMENTAL;
        if (incremental && !entry.document()) {
            ResourceValidators probed = fetchWorker.probe(uri);
            if (!probed.isEmpty() && !iterations.shouldFetch(job.jobId(), uri, probed)) {
                iterations.recordUnchanged(job.jobId(), uri);
                recordSkipped(entry);
                return;
            }
        }
        ResourceValidators previous = incremental
            ? iterations.priorFingerprint(job.jobId(), uri).map(ResourceFingerprint::validators).orElse(ResourceValidators.none())
            : ResourceValidators.none();
        FetchOutcome outcome;
        try {
            outcome = fetchWorker.fetch(
                uri,
                new FetchContext(job.jobId(), iteration.iterationNumber(), iteration.mode(), previous, entry.document())
            );
        } catch (FetchFailureException e) {
            outcome = FetchOutcome.error(uri, "fetch_failure", e.getMessage(), Duration.ZERO);
        }
        if (outcome == null) {
            outcome = FetchOutcome.error(uri, "no_outcome", "Fetch worker returned nothing", Duration.ZERO);
        }
        if (outcome.isRateLimited()) {
            eventBus.publish(job.jobId(), EventKind.RATE_LIMIT_HIT, new EventPayload.RateLimitHit(uri, outcome.statusCode()));
        }
        if (machine.isTerminal()) {
            return;
        }
        if (outcome.isNotModified()) {
            ChangeType change = iterations.recordUnchanged(job.jobId(), uri);
            recordFetched(entry, outcome, change);
        } else if (outcome.isSuccessful()) {
            ChangeType change = iterations.recordFingerprint(
                job.jobId(),
                outcome.toFingerprint(iteration.iterationNumber(), clock.instant())
            );
            recordFetched(entry, outcome, change);
        } else {
            recordFailure(entry, outcome.failureReason(), outcome.statusCode());
        }
    }

    private void recordSkipped(FrontierEntry entry) {
        context.lock().lock();
        try {
            if (machine.isTerminal()) {
                return;
            }
            machine.recordCrawled(true);
            frontier.complete(entry.uri());
            eventBus.publish(
                job.jobId(),
                EventKind.PAGE_CRAWLED,
                new EventPayload.PageCrawled(entry.uri(), 304, 0, 0, ChangeType.UNCHANGED, false)
            );
            afterOutcome(true);
        } finally {
            context.lock().unlock();
        }
    }

    private void recordFetched(FrontierEntry entry, FetchOutcome outcome, ChangeType change) {
        context.lock().lock();
        try {
            if (machine.isTerminal()) {
                return;
            }
            machine.recordCrawled(false);
            frontier.complete(entry.uri());
            long durationMs = outcome.duration().toMillis();
            if (entry.document()) {
                eventBus.publish(
                    job.jobId(),
                    EventKind.DOCUMENT_DOWNLOADED,
                    new EventPayload.DocumentDownloaded(entry.uri(), outcome.contentLength(), durationMs)
                );
            } else {
                eventBus.publish(
                    job.jobId(),
                    EventKind.PAGE_CRAWLED,
                    new EventPayload.PageCrawled(
                        entry.uri(),
                        outcome.statusCode(),
                        outcome.contentLength(),
                        durationMs,
                        change,
                        true
                    )
                );
                discover(entry, outcome.links());
            }
            afterOutcome(true);
        } finally {
            context.lock().unlock();
        }
    }

    private void recordFailure(FrontierEntry entry, String reason, int statusCode) {
        context.lock().lock();
        try {
            if (machine.isTerminal()) {
                return;
            }
            frontier.fail(entry.uri());
            machine.recordFailed();
            eventBus.publish(job.jobId(), EventKind.PAGE_FAILED, new EventPayload.PageFailed(entry.uri(), reason, statusCode));
            afterOutcome(false);
        } finally {
            context.lock().unlock();
        }
    }

    private void discover(FrontierEntry source, List<String> links) {
        String sourceHost = hostOf(source.uri());
        int depth = source.depth() + 1;
        int maxDepth = job.config().maxDepth();
        for (String link : links) {
            String documentType = documentType(link);
            if (documentType != null) {
                if (frontier.offer(new FrontierEntry(link, depth, source.uri(), true))) {
                    machine.recordDocumentFound();
                    eventBus.publish(
                        job.jobId(),
                        EventKind.DOCUMENT_FOUND,
                        new EventPayload.DocumentFound(link, source.uri(), documentType)
                    );
                }
                continue;
            }
            if (sourceHost == null || !sourceHost.equals(hostOf(link)) || (maxDepth > 0 && depth > maxDepth)) {
                continue;
            }
            if (frontier.offer(new FrontierEntry(link, depth, source.uri(), false))) {
                eventBus.publish(job.jobId(), EventKind.URL_DISCOVERED, new EventPayload.UrlDiscovered(link, source.uri(), depth));
            }
        }
    }

    /** Runs with the job lock held. */
    private void afterOutcome(boolean success) {
        JobCounters counters = machine.counters();
        long done = counters.attempts();
        long total = job.config().maxPages() > 0
            ? Math.min(job.config().maxPages(), frontier.knownCount())
            : frontier.knownCount();
        double percent = total == 0 ? 0.0 : Math.min(100.0, done * 100.0 / total);
        eventBus.publish(job.jobId(), EventKind.PROGRESS_UPDATE, new EventPayload.ProgressUpdated(done, total, percent));

        if (context.signal() != JobContext.RunSignal.NONE) {
            return;
        }
        if (!success && limits.failureRateExceeded(job.config(), counters)) {
            orchestrator.failLocked(
                context,
                String.format(Locale.ROOT, "Failure rate %.2f exceeded threshold after %d attempts", counters.failureRate(), done)
            );
            return;
        }
        if (success && context.countPageTowardsCheckpoint(checkpointInterval)) {
            checkpoints.createCheckpoint(job.jobId(), CheckpointType.AUTO);
            orchestrator.persist(context);
        }
        Duration elapsed = LimitEvaluator.elapsed(machine.snapshot().startedAt(), clock.instant());
        List<LimitBreach> breaches = limits.evaluate(job.config(), counters, elapsed, context::hasFired);
        limits.resolve(breaches, job.config()).ifPresent(this::applyLimit);
    }

    private void applyLimit(LimitBreach breach) {
        context.markLimitFired(breach.limit());
        log.info("Job {} hit limit {}: {} -> {}", job.jobId(), breach.limit(), breach.reason(), breach.action());
        switch (breach.action()) {
            case CANCEL -> orchestrator.cancelLocked(context, breach.reason());
            case PAUSE -> orchestrator.pauseLocked(context, breach.reason());
            case STOP -> {
                context.raise(JobContext.RunSignal.STOP);
                eventBus.publish(
                    job.jobId(),
                    EventKind.INFO,
                    new EventPayload.Message("Crawl stopped at limit", breach.reason())
                );
            }
            case WARN -> eventBus.publish(
                job.jobId(),
                EventKind.WARNING,
                new EventPayload.Message("Limit threshold reached", breach.reason())
            );
        }
    }

    static String documentType(String uri) {
        String path;
        try {
            path = URI.create(uri).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path == null) {
            return null;
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot < path.lastIndexOf('/')) {
            return null;
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return DOCUMENT_EXTENSIONS.contains(extension) ? extension : null;
    }

    static String originOf(String uri) {
        try {
            URI parsed = URI.create(uri);
            if (parsed.getScheme() == null || parsed.getHost() == null) {
                return null;
            }
            String origin = parsed.getScheme().toLowerCase(Locale.ROOT) + "://" + parsed.getHost().toLowerCase(Locale.ROOT);
            return parsed.getPort() > 0 ? origin + ":" + parsed.getPort() : origin;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String hostOf(String uri) {
        try {
            String host = URI.create(uri).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
