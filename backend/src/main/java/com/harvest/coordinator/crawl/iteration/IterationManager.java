package com.harvest.coordinator.crawl.iteration;

import com.harvest.coordinator.crawl.fingerprint.ChangeDetector;
import com.harvest.coordinator.crawl.fingerprint.FingerprintStore;
import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import com.harvest.coordinator.crawl.persistence.IterationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Links repeated runs of a lineage and decides what each run has to fetch.
 *
 * <p>Each running job is bound to exactly one iteration. Change decisions are always made against
 * the iteration's parent, which is the most recent iteration that completed before it started.
 */
@Service
public class IterationManager {
    private static final Logger log = LoggerFactory.getLogger(IterationManager.class);

    private final IterationRepository iterations;
    private final FingerprintStore fingerprints;
    private final Clock clock;
    private final Map<String, IterationContext> bindings = new ConcurrentHashMap<>();

    public IterationManager(IterationRepository iterations, FingerprintStore fingerprints, Clock clock) {
        this.iterations = iterations;
        this.fingerprints = fingerprints;
        this.clock = clock;
    }

    public record IterationContext(String lineageId, int iterationNumber, IterationMode mode, Integer parentIteration) {
    }

    /**
     * Works out the number, mode and parent of the next iteration of a lineage.
     *
     * @throws NoBaselineException if {@code mode} is INCREMENTAL and no iteration has completed yet
     */
    public IterationContext planNext(String lineageId, IterationMode mode) {
        Optional<Iteration> latestCompleted = iterations.findLatestCompleted(lineageId);
        if (latestCompleted.isEmpty() && mode == IterationMode.INCREMENTAL) {
            throw new NoBaselineException(lineageId);
        }
        int next = iterations.findMaxIterationNumber(lineageId).map(max -> max + 1).orElse(0);
        Integer parent = latestCompleted.map(Iteration::iterationNumber).orElse(null);
        IterationMode effectiveMode = next == 0 ? IterationMode.BASELINE : mode;
        return new IterationContext(lineageId, next, effectiveMode, parent);
    }

    public Iteration start(String jobId, IterationContext context) {
        Iteration iteration = new Iteration(
            context.lineageId(),
            context.iterationNumber(),
            jobId,
            context.mode(),
            context.parentIteration(),
            clock.instant(),
            null,
            null
        );
        iterations.insert(iteration);
        bindings.put(jobId, context);
        log.info(
            "Started iteration {} ({}) of lineage {} for job {} parent={}",
            context.iterationNumber(),
            context.mode(),
            context.lineageId(),
            jobId,
            context.parentIteration()
        );
        return iteration;
    }

    /** Attaches a recovery job to an iteration another job started. */
    public IterationContext attach(String jobId, String lineageId, int iterationNumber) {
        Iteration iteration = iterations.find(lineageId, iterationNumber)
            .orElseThrow(() -> new IllegalStateException(
                "Iteration " + iterationNumber + " of lineage " + lineageId + " does not exist"
            ));
        iterations.reassign(lineageId, iterationNumber, jobId);
        IterationContext context = new IterationContext(
            lineageId,
            iterationNumber,
            iteration.mode(),
            iteration.parentIteration()
        );
        bindings.put(jobId, context);
        return context;
    }

    public IterationContext context(String jobId) {
        IterationContext bound = bindings.get(jobId);
        if (bound != null) {
            return bound;
        }
        Iteration iteration = iterations.findByJobId(jobId)
            .orElseThrow(() -> new IllegalStateException("Job " + jobId + " is not bound to an iteration"));
        IterationContext context = new IterationContext(
            iteration.lineageId(),
            iteration.iterationNumber(),
            iteration.mode(),
            iteration.parentIteration()
        );
        bindings.put(jobId, context);
        return context;
    }

    public void release(String jobId) {
        bindings.remove(jobId);
    }

    /**
     * Decision without fresh validators: only an INCREMENTAL run with a prior fingerprint could skip,
     * and without validators to compare it has to fetch.
     */
    public boolean shouldFetch(String jobId, String uri) {
        return shouldFetch(jobId, uri, ResourceValidators.none());
    }

    public boolean shouldFetch(String jobId, String uri, ResourceValidators current) {
        IterationContext context = context(jobId);
        if (context.mode() != IterationMode.INCREMENTAL) {
            return true;
        }
        Optional<ResourceFingerprint> prior = priorFingerprint(context, uri);
        if (prior.isEmpty()) {
            return true;
        }
        ChangeDetector.Verdict verdict = ChangeDetector.compare(prior.get(), current);
        log.debug("Change check for {} in job {}: {} by {}", uri, jobId, verdict.change(), verdict.basis());
        return verdict.change() != ChangeType.UNCHANGED;
    }

    public Optional<ResourceFingerprint> priorFingerprint(String jobId, String uri) {
        return priorFingerprint(context(jobId), uri);
    }

    /**
     * Stores the fingerprint of a fetched resource under the job's iteration. A resource identical to
     * its parent fingerprint is carried over instead, so no new fingerprint row appears for it.
     *
     * @return how the resource changed relative to the parent iteration
     */
    public ChangeType recordFingerprint(String jobId, ResourceFingerprint fingerprint) {
        IterationContext context = context(jobId);
        ResourceFingerprint stamped = fingerprint.forIteration(context.iterationNumber());
        Optional<ResourceFingerprint> prior = priorFingerprint(context, fingerprint.uri());
        if (prior.isPresent() && prior.get().sameAs(stamped)) {
            fingerprints.carryOver(
                context.lineageId(),
                context.iterationNumber(),
                fingerprint.uri(),
                prior.get().iterationNumber()
            );
            return ChangeType.UNCHANGED;
        }
        fingerprints.record(context.lineageId(), stamped);
        if (prior.isEmpty()) {
            return ChangeType.NEW;
        }
        return ChangeDetector.compareContent(prior.get(), stamped);
    }

    /** Records a resource that was skipped or answered 304 as unchanged from the parent iteration. */
    public ChangeType recordUnchanged(String jobId, String uri) {
        IterationContext context = context(jobId);
        Optional<ResourceFingerprint> prior = priorFingerprint(context, uri);
        if (prior.isEmpty()) {
            log.warn("No prior fingerprint to carry over for {} in job {}", uri, jobId);
            return ChangeType.NEW;
        }
        fingerprints.carryOver(context.lineageId(), context.iterationNumber(), uri, prior.get().iterationNumber());
        return ChangeType.UNCHANGED;
    }

    public IterationComparison compare(String lineageId, int baselineIteration, int currentIteration) {
        requireIteration(lineageId, baselineIteration);
        requireIteration(lineageId, currentIteration);
        Map<String, ResourceFingerprint> before = fingerprints.effectiveSet(lineageId, baselineIteration);
        Map<String, ResourceFingerprint> after = fingerprints.effectiveSet(lineageId, currentIteration);

        Set<String> added = new LinkedHashSet<>();
        Set<String> modified = new LinkedHashSet<>();
        Set<String> unchanged = new LinkedHashSet<>();
        Set<String> deleted = new LinkedHashSet<>();
        Set<String> union = new LinkedHashSet<>(before.keySet());
        union.addAll(after.keySet());
        for (String uri : union) {
            ChangeType change = ChangeDetector.compareContent(before.get(uri), after.get(uri));
            switch (change) {
                case NEW -> added.add(uri);
                case MODIFIED -> modified.add(uri);
                case UNCHANGED -> unchanged.add(uri);
                case DELETED -> deleted.add(uri);
            }
        }
        return new IterationComparison(
            lineageId,
            baselineIteration,
            currentIteration,
            added,
            modified,
            unchanged,
            deleted
        );
    }

    /**
     * Marks the job's iteration complete and stores its comparison against the parent. A baseline
     * counts every resource as new.
     */
    public ComparisonSummary finalizeIteration(String jobId) {
        IterationContext context = context(jobId);
        ComparisonSummary summary;
        if (context.parentIteration() == null) {
            int recorded = fingerprints.effectiveSet(context.lineageId(), context.iterationNumber()).size();
            summary = new ComparisonSummary(recorded, 0, 0, 0);
        } else {
            summary = compare(context.lineageId(), context.parentIteration(), context.iterationNumber()).summary();
        }
        iterations.complete(context.lineageId(), context.iterationNumber(), clock.instant(), summary);
        log.info(
            "Finalized iteration {} of lineage {}: new={} modified={} unchanged={} deleted={}",
            context.iterationNumber(),
            context.lineageId(),
            summary.newCount(),
            summary.modifiedCount(),
            summary.unchangedCount(),
            summary.deletedCount()
        );
        return summary;
    }

    public List<Iteration> iterations(String lineageId) {
        return iterations.findByLineage(lineageId);
    }

    public Optional<Iteration> find(String lineageId, int iterationNumber) {
        return iterations.find(lineageId, iterationNumber);
    }

    /** Parent chain ending at {@code iterationNumber}, baseline first. */
    public List<Iteration> chain(String lineageId, int iterationNumber) {
        List<Iteration> chain = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Optional<Iteration> cursor = iterations.find(lineageId, iterationNumber);
        while (cursor.isPresent() && visited.add(cursor.get().iterationNumber())) {
            Iteration iteration = cursor.get();
            chain.add(iteration);
            cursor = iteration.parentIteration() == null
                ? Optional.empty()
                : iterations.find(lineageId, iteration.parentIteration());
        }
        Collections.reverse(chain);
        return chain;
    }

    private Optional<ResourceFingerprint> priorFingerprint(IterationContext context, String uri) {
        if (context.parentIteration() == null) {
            return Optional.empty();
        }
        return fingerprints.effective(context.lineageId(), context.parentIteration(), uri);
    }

    private void requireIteration(String lineageId, int iterationNumber) {
        if (iterations.find(lineageId, iterationNumber).isEmpty()) {
            throw new IllegalArgumentException("Iteration " + iterationNumber + " of lineage " + lineageId + " does not exist");
        }
    }
}
