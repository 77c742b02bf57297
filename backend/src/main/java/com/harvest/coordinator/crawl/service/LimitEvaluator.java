package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.model.BudgetConfig;
import com.harvest.coordinator.crawl.model.CrawlJobConfig;
import com.harvest.coordinator.crawl.model.LimitAction;
import com.harvest.coordinator.crawl.state.JobCounters;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Checks a job's counters against its page, document, duration and budget limits and picks the
 * action to take when several trip together.
 */
@Component
public class LimitEvaluator {
    private final CoordinatorProperties.Limits defaults;

    public LimitEvaluator(CoordinatorProperties properties) {
        this.defaults = properties.getLimits();
    }

    /**
     * @param elapsed running time, or {@code null} to skip the duration check
     * @param alreadyFired limits that fired earlier in this job; pause and warn limits do not repeat
     */
    public List<LimitBreach> evaluate(
        CrawlJobConfig config,
        JobCounters counters,
        Duration elapsed,
        Predicate<String> alreadyFired
    ) {
        List<LimitBreach> breaches = new ArrayList<>();
        if (config.maxPages() > 0 && counters.urlsCrawled() >= config.maxPages()) {
            boolean pause = config.pauseAtLimit() && !alreadyFired.test(LimitBreach.MAX_PAGES);
            breaches.add(new LimitBreach(
                LimitBreach.MAX_PAGES,
                pause ? LimitAction.PAUSE : LimitAction.STOP,
                "Reached max pages " + config.maxPages()
            ));
        }
        if (config.maxDocuments() > 0 && counters.documentsFound() >= config.maxDocuments()) {
            breaches.add(new LimitBreach(
                LimitBreach.MAX_DOCUMENTS,
                LimitAction.STOP,
                "Reached max documents " + config.maxDocuments()
            ));
        }
        durationBreach(config, elapsed).ifPresent(breaches::add);
        evaluateBudget(config.budget(), counters, alreadyFired, breaches);
        return breaches;
    }

    /** @param elapsed running time, or {@code null} when unknown */
    public Optional<LimitBreach> durationBreach(CrawlJobConfig config, Duration elapsed) {
        if (elapsed == null
            || config.maxDurationMinutes() <= 0
            || elapsed.compareTo(Duration.ofMinutes(config.maxDurationMinutes())) < 0) {
            return Optional.empty();
        }
        return Optional.of(new LimitBreach(
            LimitBreach.MAX_DURATION,
            LimitAction.CANCEL,
            "Exceeded max duration of " + config.maxDurationMinutes() + " minutes"
        ));
    }

    /** Time since the job entered INITIALIZING, or {@code null} if it has not started yet. */
    public static Duration elapsed(Instant startedAt, Instant now) {
        return startedAt == null ? null : Duration.between(startedAt, now);
    }

    public Optional<LimitBreach> resolve(List<LimitBreach> breaches, CrawlJobConfig config) {
        List<LimitAction> order = precedenceFor(config);
        return breaches.stream().min(Comparator.comparingInt(breach -> order.indexOf(breach.action())));
    }

    public List<LimitAction> precedenceFor(CrawlJobConfig config) {
        if (config.limitPrecedence().isEmpty()) {
            return defaults.getPrecedence();
        }
        return CoordinatorProperties.Limits.completePrecedence(config.limitPrecedence());
    }

    /** Only judged once enough URLs were attempted for the rate to mean something. */
    public boolean failureRateExceeded(CrawlJobConfig config, JobCounters counters) {
        if (counters.attempts() < defaults.getMinAttemptsForFailureRate()) {
            return false;
        }
        double threshold = config.failureRateThreshold() == null
            ? defaults.getFailureRateThreshold()
            : Math.min(1.0, Math.max(0.0, config.failureRateThreshold()));
        return counters.failureRate() > threshold;
    }

    private void evaluateBudget(
        BudgetConfig budget,
        JobCounters counters,
        Predicate<String> alreadyFired,
        List<LimitBreach> breaches
    ) {
        if (!budget.isEnabled()) {
            return;
        }
        double spent = budget.spent(counters.urlsCrawled() - counters.urlsSkipped());
        double percent = spent / budget.maxCost() * 100.0;
        String detail = String.format(Locale.ROOT, "%.1f%% of budget %.2f spent", percent, budget.maxCost());
        if (percent >= 100.0 && budget.hardStopAt100()) {
            breaches.add(new LimitBreach(LimitBreach.BUDGET_EXHAUSTED, LimitAction.STOP, detail));
        }
        if (percent >= budget.pauseAtPercent() && !alreadyFired.test(LimitBreach.BUDGET_PAUSE)) {
            breaches.add(new LimitBreach(LimitBreach.BUDGET_PAUSE, LimitAction.PAUSE, detail));
        }
        if (percent >= budget.warnAtPercent() && !alreadyFired.test(LimitBreach.BUDGET_WARN)) {
            breaches.add(new LimitBreach(LimitBreach.BUDGET_WARN, LimitAction.WARN, detail));
        }
    }
}
