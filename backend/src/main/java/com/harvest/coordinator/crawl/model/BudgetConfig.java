package com.harvest.coordinator.crawl.model;

/**
 * Spend budget for a job. A {@code maxCost} of zero disables budget checks.
 */
public record BudgetConfig(
    double maxCost,
    double costPerPage,
    int warnAtPercent,
    int pauseAtPercent,
    boolean hardStopAt100
) {
    public static final double DEFAULT_COST_PER_PAGE = 0.001;

    public BudgetConfig {
        maxCost = Math.max(0.0, maxCost);
        costPerPage = costPerPage <= 0 ? DEFAULT_COST_PER_PAGE : costPerPage;
        warnAtPercent = warnAtPercent <= 0 ? 80 : Math.min(100, warnAtPercent);
        pauseAtPercent = pauseAtPercent <= 0 ? 95 : Math.min(100, pauseAtPercent);
    }

    public static BudgetConfig unlimited() {
        return new BudgetConfig(0.0, DEFAULT_COST_PER_PAGE, 80, 95, true);
    }

    public boolean isEnabled() {
        return maxCost > 0;
    }

    public double spent(long pages) {
        return pages * costPerPage;
    }
}
