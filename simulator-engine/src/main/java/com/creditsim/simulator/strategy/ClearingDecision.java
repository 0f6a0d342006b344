package com.creditsim.simulator.strategy;

/**
 * Whether to clear one equivalent this tick, and with what budget.
 *
 * @param maxDepth     {@code 0} when {@code shouldRun} is false
 * @param timeBudgetMs {@code 0} when {@code shouldRun} is false
 */
public record ClearingDecision(boolean shouldRun, String reason, int maxDepth, int timeBudgetMs) {

    public static final String WARMUP_FALLBACK_RUN  = "WARMUP_FALLBACK_RUN";
    public static final String WARMUP_FALLBACK_SKIP = "WARMUP_FALLBACK_SKIP";
    public static final String WARMUP_DISABLED      = "WARMUP_DISABLED";
    public static final String RATE_HIGH_ENTER      = "RATE_HIGH_ENTER";
    public static final String RATE_LOW_EXIT        = "RATE_LOW_EXIT";
    public static final String RUN_ACTIVE           = "RUN_ACTIVE";
    public static final String SKIP_NOT_ACTIVE      = "SKIP_NOT_ACTIVE";
    public static final String SKIP_MIN_INTERVAL    = "SKIP_MIN_INTERVAL";
    public static final String SKIP_BACKOFF         = "SKIP_BACKOFF";

    public static ClearingDecision skip(String reason) {
        return new ClearingDecision(false, reason, 0, 0);
    }

    public static ClearingDecision run(String reason, int maxDepth, int timeBudgetMs) {
        return new ClearingDecision(true, reason, maxDepth, timeBudgetMs);
    }
}
