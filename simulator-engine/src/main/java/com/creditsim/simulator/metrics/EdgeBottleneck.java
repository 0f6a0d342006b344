package com.creditsim.simulator.metrics;

/**
 * A payment-direction edge that failed often this tick.
 *
 * @param targetId {@code from->to}
 * @param score    {@code (errors + timeouts + rejected) / attempts}, in (0, 1]
 */
public record EdgeBottleneck(
    String equivalent,
    String targetId,
    double score,
    String reasonCode,
    int    attempts,
    int    committed,
    int    rejected,
    int    errors,
    int    timeouts
) {

    public static final String TOO_MANY_TIMEOUTS = "TOO_MANY_TIMEOUTS";
    public static final String FREQUENT_ABORTS   = "FREQUENT_ABORTS";
    public static final String HIGH_USED         = "HIGH_USED";
}
