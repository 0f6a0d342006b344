package com.creditsim.simulator.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of {@link AdaptiveClearingPolicy}. Bound from {@code simulator.adaptive.*}.
 *
 * <p>{@code globalMaxDepthCeiling} and {@code globalTimeBudgetMsCeiling} come from the static
 * clearing settings; the policy never chooses a depth or budget above them.
 */
public record AdaptiveClearingPolicyConfig(
    int    windowTicks,
    double highRejectionRate,
    double lowRejectionRate,
    int    minIntervalTicks,
    int    backoffMaxIntervalTicks,
    int    maxDepthMin,
    int    maxDepthMax,
    int    timeBudgetMsMin,
    int    timeBudgetMsMax,
    int    globalMaxDepthCeiling,
    int    globalTimeBudgetMsCeiling,
    int    warmupFallbackCadence
) {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveClearingPolicyConfig.class);

    public AdaptiveClearingPolicyConfig {
        if (windowTicks < 1) {
            log.warn("[AdaptivePolicy] windowTicks={} < 1, using 1", windowTicks);
            windowTicks = 1;
        }
        if (!(0.0 <= lowRejectionRate && lowRejectionRate < highRejectionRate && highRejectionRate <= 1.0)) {
            log.warn("[AdaptivePolicy] Invalid thresholds, require 0 <= low < high <= 1. low={} high={}",
                     lowRejectionRate, highRejectionRate);
        }
        if (minIntervalTicks < 1) {
            log.warn("[AdaptivePolicy] minIntervalTicks={} < 1, cooldown disabled", minIntervalTicks);
        }
        if (timeBudgetMsMin > timeBudgetMsMax) {
            log.warn("[AdaptivePolicy] timeBudgetMsMin={} > timeBudgetMsMax={}", timeBudgetMsMin, timeBudgetMsMax);
        }
        if (maxDepthMin > maxDepthMax) {
            log.warn("[AdaptivePolicy] maxDepthMin={} > maxDepthMax={}", maxDepthMin, maxDepthMax);
        }
    }

    public static AdaptiveClearingPolicyConfig defaults() {
        return new AdaptiveClearingPolicyConfig(30, 0.60, 0.30, 5, 60, 3, 6, 50, 250, 6, 250, 0);
    }

    public AdaptiveClearingPolicyConfig withWindowTicks(int value) {
        return new AdaptiveClearingPolicyConfig(value, highRejectionRate, lowRejectionRate, minIntervalTicks,
            backoffMaxIntervalTicks, maxDepthMin, maxDepthMax, timeBudgetMsMin, timeBudgetMsMax,
            globalMaxDepthCeiling, globalTimeBudgetMsCeiling, warmupFallbackCadence);
    }

    public AdaptiveClearingPolicyConfig withWarmupFallbackCadence(int value) {
        return new AdaptiveClearingPolicyConfig(windowTicks, highRejectionRate, lowRejectionRate, minIntervalTicks,
            backoffMaxIntervalTicks, maxDepthMin, maxDepthMax, timeBudgetMsMin, timeBudgetMsMax,
            globalMaxDepthCeiling, globalTimeBudgetMsCeiling, value);
    }

    /** Caps the ceilings at the static clearing envelope. */
    public AdaptiveClearingPolicyConfig withCeilings(int maxDepth, int timeBudgetMs) {
        return new AdaptiveClearingPolicyConfig(windowTicks, highRejectionRate, lowRejectionRate, minIntervalTicks,
            backoffMaxIntervalTicks, maxDepthMin, maxDepthMax, timeBudgetMsMin, timeBudgetMsMax,
            Math.min(globalMaxDepthCeiling, maxDepth), Math.min(globalTimeBudgetMsCeiling, timeBudgetMs),
            warmupFallbackCadence);
    }
}
