package com.creditsim.simulator.drift;

import com.creditsim.common.model.ScenarioSettings;

/**
 * Trust-drift parameters, parsed once from scenario settings and fixed for the run.
 */
public record TrustDriftConfig(
    boolean enabled,
    double  growthRate,
    double  decayRate,
    double  maxGrowth,
    double  minLimitRatio,
    double  overloadThreshold
) {

    public static final double DEFAULT_GROWTH_RATE        = 0.05;
    public static final double DEFAULT_DECAY_RATE         = 0.02;
    public static final double DEFAULT_MAX_GROWTH         = 2.0;
    public static final double DEFAULT_MIN_LIMIT_RATIO    = 0.3;
    public static final double DEFAULT_OVERLOAD_THRESHOLD = 0.8;

    public static TrustDriftConfig disabled() {
        return new TrustDriftConfig(false, DEFAULT_GROWTH_RATE, DEFAULT_DECAY_RATE,
            DEFAULT_MAX_GROWTH, DEFAULT_MIN_LIMIT_RATIO, DEFAULT_OVERLOAD_THRESHOLD);
    }

    public static TrustDriftConfig from(ScenarioSettings settings) {
        ScenarioSettings.TrustDrift td = settings != null ? settings.trustDrift() : null;
        if (td == null) {
            return disabled();
        }
        return new TrustDriftConfig(
            Boolean.TRUE.equals(td.enabled()),
            orDefault(td.growthRate(),        DEFAULT_GROWTH_RATE),
            orDefault(td.decayRate(),         DEFAULT_DECAY_RATE),
            orDefault(td.maxGrowth(),         DEFAULT_MAX_GROWTH),
            orDefault(td.minLimitRatio(),     DEFAULT_MIN_LIMIT_RATIO),
            orDefault(td.overloadThreshold(), DEFAULT_OVERLOAD_THRESHOLD));
    }

    private static double orDefault(Double value, double fallback) {
        return value != null && Double.isFinite(value) ? value : fallback;
    }
}
