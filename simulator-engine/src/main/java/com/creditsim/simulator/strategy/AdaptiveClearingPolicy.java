package com.creditsim.simulator.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feedback-controlled clearing cadence, one instance per run.
 *
 * <p>Each equivalent keeps a rolling window of {@code (attempted, rejectedNoCapacity)}
 * per tick. Until the window is full the policy either skips or, when a warm-up cadence
 * is configured, runs at minimal budget. Once full:
 * <ul>
 *   <li>the equivalent becomes active when the no-capacity rate reaches
 *       {@code highRejectionRate} and inactive when it drops below {@code lowRejectionRate};</li>
 *   <li>an active equivalent clears unless it cleared less than {@code minIntervalTicks}
 *       ago, or less than its current back-off interval ago;</li>
 *   <li>depth and budget scale linearly with pressure between their bounds and never
 *       exceed the global ceilings.</li>
 * </ul>
 * A pass that clears nothing doubles the back-off interval, up to
 * {@code backoffMaxIntervalTicks}; a productive pass resets it.
 */
public class AdaptiveClearingPolicy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveClearingPolicy.class);

    static final double ZERO_VOLUME_EPS = 1e-9;

    private final AdaptiveClearingPolicyConfig   config;
    private final Map<String, EquivalentState>   states = new ConcurrentHashMap<>();

    public AdaptiveClearingPolicy(AdaptiveClearingPolicyConfig config) {
        this.config = config;
    }

    public AdaptiveClearingPolicyConfig getConfig() {
        return config;
    }

    // ── signals ────────────────────────────────────────────────────────────────

    public void recordSignals(String equivalent, TickSignals signals) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            s.window.addLast(new int[] {signals.attempted(), signals.rejectedNoCapacity()});
            while (s.window.size() > config.windowTicks()) {
                s.window.pollFirst();
            }
        }
    }

    public void recordResult(String equivalent, long tick, BigDecimal volume, long costMs) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            s.lastClearingTick   = tick;
            s.lastClearingVolume = volume != null ? volume : BigDecimal.ZERO;
            s.lastClearingCostMs = costMs;
            if (s.lastClearingVolume.doubleValue() < ZERO_VOLUME_EPS) {
                s.consecutiveZeroYield++;
                int minInterval = Math.max(1, config.minIntervalTicks());
                int maxInterval = Math.max(minInterval, config.backoffMaxIntervalTicks());
                int exp         = Math.max(0, s.consecutiveZeroYield - 1);
                long interval   = Math.min(maxInterval, (long) minInterval << Math.min(exp, 30));
                s.backoffInterval = (int) Math.max(minInterval, interval);
                log.debug("[AdaptivePolicy] Zero yield. eq={} tick={} streak={} backoff={}",
                          equivalent, tick, s.consecutiveZeroYield, s.backoffInterval);
            } else {
                s.consecutiveZeroYield = 0;
                s.backoffInterval      = 0;
            }
        }
    }

    public double noCapacityRate(String equivalent) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            long attempted = 0;
            long rejected  = 0;
            for (int[] entry : s.window) {
                attempted += entry[0];
                rejected  += entry[1];
            }
            return attempted == 0 ? 0.0 : (double) rejected / attempted;
        }
    }

    public int windowFill(String equivalent) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            return s.window.size();
        }
    }

    public int backoffInterval(String equivalent) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            return s.backoffInterval;
        }
    }

    public boolean isActive(String equivalent) {
        EquivalentState s = state(equivalent);
        synchronized (s) {
            return s.active;
        }
    }

    // ── decision ───────────────────────────────────────────────────────────────

    public ClearingDecision evaluate(String equivalent, long tick) {
        EquivalentState s = state(equivalent);
        double rate = noCapacityRate(equivalent);
        synchronized (s) {
            if (s.window.size() < config.windowTicks()) {
                if (config.warmupFallbackCadence() <= 0) {
                    return ClearingDecision.skip(ClearingDecision.WARMUP_DISABLED);
                }
                if (tick % config.warmupFallbackCadence() != 0) {
                    return ClearingDecision.skip(ClearingDecision.WARMUP_FALLBACK_SKIP);
                }
                ClearingDecision blocked = checkIntervals(s, tick);
                return blocked != null ? blocked : minimalDecision();
            }

            boolean wasActive = s.active;
            if (rate >= config.highRejectionRate()) {
                s.active = true;
            } else if (rate < config.lowRejectionRate()) {
                s.active = false;
            }
            if (wasActive && !s.active) {
                return ClearingDecision.skip(ClearingDecision.RATE_LOW_EXIT);
            }
            if (!s.active) {
                return ClearingDecision.skip(ClearingDecision.SKIP_NOT_ACTIVE);
            }
            ClearingDecision blocked = checkIntervals(s, tick);
            if (blocked != null) {
                return blocked;
            }
            return scaledDecision(rate, wasActive ? ClearingDecision.RUN_ACTIVE : ClearingDecision.RATE_HIGH_ENTER);
        }
    }

    private ClearingDecision checkIntervals(EquivalentState s, long tick) {
        if (s.lastClearingTick < 0) {
            return null;
        }
        long since = tick - s.lastClearingTick;
        if (since < config.minIntervalTicks()) {
            return ClearingDecision.skip(ClearingDecision.SKIP_MIN_INTERVAL);
        }
        if (s.backoffInterval > 0 && since < s.backoffInterval) {
            return ClearingDecision.skip(ClearingDecision.SKIP_BACKOFF);
        }
        return null;
    }

    private ClearingDecision scaledDecision(double rate, String reason) {
        double pressure = normalize(rate, config.lowRejectionRate(), config.highRejectionRate());
        double rawDepth  = config.maxDepthMin() + pressure * (config.maxDepthMax() - config.maxDepthMin());
        double rawBudget = config.timeBudgetMsMin() + pressure * (config.timeBudgetMsMax() - config.timeBudgetMsMin());
        int depth  = clamp((int) rawDepth, config.maxDepthMin(),
                           Math.min(config.maxDepthMax(), config.globalMaxDepthCeiling()));
        int budget = clamp((int) rawBudget, config.timeBudgetMsMin(),
                           Math.min(config.timeBudgetMsMax(), config.globalTimeBudgetMsCeiling()));
        return ClearingDecision.run(reason, depth, budget);
    }

    private ClearingDecision minimalDecision() {
        int depth  = clamp(config.maxDepthMin(), 1,
                           Math.min(config.maxDepthMax(), config.globalMaxDepthCeiling()));
        int budget = clamp(config.timeBudgetMsMin(), 1,
                           Math.min(config.timeBudgetMsMax(), config.globalTimeBudgetMsCeiling()));
        return ClearingDecision.run(ClearingDecision.WARMUP_FALLBACK_RUN, depth, budget);
    }

    /** The upper bound wins when {@code lo > hi}: a ceiling is never exceeded. Never below 1. */
    static int clamp(int v, int lo, int hi) {
        return Math.max(1, Math.min(hi, Math.max(lo, v)));
    }

    static double normalize(double v, double lo, double hi) {
        if (hi <= lo) return 1.0;
        return Math.max(0.0, Math.min(1.0, (v - lo) / (hi - lo)));
    }

    private EquivalentState state(String equivalent) {
        return states.computeIfAbsent(equivalent, k -> new EquivalentState());
    }

    // ── per-equivalent state ───────────────────────────────────────────────────

    private static final class EquivalentState {
        final Deque<int[]> window = new ArrayDeque<>();
        BigDecimal lastClearingVolume = BigDecimal.ZERO;
        long       lastClearingCostMs;
        long       lastClearingTick   = -1;
        int        backoffInterval;
        int        consecutiveZeroYield;
        boolean    active;
    }
}
