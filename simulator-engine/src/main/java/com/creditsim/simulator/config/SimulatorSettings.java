package com.creditsim.simulator.config;

import java.math.BigDecimal;

/**
 * Immutable run-engine configuration, bound from {@code simulator.*} properties
 * in {@link SimulatorConfig}.
 *
 * @param amountCap optional global cap on a single payment amount; {@code null} = no cap
 */
public record SimulatorSettings(
    long       tickIntervalMs,
    long       simStepMs,
    int        actionsPerTickMax,
    int        maxInFlight,
    int        clearingEveryNTicks,
    String     clearingPolicy,
    int        clearingMaxDepth,
    int        clearingTimeBudgetMs,
    double     clearingHardTimeoutCapSec,
    int        maxTimeoutsPerTick,
    int        maxErrorsTotal,
    int        maxConsecTickFailures,
    long       paymentTimeoutMs,
    BigDecimal amountCap,
    boolean    injectEnabled,
    int        metricsEveryNTicks,
    int        bottlenecksEveryNTicks,
    long       artifactsEveryMs
) {

    public static final String POLICY_STATIC   = "static";
    public static final String POLICY_ADAPTIVE = "adaptive";

    public static SimulatorSettings defaults() {
        return new SimulatorSettings(
            1_000, 1_000, 20, 1, 25, POLICY_STATIC, 6, 250, 8.0,
            50, 200, 3, 2_000, null, true, 1, 10, 5_000);
    }

    public boolean isAdaptive() {
        return POLICY_ADAPTIVE.equalsIgnoreCase(clearingPolicy);
    }

    public SimulatorSettings withActionsPerTickMax(int value) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, value, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withMaxInFlight(int value) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, value, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withClearing(int everyNTicks, String policy) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, everyNTicks,
            policy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withClearingBudget(int timeBudgetMs, double hardTimeoutCapSec) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, timeBudgetMs, hardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withFailureBudgets(int timeoutsPerTick, int errorsTotal, int consecTickFailures) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            timeoutsPerTick, errorsTotal, consecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withAmountCap(BigDecimal value) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, value,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withPaymentTimeoutMs(long value) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, value, amountCap,
            injectEnabled, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withInjectEnabled(boolean value) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            value, metricsEveryNTicks, bottlenecksEveryNTicks, artifactsEveryMs);
    }

    public SimulatorSettings withThrottles(int metricsEvery, int bottlenecksEvery, long artifactsMs) {
        return new SimulatorSettings(tickIntervalMs, simStepMs, actionsPerTickMax, maxInFlight, clearingEveryNTicks,
            clearingPolicy, clearingMaxDepth, clearingTimeBudgetMs, clearingHardTimeoutCapSec,
            maxTimeoutsPerTick, maxErrorsTotal, maxConsecTickFailures, paymentTimeoutMs, amountCap,
            injectEnabled, metricsEvery, bottlenecksEvery, artifactsMs);
    }
}
