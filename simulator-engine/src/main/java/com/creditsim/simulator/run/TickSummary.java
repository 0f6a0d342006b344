package com.creditsim.simulator.run;

/**
 * Counts of the last completed tick.
 *
 * @param planned number of intents the planner produced
 */
public record TickSummary(long tickIndex, long simTimeMs, int planned, int committed, int rejected,
                          int errors, int timeouts, long durationMs) {}
