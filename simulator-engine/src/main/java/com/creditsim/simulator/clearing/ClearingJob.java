package com.creditsim.simulator.clearing;

/** One equivalent to clear in a pass, with its own depth and time budget. */
public record ClearingJob(String equivalent, int maxDepth, long timeBudgetMs) {}
