package com.creditsim.simulator.persistence;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.simulator.metrics.EdgeBottleneck;
import com.creditsim.simulator.metrics.EquivalentMetrics;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Sink for per-tick metrics, bottleneck snapshots and run status rows. Every write is
 * an upsert on its natural key, so replaying a tick overwrites instead of duplicating.
 */
public interface MetricsStore {

    /** One row per metric key per equivalent at simulated time {@code tMs}. */
    Mono<Void> writeTickMetrics(String runId, long tMs, List<EquivalentMetrics> metrics);

    Mono<Void> writeBottlenecks(String runId, String equivalent, Instant computedAt, List<EdgeBottleneck> items);

    Mono<Void> writeRunStatus(String runId, String scenarioId, RunStatusPayload status);
}
