package com.creditsim.simulator.persistence;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.simulator.metrics.EdgeBottleneck;
import com.creditsim.simulator.metrics.EquivalentMetrics;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed {@link MetricsStore}, keyed the same way as the database tables. */
public class InMemoryMetricsStore implements MetricsStore {

    private final Map<String, Double>               metrics     = new ConcurrentHashMap<>();
    private final Map<String, List<EdgeBottleneck>> bottlenecks = new ConcurrentHashMap<>();
    private final Map<String, RunStatusPayload>     statuses    = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> writeTickMetrics(String runId, long tMs, List<EquivalentMetrics> rows) {
        return Mono.fromRunnable(() -> rows.forEach(m ->
            m.values().forEach((key, value) -> metrics.put(metricKey(runId, m.equivalent(), key, tMs), value))));
    }

    @Override
    public Mono<Void> writeBottlenecks(String runId, String equivalent, Instant computedAt, List<EdgeBottleneck> items) {
        return Mono.fromRunnable(() -> bottlenecks.put(runId + "|" + equivalent, new ArrayList<>(items)));
    }

    @Override
    public Mono<Void> writeRunStatus(String runId, String scenarioId, RunStatusPayload status) {
        return Mono.fromRunnable(() -> statuses.put(runId, status));
    }

    public Optional<Double> metric(String runId, String equivalent, String key, long tMs) {
        return Optional.ofNullable(metrics.get(metricKey(runId, equivalent, key, tMs)));
    }

    /** Latest snapshot written for {@code equivalent}. */
    public List<EdgeBottleneck> bottlenecks(String runId, String equivalent) {
        return bottlenecks.getOrDefault(runId + "|" + equivalent, List.of());
    }

    public Optional<RunStatusPayload> runStatus(String runId) {
        return Optional.ofNullable(statuses.get(runId));
    }

    public int metricCount() {
        return metrics.size();
    }

    private static String metricKey(String runId, String equivalent, String key, long tMs) {
        return runId + "|" + equivalent + "|" + key + "|" + tMs;
    }
}
