package com.creditsim.simulator.persistence;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.simulator.metrics.EdgeBottleneck;
import com.creditsim.simulator.metrics.EquivalentMetrics;
import com.creditsim.simulator.persistence.repository.RunStatusRepository;
import com.creditsim.simulator.persistence.repository.TickBottleneckRepository;
import com.creditsim.simulator.persistence.repository.TickMetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** {@link MetricsStore} over Spring Data R2DBC; rows are written with H2 {@code MERGE}. */
@Service
public class R2dbcMetricsStore implements MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcMetricsStore.class);

    private final TickMetricRepository     metricRepository;
    private final TickBottleneckRepository bottleneckRepository;
    private final RunStatusRepository      runStatusRepository;

    public R2dbcMetricsStore(TickMetricRepository metricRepository,
                             TickBottleneckRepository bottleneckRepository,
                             RunStatusRepository runStatusRepository) {
        this.metricRepository     = metricRepository;
        this.bottleneckRepository = bottleneckRepository;
        this.runStatusRepository  = runStatusRepository;
    }

    @Override
    public Mono<Void> writeTickMetrics(String runId, long tMs, List<EquivalentMetrics> metrics) {
        return Flux.fromIterable(metrics)
            .concatMap(m -> Flux.fromIterable(m.values().entrySet())
                .concatMap((Map.Entry<String, Double> e) ->
                    metricRepository.upsert(runId, m.equivalent(), e.getKey(), tMs, e.getValue())))
            .then()
            .doOnSuccess(v -> log.debug("[Metrics] Tick metrics written. runId={} tMs={} equivalents={}",
                                        runId, tMs, metrics.size()));
    }

    @Override
    public Mono<Void> writeBottlenecks(String runId, String equivalent, Instant computedAt, List<EdgeBottleneck> items) {
        LocalDateTime at = LocalDateTime.ofInstant(computedAt, ZoneOffset.UTC);
        return Flux.fromIterable(items)
            .concatMap(b -> bottleneckRepository.upsert(runId, equivalent, at, b.targetId(), b.score(),
                b.reasonCode(), b.attempts(), b.committed(), b.rejected(), b.errors(), b.timeouts()))
            .then();
    }

    @Override
    public Mono<Void> writeRunStatus(String runId, String scenarioId, RunStatusPayload status) {
        return runStatusRepository.upsert(runId, scenarioId, status.state(), status.tickIndex(),
            status.simTimeMs(), status.intensityPercent(), status.attempts(), status.committed(),
            status.rejected(), status.errors(), status.timeouts(), status.lastErrorCode(),
            status.lastErrorMessage(), LocalDateTime.now(ZoneOffset.UTC));
    }
}
