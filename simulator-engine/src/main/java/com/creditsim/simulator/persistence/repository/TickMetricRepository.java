package com.creditsim.simulator.persistence.repository;

import com.creditsim.simulator.persistence.model.TickMetric;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TickMetricRepository extends ReactiveCrudRepository<TickMetric, Long> {

    /** Upsert on {@code (run_id, equivalent, metric_key, t_ms)}. */
    @Modifying
    @Query("""
        MERGE INTO tick_metrics (run_id, equivalent, metric_key, t_ms, metric_value)
        KEY (run_id, equivalent, metric_key, t_ms)
        VALUES (:runId, :equivalent, :metricKey, :tMs, :value)
        """)
    Mono<Void> upsert(String runId, String equivalent, String metricKey, long tMs, double value);

    @Query("""
        SELECT * FROM tick_metrics
        WHERE run_id = :runId AND equivalent = :equivalent AND metric_key = :metricKey
        ORDER BY t_ms ASC
        """)
    Flux<TickMetric> findSeries(String runId, String equivalent, String metricKey);
}
