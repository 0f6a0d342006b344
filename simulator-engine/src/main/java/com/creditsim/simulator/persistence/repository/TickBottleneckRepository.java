package com.creditsim.simulator.persistence.repository;

import com.creditsim.simulator.persistence.model.TickBottleneck;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface TickBottleneckRepository extends ReactiveCrudRepository<TickBottleneck, Long> {

    /** Upsert on {@code (run_id, equivalent, computed_at, target_id)}. */
    @Modifying
    @Query("""
        MERGE INTO tick_bottlenecks
            (run_id, equivalent, computed_at, target_type, target_id, score, reason_code,
             attempts, committed, rejected, errors, timeouts)
        KEY (run_id, equivalent, computed_at, target_id)
        VALUES
            (:runId, :equivalent, :computedAt, 'edge', :targetId, :score, :reasonCode,
             :attempts, :committed, :rejected, :errors, :timeouts)
        """)
    Mono<Void> upsert(String runId, String equivalent, LocalDateTime computedAt, String targetId,
                      double score, String reasonCode,
                      int attempts, int committed, int rejected, int errors, int timeouts);

    /** Entries of the most recent snapshot, best score first. */
    @Query("""
        SELECT * FROM tick_bottlenecks
        WHERE run_id = :runId AND equivalent = :equivalent
          AND computed_at = (SELECT MAX(computed_at) FROM tick_bottlenecks
                             WHERE run_id = :runId AND equivalent = :equivalent)
        ORDER BY score DESC, target_id DESC
        """)
    Flux<TickBottleneck> findLatest(String runId, String equivalent);
}
