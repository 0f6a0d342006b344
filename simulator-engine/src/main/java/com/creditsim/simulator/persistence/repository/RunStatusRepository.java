package com.creditsim.simulator.persistence.repository;

import com.creditsim.simulator.persistence.model.RunStatusRow;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RunStatusRepository extends ReactiveCrudRepository<RunStatusRow, String> {

    @Modifying
    @Query("""
        MERGE INTO run_status
            (run_id, scenario_id, state, tick_index, sim_time_ms, intensity_percent,
             attempts, committed, rejected, errors, timeouts,
             last_error_code, last_error_message, updated_at)
        KEY (run_id)
        VALUES
            (:runId, :scenarioId, :state, :tickIndex, :simTimeMs, :intensityPercent,
             :attempts, :committed, :rejected, :errors, :timeouts,
             :lastErrorCode, :lastErrorMessage, :updatedAt)
        """)
    Mono<Void> upsert(String runId, String scenarioId, String state, long tickIndex, long simTimeMs,
                      int intensityPercent, long attempts, long committed, long rejected, long errors,
                      long timeouts, String lastErrorCode, String lastErrorMessage, LocalDateTime updatedAt);
}
