package com.creditsim.simulator.run;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.persistence.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Announces a run's status to observers and writes its status row. */
@Component
public class RunStatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(RunStatusPublisher.class);

    private final SimulatorEventBus eventBus;
    private final MetricsStore      metricsStore;

    public RunStatusPublisher(SimulatorEventBus eventBus, MetricsStore metricsStore) {
        this.eventBus     = eventBus;
        this.metricsStore = metricsStore;
    }

    /** Emits {@code run_status} without touching the status row. */
    public RunStatusPayload announce(RunState run) {
        RunStatusPayload status = run.toStatusPayload();
        eventBus.publish(run.getRunId(), SimulatorEvent.RUN_STATUS, status);
        return status;
    }

    /** Emits {@code run_status}; the row write is best-effort. */
    public Mono<Void> publish(RunState run) {
        RunStatusPayload status = announce(run);
        return metricsStore.writeRunStatus(run.getRunId(), run.getScenarioId(), status)
            .onErrorResume(e -> {
                if (run.shouldWarnThisTick("run-status-write")) {
                    log.warn("[RunStatus] Write failed. runId={} state={} error={}",
                             run.getRunId(), status.state(), e.getMessage());
                }
                return Mono.empty();
            });
    }
}
