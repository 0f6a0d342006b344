package com.creditsim.simulator.controller;

import com.creditsim.common.event.RunStatusPayload;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.TickSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Read model of a run returned by every run endpoint. */
public record RunView(
    @JsonProperty("runId")      String runId,
    @JsonProperty("scenarioId") String scenarioId,
    @JsonProperty("mode")       String mode,
    @JsonProperty("seed")       long seed,
    @JsonProperty("startedAt")  Instant startedAt,
    @JsonProperty("stoppedAt")  Instant stoppedAt,
    @JsonProperty("status")     RunStatusPayload status,
    @JsonProperty("lastTick")   TickSummary lastTick
) {

    public static RunView of(RunState run) {
        return new RunView(run.getRunId(), run.getScenarioId(), run.getMode(), run.getSeed(),
            run.getStartedAt(), run.getStoppedAt(), run.toStatusPayload(), run.getLastTick());
    }
}
