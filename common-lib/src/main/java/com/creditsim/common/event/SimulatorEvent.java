package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Envelope of every event a run emits to observers.
 *
 * <p>{@code eventId} increases monotonically per run, so a transport can offer
 * replay-from-offset without inspecting the payload.
 */
public record SimulatorEvent(
    @JsonProperty("eventId") long eventId,
    @JsonProperty("runId")   String runId,
    @JsonProperty("type")    String type,
    @JsonProperty("at")      Instant at,
    @JsonProperty("payload") Object payload
) {

    public static final String TX_UPDATED       = "tx.updated";
    public static final String TX_FAILED        = "tx.failed";
    public static final String CLEARING_PLAN    = "clearing.plan";
    public static final String CLEARING_DONE    = "clearing.done";
    public static final String TOPOLOGY_CHANGED = "topology.changed";
    public static final String RUN_STATUS       = "run_status";
    public static final String NOTE             = "note";
    public static final String AUDIT_DRIFT      = "audit.drift";
}
