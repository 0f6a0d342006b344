package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RunStatusPayload(
    @JsonProperty("state")                  String state,
    @JsonProperty("tickIndex")              long tickIndex,
    @JsonProperty("simTimeMs")              long simTimeMs,
    @JsonProperty("intensityPercent")       int intensityPercent,
    @JsonProperty("attempts")               long attempts,
    @JsonProperty("committed")              long committed,
    @JsonProperty("rejected")               long rejected,
    @JsonProperty("errors")                 long errors,
    @JsonProperty("timeouts")               long timeouts,
    @JsonProperty("consecAllRejectedTicks") int consecAllRejectedTicks,
    @JsonProperty("errorsLastMinute")       int errorsLastMinute,
    @JsonProperty("lastErrorCode")          String lastErrorCode,
    @JsonProperty("lastErrorMessage")       String lastErrorMessage,
    @JsonProperty("lastErrorAt")            Instant lastErrorAt
) {}
