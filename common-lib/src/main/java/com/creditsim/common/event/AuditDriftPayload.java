package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/** Participants whose net position moved differently from the tick's committed payments. */
public record AuditDriftPayload(
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("tickIndex")  long tickIndex,
    @JsonProperty("severity")   String severity,
    @JsonProperty("totalDrift") BigDecimal totalDrift,
    @JsonProperty("drifts")     List<ParticipantDrift> drifts,
    @JsonProperty("source")     String source
) {}
