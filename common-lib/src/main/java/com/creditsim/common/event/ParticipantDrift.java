package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record ParticipantDrift(
    @JsonProperty("participantId") String participantId,
    @JsonProperty("expectedDelta") BigDecimal expectedDelta,
    @JsonProperty("actualDelta")   BigDecimal actualDelta,
    @JsonProperty("drift")         BigDecimal drift
) {}
