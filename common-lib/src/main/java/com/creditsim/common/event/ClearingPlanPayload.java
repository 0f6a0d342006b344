package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ClearingPlanPayload(
    @JsonProperty("planId")     String planId,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("cycle")      List<CycleEdgeRef> cycle
) {}
