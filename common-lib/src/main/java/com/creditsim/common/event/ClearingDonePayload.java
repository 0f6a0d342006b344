package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record ClearingDonePayload(
    @JsonProperty("planId")        String planId,
    @JsonProperty("equivalent")    String equivalent,
    @JsonProperty("clearedCycles") int clearedCycles,
    @JsonProperty("clearedAmount") BigDecimal clearedAmount,
    @JsonProperty("touchedNodes")  List<String> touchedNodes,
    @JsonProperty("touchedEdges")  List<CycleEdgeRef> touchedEdges
) {}
