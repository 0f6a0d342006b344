package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record TxUpdatedPayload(
    @JsonProperty("seq")         int seq,
    @JsonProperty("equivalent")  String equivalent,
    @JsonProperty("from")        String from,
    @JsonProperty("to")          String to,
    @JsonProperty("amount")      BigDecimal amount,
    @JsonProperty("routeLength") int routeLength,
    @JsonProperty("edges")       List<EdgePatch> edges,
    @JsonProperty("nodes")       List<NodePatch> nodes
) {}
