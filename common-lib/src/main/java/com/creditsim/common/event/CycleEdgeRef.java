package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Debt edge inside a clearing cycle, debtor to creditor. */
public record CycleEdgeRef(
    @JsonProperty("from") String from,
    @JsonProperty("to")   String to
) {}
