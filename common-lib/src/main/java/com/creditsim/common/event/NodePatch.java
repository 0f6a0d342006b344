package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** Visualization state of one participant; {@code netBalance} is credits minus debts. */
public record NodePatch(
    @JsonProperty("id")         String id,
    @JsonProperty("status")     String status,
    @JsonProperty("netBalance") BigDecimal netBalance
) {}
