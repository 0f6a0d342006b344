package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record Debt(
    @JsonProperty("debtor")     String debtor,
    @JsonProperty("creditor")   String creditor,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("amount")     BigDecimal amount
) {}
