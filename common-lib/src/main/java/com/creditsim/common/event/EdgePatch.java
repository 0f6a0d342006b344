package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Visualization state of one trust line after a change.
 * {@code used} is what the debtor owes the creditor; {@code available = limit - used}.
 */
public record EdgePatch(
    @JsonProperty("from")       String from,
    @JsonProperty("to")         String to,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("limit")      BigDecimal limit,
    @JsonProperty("used")       BigDecimal used,
    @JsonProperty("available")  BigDecimal available,
    @JsonProperty("status")     String status
) {}
