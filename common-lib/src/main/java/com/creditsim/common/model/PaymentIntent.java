package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A planned payment. {@code seq} is 0-based and contiguous within a tick.
 */
public record PaymentIntent(
    @JsonProperty("seq")        int seq,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("senderId")   String senderId,
    @JsonProperty("receiverId") String receiverId,
    @JsonProperty("amount")     BigDecimal amount
) {}
