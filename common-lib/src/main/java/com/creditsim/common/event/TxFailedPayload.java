package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record TxFailedPayload(
    @JsonProperty("seq")        int seq,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("from")       String from,
    @JsonProperty("to")         String to,
    @JsonProperty("amount")     BigDecimal amount,
    @JsonProperty("errorCode")  String errorCode,
    @JsonProperty("message")    String message
) {}
