package com.creditsim.simulator.ledger;

import java.math.BigDecimal;

public record PaymentRequest(
    String senderId,
    String receiverId,
    String equivalent,
    BigDecimal amount,
    String idempotencyKey
) {}
