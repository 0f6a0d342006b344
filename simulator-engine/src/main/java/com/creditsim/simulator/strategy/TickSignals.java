package com.creditsim.simulator.strategy;

import java.math.BigDecimal;

/** What one equivalent saw during one tick. Negative counts are treated as zero. */
public record TickSignals(int attempted, int rejectedNoCapacity, BigDecimal totalDebt) {

    public TickSignals {
        attempted          = Math.max(0, attempted);
        rejectedNoCapacity = Math.max(0, rejectedNoCapacity);
        totalDebt          = totalDebt != null ? totalDebt : BigDecimal.ZERO;
    }
}
