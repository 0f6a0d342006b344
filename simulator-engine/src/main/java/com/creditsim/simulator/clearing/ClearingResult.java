package com.creditsim.simulator.clearing;

import com.creditsim.common.event.CycleEdgeRef;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one clearing pass in one equivalent.
 *
 * @param clearedAmount  sum over settled cycles of each cycle's clear amount
 * @param touchedEdges   debt edges (debtor → creditor) that were reduced
 * @param budgetExceeded the pass stopped because its time budget ran out
 */
public record ClearingResult(
    String equivalent,
    String planId,
    int clearedCycles,
    BigDecimal clearedAmount,
    List<String> touchedNodes,
    List<CycleEdgeRef> touchedEdges,
    long elapsedMs,
    boolean budgetExceeded,
    boolean cancelled,
    String error
) {

    public static ClearingResult nothing(String equivalent) {
        return new ClearingResult(equivalent, null, 0, BigDecimal.ZERO, List.of(), List.of(), 0, false, false, null);
    }

    public static ClearingResult failed(String equivalent, String error) {
        return new ClearingResult(equivalent, null, 0, BigDecimal.ZERO, List.of(), List.of(), 0, false, false, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
