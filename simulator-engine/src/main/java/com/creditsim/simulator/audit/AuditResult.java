package com.creditsim.simulator.audit;

import com.creditsim.common.event.ParticipantDrift;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one equivalent's post-tick balance audit.
 *
 * @param totalDrift   half the summed absolute drifts, i.e. the volume that went astray
 * @param tickVolume   committed payment volume plus cleared volume of the tick
 * @param netImbalance sum of all net positions after the tick; zero for a consistent ledger
 */
public record AuditResult(
    String                 equivalent,
    long                   tickIndex,
    List<ParticipantDrift> drifts,
    BigDecimal             totalDrift,
    BigDecimal             tickVolume,
    BigDecimal             netImbalance
) {

    public static final String SEVERITY_WARNING  = "warning";
    public static final String SEVERITY_CRITICAL = "critical";

    private static final BigDecimal WARNING_RATIO = new BigDecimal("0.01");

    public static AuditResult clean(String equivalent, long tickIndex) {
        return new AuditResult(equivalent, tickIndex, List.of(), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean ok() {
        return drifts.isEmpty() && netImbalance.signum() == 0;
    }

    /** {@code warning} while the drift stays under 1% of the tick's volume, else {@code critical}. */
    public String severity() {
        if (netImbalance.signum() != 0 || tickVolume.signum() <= 0) {
            return SEVERITY_CRITICAL;
        }
        return totalDrift.compareTo(tickVolume.multiply(WARNING_RATIO)) < 0 ? SEVERITY_WARNING : SEVERITY_CRITICAL;
    }
}
