package com.creditsim.simulator.executor;

import java.util.List;
import java.util.Map;

/**
 * Aggregate of one executed batch.
 *
 * @param aborted  {@code true} when execution stopped early on the per-tick timeout ceiling
 * @param byEdge   keyed {@link EdgeStats#key()}
 * @param rejectionCodesByEquivalent rejection-code histogram per equivalent
 */
public record ExecutionResult(
    int attempts,
    int committed,
    int rejected,
    int errors,
    int timeouts,
    boolean aborted,
    Map<String, EquivalentStats> byEquivalent,
    Map<String, EdgeStats> byEdge,
    Map<String, Map<String, Integer>> rejectionCodesByEquivalent,
    List<PaymentOutcome> outcomes
) {

    public static ExecutionResult empty() {
        return new ExecutionResult(0, 0, 0, 0, 0, false, Map.of(), Map.of(), Map.of(), List.of());
    }

    public EquivalentStats equivalent(String equivalent) {
        return byEquivalent.getOrDefault(equivalent, EquivalentStats.ZERO);
    }

    /** Rejections with {@code ROUTING_NO_CAPACITY} in {@code equivalent}. */
    public int noCapacityRejections(String equivalent) {
        return rejectionCodesByEquivalent.getOrDefault(equivalent, Map.of())
            .getOrDefault(RejectionCodes.ROUTING_NO_CAPACITY, 0);
    }

    public record EquivalentStats(int committed, int rejected, int errors, int timeouts,
                                  long routeLengthSum, int routeCount) {

        public static final EquivalentStats ZERO = new EquivalentStats(0, 0, 0, 0, 0, 0);

        public int attempts() {
            return committed + rejected + errors;
        }

        public double avgRouteLength() {
            return routeCount > 0 ? (double) routeLengthSum / routeCount : 0.0;
        }
    }

    /** Per payment-direction edge: {@code from} paid (or tried to pay) {@code to}. */
    public record EdgeStats(String equivalent, String from, String to,
                            int attempts, int committed, int rejected, int errors, int timeouts) {

        public String key() {
            return key(equivalent, from, to);
        }

        public static String key(String equivalent, String from, String to) {
            return equivalent + ":" + from + "->" + to;
        }
    }
}
