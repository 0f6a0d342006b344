package com.creditsim.simulator.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tick's metric values for one equivalent.
 *
 * @param successRate      {@code committed / (committed + rejected)} in percent
 * @param bottlenecksScore {@code (errors + timeouts) / (committed + rejected + errors)} in percent
 */
public record EquivalentMetrics(
    String equivalent,
    double successRate,
    double avgRouteLength,
    double totalDebt,
    double clearingVolume,
    double bottlenecksScore,
    int    activeParticipants,
    int    activeTrustlines
) {

    public static final String SUCCESS_RATE        = "success_rate";
    public static final String AVG_ROUTE_LENGTH    = "avg_route_length";
    public static final String TOTAL_DEBT          = "total_debt";
    public static final String CLEARING_VOLUME     = "clearing_volume";
    public static final String BOTTLENECKS_SCORE   = "bottlenecks_score";
    public static final String ACTIVE_PARTICIPANTS = "active_participants";
    public static final String ACTIVE_TRUSTLINES   = "active_trustlines";

    /** Metric key to value, in a stable order. */
    public Map<String, Double> values() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(SUCCESS_RATE, successRate);
        values.put(AVG_ROUTE_LENGTH, avgRouteLength);
        values.put(TOTAL_DEBT, totalDebt);
        values.put(CLEARING_VOLUME, clearingVolume);
        values.put(BOTTLENECKS_SCORE, bottlenecksScore);
        values.put(ACTIVE_PARTICIPANTS, (double) activeParticipants);
        values.put(ACTIVE_TRUSTLINES, (double) activeTrustlines);
        return values;
    }
}
