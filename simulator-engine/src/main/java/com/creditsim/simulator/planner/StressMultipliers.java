package com.creditsim.simulator.planner;

import com.creditsim.common.model.ScenarioEvent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code tx_rate} multipliers of the stress events active at one simulated instant.
 *
 * <p>A stress event is active on {@code [time, time + durationMs)}; without a positive
 * duration it is active only at exactly {@code time}. Only {@code mult} effects on
 * {@code tx_rate} are recognised, other effects are ignored. Values are clamped to
 * {@code [0, 10]} and multipliers for the same scope multiply.
 */
public record StressMultipliers(double all, Map<String, Double> byGroup, Map<String, Double> byProfile) {

    static final double MAX_MULTIPLIER = 10.0;

    public static StressMultipliers none() {
        return new StressMultipliers(1.0, Map.of(), Map.of());
    }

    public static StressMultipliers compute(List<ScenarioEvent> events, long simTimeMs) {
        if (events == null || events.isEmpty()) {
            return none();
        }
        double all = 1.0;
        Map<String, Double> byGroup   = new HashMap<>();
        Map<String, Double> byProfile = new HashMap<>();

        for (ScenarioEvent evt : events) {
            if (evt == null || !evt.isType(ScenarioEvent.TYPE_STRESS) || evt.time() == null) continue;
            if (!isActive(evt, simTimeMs)) continue;
            if (evt.effects() == null) continue;

            for (Map<String, Object> eff : evt.effects()) {
                if (eff == null) continue;
                if (!"mult".equals(str(eff.get("op"))) || !"tx_rate".equals(str(eff.get("field")))) continue;
                Double value = toDouble(eff.get("value"));
                if (value == null || value <= 0) continue;
                double v = Math.min(MAX_MULTIPLIER, value);

                String scope = str(eff.get("scope"));
                if (scope.isEmpty() || "all".equals(scope)) {
                    all *= v;
                } else if (scope.startsWith("group:")) {
                    String g = scope.substring("group:".length()).trim();
                    if (!g.isEmpty()) byGroup.merge(g, v, (a, b) -> a * b);
                } else if (scope.startsWith("profile:")) {
                    String p = scope.substring("profile:".length()).trim();
                    if (!p.isEmpty()) byProfile.merge(p, v, (a, b) -> a * b);
                }
            }
        }
        return new StressMultipliers(all, Map.copyOf(byGroup), Map.copyOf(byProfile));
    }

    /** Product of the multipliers that apply to a sender in {@code groupId} with {@code profileId}. */
    public double forSender(String groupId, String profileId) {
        double m = all;
        if (groupId != null)   m *= byGroup.getOrDefault(groupId, 1.0);
        if (profileId != null) m *= byProfile.getOrDefault(profileId, 1.0);
        return m;
    }

    private static boolean isActive(ScenarioEvent evt, long simTimeMs) {
        long start    = Math.max(0, evt.time());
        long duration = durationOf(evt);
        if (duration <= 0) {
            return simTimeMs == start;
        }
        return start <= simTimeMs && simTimeMs < start + duration;
    }

    private static long durationOf(ScenarioEvent evt) {
        if (evt.metadata() != null) {
            Double fromMeta = toDouble(evt.metadata().get("durationMs"));
            if (fromMeta != null) return Math.max(0, fromMeta.longValue());
        }
        return evt.durationMs() != null ? Math.max(0, evt.durationMs()) : 0;
    }

    private static String str(Object raw) {
        return raw == null ? "" : raw.toString().trim();
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) return n.doubleValue();
        if (raw == null) return null;
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
