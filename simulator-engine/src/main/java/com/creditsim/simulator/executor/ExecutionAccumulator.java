package com.creditsim.simulator.executor;

import com.creditsim.common.model.PaymentIntent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Mutable counters folded in emission order; only touched from the ordered emitter. */
final class ExecutionAccumulator {

    private int attempts;
    private int committed;
    private int rejected;
    private int errors;
    private int timeouts;

    private final Map<String, int[]>                   byEquivalent  = new TreeMap<>();
    private final Map<String, long[]>                  routeByEq     = new HashMap<>();
    private final Map<String, int[]>                   byEdge        = new LinkedHashMap<>();
    private final Map<String, String[]>                edgeIds       = new HashMap<>();
    private final Map<String, Map<String, Integer>>    rejectionCodes = new TreeMap<>();
    private final List<PaymentOutcome>                 outcomes      = new ArrayList<>();

    private static final int COMMITTED = 0, REJECTED = 1, ERRORS = 2, TIMEOUTS = 3, ATTEMPTS = 4;

    synchronized void add(PaymentOutcome outcome) {
        PaymentIntent intent = outcome.intent();
        String eq = intent.equivalent();
        int[] eqStats = byEquivalent.computeIfAbsent(eq, k -> new int[4]);
        outcomes.add(outcome);
        attempts++;

        switch (outcome.kind()) {
            case COMMITTED -> {
                committed++;
                eqStats[COMMITTED]++;
                long[] route = routeByEq.computeIfAbsent(eq, k -> new long[2]);
                route[0] += outcome.routeLength();
                route[1]++;
            }
            case REJECTED -> {
                rejected++;
                eqStats[REJECTED]++;
                rejectionCodes.computeIfAbsent(eq, k -> new TreeMap<>()).merge(outcome.code(), 1, Integer::sum);
            }
            case TIMEOUT -> {
                errors++;
                timeouts++;
                eqStats[ERRORS]++;
                eqStats[TIMEOUTS]++;
            }
            case ERROR -> {
                errors++;
                eqStats[ERRORS]++;
            }
        }

        List<String> route = outcome.route();
        if (route.size() >= 2) {
            for (int i = 0; i + 1 < route.size(); i++) {
                countEdge(eq, route.get(i), route.get(i + 1), outcome.kind());
            }
        } else {
            countEdge(eq, intent.senderId(), intent.receiverId(), outcome.kind());
        }
    }

    private void countEdge(String eq, String from, String to, PaymentOutcome.Kind kind) {
        String key = ExecutionResult.EdgeStats.key(eq, from, to);
        edgeIds.putIfAbsent(key, new String[]{eq, from, to});
        int[] s = byEdge.computeIfAbsent(key, k -> new int[5]);
        s[ATTEMPTS]++;
        switch (kind) {
            case COMMITTED -> s[COMMITTED]++;
            case REJECTED  -> s[REJECTED]++;
            case TIMEOUT   -> { s[ERRORS]++; s[TIMEOUTS]++; }
            case ERROR     -> s[ERRORS]++;
        }
    }

    synchronized int timeouts() {
        return timeouts;
    }

    synchronized ExecutionResult build(boolean aborted) {
        Map<String, ExecutionResult.EquivalentStats> eqOut = new TreeMap<>();
        byEquivalent.forEach((eq, s) -> {
            long[] route = routeByEq.getOrDefault(eq, new long[2]);
            eqOut.put(eq, new ExecutionResult.EquivalentStats(
                s[COMMITTED], s[REJECTED], s[ERRORS], s[TIMEOUTS], route[0], (int) route[1]));
        });
        Map<String, ExecutionResult.EdgeStats> edgeOut = new LinkedHashMap<>();
        byEdge.forEach((key, s) -> {
            String[] ids = edgeIds.get(key);
            edgeOut.put(key, new ExecutionResult.EdgeStats(ids[0], ids[1], ids[2],
                s[ATTEMPTS], s[COMMITTED], s[REJECTED], s[ERRORS], s[TIMEOUTS]));
        });
        Map<String, Map<String, Integer>> codesOut = new TreeMap<>();
        rejectionCodes.forEach((eq, codes) -> codesOut.put(eq, Map.copyOf(codes)));
        return new ExecutionResult(attempts, committed, rejected, errors, timeouts, aborted,
            Collections.unmodifiableMap(eqOut), Collections.unmodifiableMap(edgeOut),
            Collections.unmodifiableMap(codesOut),
            List.copyOf(outcomes));
    }
}
