package com.creditsim.simulator.ledger;

import com.creditsim.common.model.Participant;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.cache.RoutingCache;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Single-path router over the mutual-credit graph.
 *
 * <p>A hop {@code u → v} (u pays v) can carry what v owes u (debt reduction) plus the
 * unused part of the active trust line v→u (new debt of u to v). The router returns the
 * shortest path whose every hop can carry the full amount.
 */
final class PaymentRouter {

    static final int MAX_HOPS = 6;

    private final RoutingCache routingCache;

    PaymentRouter(RoutingCache routingCache) {
        this.routingCache = routingCache;
    }

    List<String> route(LedgerState state, String sender, String receiver, String equivalent, BigDecimal amount) {
        Map<String, Set<String>> graph = routingCache.graph(equivalent, () -> buildGraph(state, equivalent));
        if (!graph.containsKey(sender) || !graph.containsKey(receiver)
                || shortestPath(state, graph, sender, receiver, equivalent, null) == null) {
            throw LedgerRejectionException.noRoute(
                "No route " + sender + " -> " + receiver + " in " + equivalent);
        }
        List<String> path = shortestPath(state, graph, sender, receiver, equivalent, amount);
        if (path == null) {
            throw LedgerRejectionException.noCapacity(
                "Insufficient capacity " + sender + " -> " + receiver + " amount=" + amount + " in " + equivalent);
        }
        return path;
    }

    /** Applies {@code amount} along {@code path}: reduce reverse debt first, then grow forward debt. */
    static void apply(LedgerState state, List<String> path, String equivalent, BigDecimal amount) {
        for (int i = 0; i + 1 < path.size(); i++) {
            String u = path.get(i);
            String v = path.get(i + 1);
            BigDecimal reverse   = state.debt(v, u, equivalent);
            BigDecimal reduction = reverse.min(amount);
            BigDecimal remainder = amount.subtract(reduction);
            state.putDebt(v, u, equivalent, reverse.subtract(reduction));
            if (remainder.signum() > 0) {
                state.putDebt(u, v, equivalent, state.debt(u, v, equivalent).add(remainder));
            }
        }
    }

    static BigDecimal hopCapacity(LedgerState state, String u, String v, String equivalent) {
        BigDecimal capacity = state.debt(v, u, equivalent);
        TrustLine tl = state.trustLines.get(TrustLine.key(v, u, equivalent));
        if (tl != null && tl.isActive() && tl.limit() != null) {
            BigDecimal headroom = tl.limit().subtract(state.debt(u, v, equivalent));
            if (headroom.signum() > 0) {
                capacity = capacity.add(headroom);
            }
        }
        return capacity;
    }

    /** BFS path; a {@code null} amount ignores capacity and checks reachability only. */
    private List<String> shortestPath(LedgerState state, Map<String, Set<String>> graph,
                                      String sender, String receiver, String equivalent, BigDecimal amount) {
        Map<String, String> parent = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parent.put(sender, sender);
        depth.put(sender, 0);
        queue.add(sender);

        while (!queue.isEmpty()) {
            String u = queue.poll();
            int d = depth.get(u);
            if (d >= MAX_HOPS) continue;
            for (String v : graph.getOrDefault(u, Collections.emptySet())) {
                if (parent.containsKey(v)) continue;
                Participant p = state.participants.get(v);
                if (p != null && !p.isActive()) continue;
                BigDecimal cap = amount != null ? hopCapacity(state, u, v, equivalent) : BigDecimal.ZERO;
                if (amount != null && cap.compareTo(amount) < 0) continue;
                parent.put(v, u);
                depth.put(v, d + 1);
                if (v.equals(receiver)) {
                    return unwind(parent, sender, receiver);
                }
                queue.add(v);
            }
        }
        return null;
    }

    private static List<String> unwind(Map<String, String> parent, String sender, String receiver) {
        List<String> path = new ArrayList<>();
        for (String node = receiver; !node.equals(sender); node = parent.get(node)) {
            path.add(node);
        }
        path.add(sender);
        Collections.reverse(path);
        return path;
    }

    private static Map<String, Set<String>> buildGraph(LedgerState state, String equivalent) {
        Map<String, Set<String>> graph = new TreeMap<>();
        for (TrustLine tl : state.trustLines.values()) {
            if (!equivalent.equals(tl.equivalent()) || !tl.isActive()) continue;
            graph.computeIfAbsent(tl.from(), k -> new TreeSet<>()).add(tl.to());
            graph.computeIfAbsent(tl.to(), k -> new TreeSet<>()).add(tl.from());
        }
        return graph;
    }
}
