package com.creditsim.simulator.clearing;

import com.creditsim.common.model.Debt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Depth-first search for debt cycles in one equivalent.
 *
 * <p>A cycle is a closed walk of positive debts {@code d₀ owes d₁ owes … owes d₀} of at
 * most {@code maxDepth} edges. Each cycle is reported once, rotated to start at its
 * smallest participant id. Results are ordered shortest first, then lexicographically.
 */
public final class CycleFinder {

    /** Search stops once this many cycles are collected; never more are returned. */
    static final int MAX_CYCLES = 50;

    private CycleFinder() {}

    public static List<List<Debt>> find(Collection<Debt> debts, String equivalent, int maxDepth) {
        Map<String, Map<String, Debt>> adjacency = new TreeMap<>();
        for (Debt d : debts) {
            if (!equivalent.equals(d.equivalent())) continue;
            if (d.amount() == null || d.amount().signum() <= 0) continue;
            if (d.debtor().equals(d.creditor())) continue;
            adjacency.computeIfAbsent(d.debtor(), k -> new TreeMap<>()).put(d.creditor(), d);
        }

        List<List<Debt>> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String start : adjacency.keySet()) {
            if (found.size() >= MAX_CYCLES) break;
            dfs(adjacency, start, start, new ArrayList<>(), new LinkedHashSet<>(List.of(start)),
                Math.max(0, maxDepth), found, seen);
        }
        found.sort(Comparator.<List<Debt>>comparingInt(List::size).thenComparing(CycleFinder::signature));
        return found;
    }

    private static void dfs(Map<String, Map<String, Debt>> adjacency, String start, String node,
                            List<Debt> path, Set<String> onPath, int maxDepth,
                            List<List<Debt>> found, Set<String> seen) {
        if (found.size() >= MAX_CYCLES || path.size() >= maxDepth) return;
        for (Debt edge : adjacency.getOrDefault(node, Map.of()).values()) {
            if (found.size() >= MAX_CYCLES) return;
            String next = edge.creditor();
            if (next.equals(start)) {
                List<Debt> cycle = new ArrayList<>(path);
                cycle.add(edge);
                if (cycle.size() >= 2 && seen.add(signature(cycle))) {
                    found.add(List.copyOf(cycle));
                }
                continue;
            }
            // only walk nodes ordered after start, so every cycle is found from its smallest node
            if (next.compareTo(start) < 0 || onPath.contains(next)) continue;
            path.add(edge);
            onPath.add(next);
            dfs(adjacency, start, next, path, onPath, maxDepth, found, seen);
            onPath.remove(next);
            path.remove(path.size() - 1);
        }
    }

    /** Moves one cycle, chosen from {@code seed}, to the front; the rest keep their order. */
    public static List<List<Debt>> prioritize(List<List<Debt>> cycles, long seed) {
        if (cycles.size() <= 1) return cycles;
        int pick = new Random(seed).nextInt(cycles.size());
        List<List<Debt>> ordered = new ArrayList<>(cycles.size());
        ordered.add(cycles.get(pick));
        for (int i = 0; i < cycles.size(); i++) {
            if (i != pick) ordered.add(cycles.get(i));
        }
        return ordered;
    }

    static String signature(List<Debt> cycle) {
        return cycle.stream().map(Debt::debtor).collect(Collectors.joining(">"));
    }
}
