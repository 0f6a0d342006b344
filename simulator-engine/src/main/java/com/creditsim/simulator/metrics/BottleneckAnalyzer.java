package com.creditsim.simulator.metrics;

import com.creditsim.simulator.executor.ExecutionResult.EdgeStats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks the edges of one equivalent by failure share.
 *
 * <p>Edges with no attempts or a zero score are left out. A timeout share of at least
 * {@value #TIMEOUT_SHARE} is reported as {@code TOO_MANY_TIMEOUTS}; any rejection or
 * error as {@code FREQUENT_ABORTS}.
 */
public final class BottleneckAnalyzer {

    public static final int    DEFAULT_LIMIT = 50;
    static final double        TIMEOUT_SHARE = 0.2;

    private BottleneckAnalyzer() {}

    public static List<EdgeBottleneck> analyze(String equivalent, Collection<EdgeStats> edges, int limit) {
        List<EdgeBottleneck> items = new ArrayList<>();
        for (EdgeStats st : edges) {
            if (!equivalent.equals(st.equivalent()) || st.attempts() <= 0) continue;
            int bad = st.errors() + st.timeouts() + st.rejected();
            double score = Math.max(0.0, Math.min(1.0, (double) bad / st.attempts()));
            if (score <= 0) continue;

            String reason;
            if (st.timeouts() > 0 && (double) st.timeouts() / st.attempts() >= TIMEOUT_SHARE) {
                reason = EdgeBottleneck.TOO_MANY_TIMEOUTS;
            } else if (st.rejected() > 0 || st.errors() > 0) {
                reason = EdgeBottleneck.FREQUENT_ABORTS;
            } else {
                reason = EdgeBottleneck.HIGH_USED;
            }
            items.add(new EdgeBottleneck(equivalent, st.from() + "->" + st.to(), score, reason,
                st.attempts(), st.committed(), st.rejected(), st.errors(), st.timeouts()));
        }
        return items.stream()
            .sorted(Comparator.comparingDouble(EdgeBottleneck::score)
                .thenComparing(EdgeBottleneck::targetId)
                .reversed())
            .limit(Math.max(0, limit))
            .collect(Collectors.toList());
    }
}
