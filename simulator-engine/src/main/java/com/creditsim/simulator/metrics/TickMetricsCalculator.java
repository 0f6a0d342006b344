package com.creditsim.simulator.metrics;

import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.executor.ExecutionResult;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.scenario.ScenarioGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-equivalent metric values of one tick.
 *
 * <p>Total debt is read from the ledger only every {@code metricsEveryNTicks} ticks; in
 * between, the last value kept on the run is reported.
 */
@Component
public class TickMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(TickMetricsCalculator.class);

    public List<EquivalentMetrics> compute(RunState run, LedgerSession session, ExecutionResult execution,
                                           Map<String, BigDecimal> clearingVolumes) {
        ScenarioGraph graph = run.getGraph();
        List<String> equivalents = graph.equivalents();
        Map<String, BigDecimal> totalDebt = totalDebt(run, session, equivalents);

        int activeParticipants = (int) graph.participants().stream().filter(Participant::isActive).count();
        Map<String, Integer> activeLines = new HashMap<>();
        for (TrustLine tl : graph.activeTrustLines()) {
            activeLines.merge(tl.equivalent(), 1, Integer::sum);
        }

        List<EquivalentMetrics> out = new ArrayList<>(equivalents.size());
        for (String eq : equivalents) {
            ExecutionResult.EquivalentStats st = execution.equivalent(eq);
            int decided  = st.committed() + st.rejected();
            int finished = decided + st.errors();
            double successRate = decided > 0 ? st.committed() * 100.0 / decided : 0.0;
            double bottlenecks = finished > 0 ? (st.errors() + st.timeouts()) * 100.0 / finished : 0.0;
            BigDecimal cleared = clearingVolumes.getOrDefault(eq, BigDecimal.ZERO);

            out.add(new EquivalentMetrics(eq, successRate, st.avgRouteLength(),
                totalDebt.getOrDefault(eq, BigDecimal.ZERO).doubleValue(),
                cleared != null ? cleared.doubleValue() : 0.0,
                bottlenecks, activeParticipants, activeLines.getOrDefault(eq, 0)));
        }
        return out;
    }

    private Map<String, BigDecimal> totalDebt(RunState run, LedgerSession session, List<String> equivalents) {
        Map<String, BigDecimal> cached = run.totalDebtByEquivalent();
        int everyN = run.getSettings().metricsEveryNTicks();
        boolean refresh = everyN <= 1 || run.getTickIndex() % everyN == 0 || cached.isEmpty();
        if (!refresh) {
            return cached;
        }
        try {
            Map<String, BigDecimal> totals = new HashMap<>();
            equivalents.forEach(eq -> totals.put(eq, BigDecimal.ZERO));
            for (Debt d : session.debts()) {
                totals.merge(d.equivalent(), d.amount(), BigDecimal::add);
            }
            cached.putAll(totals);
        } catch (RuntimeException e) {
            if (run.shouldWarnThisTick("total-debt")) {
                log.debug("[Metrics] Total debt refresh failed, using last value. runId={} tick={} error={}",
                          run.getRunId(), run.getTickIndex(), e.getMessage());
            }
        }
        return cached;
    }
}
