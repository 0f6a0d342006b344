package com.creditsim.simulator.clearing;

import com.creditsim.common.event.ClearingDonePayload;
import com.creditsim.common.event.ClearingPlanPayload;
import com.creditsim.common.event.CycleEdgeRef;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.model.Amounts;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.drift.TrustDriftEngine;
import com.creditsim.simulator.drift.TrustDriftResult;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.ledger.LedgerService;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.run.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Settles debt cycles of one equivalent in a ledger session of its own.
 *
 * <p>Loop: search cycles, settle the first one that succeeds for its minimum edge
 * amount, search again. Stops when no cycle settles, after {@link #MAX_CYCLES_PER_PASS}
 * settled cycles, when the time budget (checked before each search) runs out, or when
 * cancellation is requested. Trust growth for the touched lines is applied in the same
 * session before it is committed. Failures are confined to this equivalent: the session is
 * rolled back and the run is charged one {@code CLEARING_ERROR}.
 */
@Component
public class ClearingEngine {

    private static final Logger log = LoggerFactory.getLogger(ClearingEngine.class);

    public static final String CLEARING_ERROR      = "CLEARING_ERROR";
    static final int           MAX_CYCLES_PER_PASS = 100;
    static final int           YIELD_EVERY         = 5;

    private final LedgerService     ledger;
    private final SimulatorEventBus eventBus;
    private final TrustDriftEngine  trustDrift;

    public ClearingEngine(LedgerService ledger, SimulatorEventBus eventBus, TrustDriftEngine trustDrift) {
        this.ledger     = ledger;
        this.eventBus   = eventBus;
        this.trustDrift = trustDrift;
    }

    public Mono<ClearingResult> clear(RunState run, String equivalent, int maxDepth, long timeBudgetMs) {
        return Mono.fromCallable(() -> clearBlocking(run, equivalent, maxDepth, timeBudgetMs, () -> false))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Seed choosing the cycle that is both announced and settled first. */
    static long prioritySeed(String runId, long tick, String equivalent) {
        return ((long) runId.hashCode() * 1_000_003L + tick) * 31L + equivalent.hashCode();
    }

    ClearingResult clearBlocking(RunState run, String equivalent, int maxDepth, long timeBudgetMs,
                                 BooleanSupplier cancelRequested) {
        long tick    = run.getTickIndex();
        long seed    = prioritySeed(run.getRunId(), tick, equivalent);
        long started = System.nanoTime();
        LedgerSession session = ledger.openSession();
        try {
            List<List<Debt>> cycles = CycleFinder.prioritize(
                CycleFinder.find(session.debts(), equivalent, maxDepth), seed);
            if (cycles.isEmpty()) {
                log.debug("[Clearing] No cycles. runId={} tick={} eq={}", run.getRunId(), tick, equivalent);
                return ClearingResult.nothing(equivalent);
            }

            String planId = "plan_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            eventBus.publish(run.getRunId(), SimulatorEvent.CLEARING_PLAN,
                new ClearingPlanPayload(planId, equivalent, edgeRefs(cycles.get(0))));

            int        clearedCycles = 0;
            BigDecimal clearedAmount = BigDecimal.ZERO;
            boolean    budgetExceeded = false;
            boolean    cancelled      = false;
            Set<String>                     touchedNodes   = new TreeSet<>();
            Set<Map.Entry<String, String>>  touchedEdges   = new LinkedHashSet<>();
            Map<String, BigDecimal>         clearedPerEdge = new LinkedHashMap<>();

            while (true) {
                if (cancelRequested.getAsBoolean()) {
                    cancelled = true;
                    break;
                }
                if (clearedCycles > 0 && clearedCycles % YIELD_EVERY == 0) {
                    Thread.yield();
                }
                long elapsedMs = elapsedMs(started);
                if (timeBudgetMs > 0 && elapsedMs >= timeBudgetMs) {
                    budgetExceeded = true;
                    if (run.shouldWarnThisTick("clearing-budget:" + equivalent)) {
                        log.warn("[Clearing] Time budget exceeded. runId={} tick={} eq={} budgetMs={} elapsedMs={} clearedCycles={}",
                                 run.getRunId(), tick, equivalent, timeBudgetMs, elapsedMs, clearedCycles);
                    }
                    break;
                }

                cycles = CycleFinder.prioritize(CycleFinder.find(session.debts(), equivalent, maxDepth), seed);
                if (cycles.isEmpty()) break;

                boolean executed = false;
                for (List<Debt> cycle : cycles) {
                    BigDecimal amount = cycle.stream().map(Debt::amount).reduce(BigDecimal::min).orElse(BigDecimal.ZERO);
                    Boolean settled = session.settleCycle(equivalent, cycle, amount).block();
                    if (!Boolean.TRUE.equals(settled)) continue;

                    clearedCycles++;
                    if (amount.signum() > 0) clearedAmount = clearedAmount.add(amount);
                    for (Debt edge : cycle) {
                        touchedNodes.add(edge.debtor());
                        touchedNodes.add(edge.creditor());
                        touchedEdges.add(new AbstractMap.SimpleImmutableEntry<>(edge.creditor(), edge.debtor()));
                        clearedPerEdge.merge(lineKey(edge), amount, BigDecimal::add);
                    }
                    executed = true;
                    break;
                }
                if (!executed || clearedCycles >= MAX_CYCLES_PER_PASS) break;
            }

            if (cancelled) {
                session.rollback();
                log.warn("[Clearing] Cancelled, rolled back. runId={} tick={} eq={} clearedCycles={}",
                         run.getRunId(), tick, equivalent, clearedCycles);
                return new ClearingResult(equivalent, planId, 0, BigDecimal.ZERO, List.of(), List.of(),
                    elapsedMs(started), budgetExceeded, true, null);
            }

            TrustDriftResult growth = applyGrowth(run, session, equivalent, touchedEdges, clearedPerEdge, tick);
            session.commit();
            persistGrowth(run, growth);

            List<CycleEdgeRef> edgeRefs = touchedEdges.stream()
                .map(e -> new CycleEdgeRef(e.getValue(), e.getKey()))
                .collect(Collectors.toList());
            BigDecimal cleared = Amounts.truncate(clearedAmount);
            eventBus.publish(run.getRunId(), SimulatorEvent.CLEARING_DONE, new ClearingDonePayload(
                planId, equivalent, clearedCycles, cleared, new ArrayList<>(touchedNodes), edgeRefs));

            long elapsed = elapsedMs(started);
            log.info("[Clearing] Done. runId={} tick={} eq={} cycles={} amount={} elapsedMs={}",
                     run.getRunId(), tick, equivalent, clearedCycles, cleared, elapsed);
            return new ClearingResult(equivalent, planId, clearedCycles, cleared, new ArrayList<>(touchedNodes),
                edgeRefs, elapsed, budgetExceeded, false, null);

        } catch (RuntimeException e) {
            session.rollback();
            if (run.shouldWarnThisTick("clearing-failed:" + equivalent)) {
                log.warn("[Clearing] Failed. runId={} tick={} eq={} error={}",
                         run.getRunId(), tick, equivalent, e.getMessage(), e);
            }
            run.recordError(CLEARING_ERROR, String.valueOf(e.getMessage()));
            return ClearingResult.failed(equivalent, String.valueOf(e.getMessage()));
        } finally {
            session.rollback();
        }
    }

    private TrustDriftResult applyGrowth(RunState run, LedgerSession session, String equivalent,
                                         Set<Map.Entry<String, String>> touchedEdges,
                                         Map<String, BigDecimal> clearedPerEdge, long tick) {
        if (touchedEdges.isEmpty()) return TrustDriftResult.none();
        try {
            return trustDrift.applyGrowth(run, session, equivalent, touchedEdges, clearedPerEdge, tick);
        } catch (RuntimeException e) {
            log.warn("[Clearing] Trust growth failed. runId={} tick={} eq={} error={}",
                     run.getRunId(), tick, equivalent, e.getMessage());
            return TrustDriftResult.none();
        }
    }

    private void persistGrowth(RunState run, TrustDriftResult growth) {
        if (growth.updatedCount() == 0) return;
        trustDrift.persist(run, growth)
            .onErrorResume(e -> {
                log.warn("[Clearing] Scenario patch after growth failed. runId={} error={}", run.getRunId(), e.getMessage());
                return Mono.empty();
            })
            .block();
    }

    private static List<CycleEdgeRef> edgeRefs(List<Debt> cycle) {
        return cycle.stream().map(d -> new CycleEdgeRef(d.debtor(), d.creditor())).collect(Collectors.toList());
    }

    /** Trust line behind a debt edge: the creditor extended credit to the debtor. */
    private static String lineKey(Debt edge) {
        return TrustLine.key(edge.creditor(), edge.debtor(), edge.equivalent());
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
