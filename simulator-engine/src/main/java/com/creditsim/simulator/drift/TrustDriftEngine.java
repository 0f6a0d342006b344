package com.creditsim.simulator.drift;

import com.creditsim.common.event.EdgePatch;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TopologyChangedPayload;
import com.creditsim.common.model.Amounts;
import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.event.EdgePatchBuilder;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.scenario.ScenarioGraph;
import com.creditsim.simulator.scenario.ScenarioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Moves trust-line limits with usage.
 *
 * <p><b>Growth</b> follows a successful clearing pass on every touched line:
 * {@code min(current × (1 + growthRate), original × maxGrowth)}.
 * <b>Decay</b> runs once per tick on active lines not cleared this tick whose
 * {@code debt / limit} reached {@code overloadThreshold}:
 * {@code max(current × (1 − decayRate), original × minLimitRatio)}.
 *
 * <p>Limits stay at cent precision; the growth ceiling is rounded down and the decay
 * floor rounded up, so {@code original × minLimitRatio ≤ limit ≤ original × maxGrowth}
 * always holds. Each change is written to the given ledger session and the run's
 * scenario mirror together, and announced as a {@code topology.changed} event carrying
 * only the changed lines.
 */
@Component
public class TrustDriftEngine {

    private static final Logger log = LoggerFactory.getLogger(TrustDriftEngine.class);

    public static final String REASON_GROWTH = "trust_drift_growth";
    public static final String REASON_DECAY  = "trust_drift_decay";

    private final SimulatorEventBus eventBus;
    private final EdgePatchBuilder  patchBuilder;
    private final ScenarioStore     scenarioStore;

    public TrustDriftEngine(SimulatorEventBus eventBus, EdgePatchBuilder patchBuilder, ScenarioStore scenarioStore) {
        this.eventBus      = eventBus;
        this.patchBuilder  = patchBuilder;
        this.scenarioStore = scenarioStore;
    }

    // ── init ───────────────────────────────────────────────────────────────────

    /** Parses the drift config and records the original limit of every line. Idempotent per line. */
    public void init(RunState run) {
        ScenarioGraph graph = run.getGraph();
        TrustDriftConfig config = TrustDriftConfig.from(graph.settings());
        run.setTrustDriftConfig(config);
        for (TrustLine tl : graph.trustLines()) {
            register(run, tl);
        }
        if (config.enabled()) {
            log.info("[TrustDrift] Initialized. runId={} edges={} growthRate={} decayRate={} maxGrowth={} minLimitRatio={} overloadThreshold={}",
                     run.getRunId(), run.edgeClearingHistory().size(), config.growthRate(), config.decayRate(),
                     config.maxGrowth(), config.minLimitRatio(), config.overloadThreshold());
        }
    }

    /** Starts tracking a line created after init (inject). */
    public void register(RunState run, TrustLine tl) {
        if (tl.limit() == null || tl.limit().signum() <= 0) return;
        run.edgeClearingHistory().putIfAbsent(tl.key(), new EdgeClearingHistory(Amounts.truncate(tl.limit())));
    }

    // ── growth ─────────────────────────────────────────────────────────────────

    /**
     * Grows every line touched by clearing in {@code equivalent}. Writes go to the clearing
     * session; the caller commits it.
     *
     * @param touched         (creditor, debtor) pairs
     * @param clearedPerEdge  cleared volume keyed by {@link TrustLine#key()}
     */
    public TrustDriftResult applyGrowth(RunState run, LedgerSession session, String equivalent,
                                        Collection<Map.Entry<String, String>> touched,
                                        Map<String, BigDecimal> clearedPerEdge, long tick) {
        TrustDriftConfig cfg = run.getTrustDriftConfig();
        if (cfg == null || !cfg.enabled() || touched.isEmpty()) {
            return TrustDriftResult.none();
        }
        ScenarioGraph graph = run.getGraph();
        BigDecimal multiplier = BigDecimal.ONE.add(BigDecimal.valueOf(cfg.growthRate()));
        BigDecimal maxGrowth  = BigDecimal.valueOf(cfg.maxGrowth());
        List<TrustLine> updated = new ArrayList<>();

        for (Map.Entry<String, String> pair : touched) {
            String key = TrustLine.key(pair.getKey(), pair.getValue(), equivalent);
            EdgeClearingHistory history = run.edgeClearingHistory().get(key);
            if (history == null) continue;
            history.recordClearing(tick, Amounts.truncate(clearedPerEdge.getOrDefault(key, BigDecimal.ZERO)));

            TrustLine line = graph.trustLine(pair.getKey(), pair.getValue(), equivalent).orElse(null);
            if (line == null || line.limit() == null) continue;

            BigDecimal current = Amounts.truncate(line.limit());
            BigDecimal ceiling = history.getOriginalLimit().multiply(maxGrowth).setScale(Amounts.SCALE, RoundingMode.FLOOR);
            BigDecimal newLimit = Amounts.truncate(current.multiply(multiplier)).min(ceiling);
            if (newLimit.compareTo(current) != 0) {
                updated.add(writeLimit(session, graph, line, newLimit));
                log.info("[TrustDrift] Growth. runId={} key={} old={} new={}", run.getRunId(), key, current, newLimit);
            }
        }
        return publish(run, session, REASON_GROWTH, updated);
    }

    // ── decay ──────────────────────────────────────────────────────────────────

    /**
     * Decays overloaded active lines that were not cleared in {@code tick}. Writes go to the
     * main tick session; the caller commits it.
     */
    public TrustDriftResult applyDecay(RunState run, LedgerSession session, DebtSnapshot snapshot, long tick) {
        TrustDriftConfig cfg = run.getTrustDriftConfig();
        if (cfg == null || !cfg.enabled()) {
            return TrustDriftResult.none();
        }
        ScenarioGraph graph = run.getGraph();
        BigDecimal multiplier = BigDecimal.ONE.subtract(BigDecimal.valueOf(cfg.decayRate()));
        BigDecimal minRatio   = BigDecimal.valueOf(cfg.minLimitRatio());
        BigDecimal threshold  = BigDecimal.valueOf(cfg.overloadThreshold());
        List<TrustLine> updated = new ArrayList<>();

        for (TrustLine line : graph.activeTrustLines()) {
            EdgeClearingHistory history = run.edgeClearingHistory().get(line.key());
            if (history == null || history.getLastClearingTick() == tick) continue;
            if (line.limit() == null) continue;

            BigDecimal current = Amounts.truncate(line.limit());
            if (current.signum() <= 0) continue;
            BigDecimal debt  = snapshot.amount(line.to(), line.from(), line.equivalent());
            BigDecimal ratio = debt.divide(current, 6, RoundingMode.HALF_UP);
            if (ratio.compareTo(threshold) < 0) continue;

            BigDecimal floor = history.getOriginalLimit().multiply(minRatio).setScale(Amounts.SCALE, RoundingMode.CEILING);
            BigDecimal newLimit = Amounts.truncate(current.multiply(multiplier)).max(floor);
            if (newLimit.compareTo(current) != 0) {
                updated.add(writeLimit(session, graph, line, newLimit));
                log.info("[TrustDrift] Decay. runId={} key={} old={} new={} ratio={}",
                         run.getRunId(), line.key(), current, newLimit, ratio);
            }
        }
        return publish(run, session, REASON_DECAY, updated);
    }

    /** Mirrors changed lines into the durable scenario document. */
    public Mono<Void> persist(RunState run, TrustDriftResult result) {
        return Flux.fromIterable(result.updated())
            .concatMap(tl -> scenarioStore.patchTrustLine(run.getScenarioId(), tl))
            .then();
    }

    // ── internals ──────────────────────────────────────────────────────────────

    private TrustLine writeLimit(LedgerSession session, ScenarioGraph graph, TrustLine line, BigDecimal newLimit) {
        TrustLine updated = line.withLimit(newLimit);
        session.upsertTrustLine(updated);
        graph.updateTrustLineLimit(line.from(), line.to(), line.equivalent(), newLimit);
        return updated;
    }

    private TrustDriftResult publish(RunState run, LedgerSession session, String reason, List<TrustLine> updated) {
        if (updated.isEmpty()) {
            return TrustDriftResult.none();
        }
        Map<String, List<TrustLine>> byEq = new TreeMap<>();
        updated.forEach(tl -> byEq.computeIfAbsent(tl.equivalent(), k -> new ArrayList<>()).add(tl));

        byEq.forEach((eq, lines) -> {
            List<EdgePatch> patches = new ArrayList<>();
            for (TrustLine tl : lines) {
                patches.add(patchBuilder.edge(session, tl));
            }
            if (patches.isEmpty()) {
                log.debug("[TrustDrift] Skipped empty topology change. runId={} eq={} reason={}", run.getRunId(), eq, reason);
                return;
            }
            eventBus.publish(run.getRunId(), SimulatorEvent.TOPOLOGY_CHANGED,
                new TopologyChangedPayload(eq, reason, List.of(), patches));
        });
        return new TrustDriftResult(updated.size(), byEq);
    }
}
