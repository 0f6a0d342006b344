package com.creditsim.simulator.orchestrator;

import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.common.trace.RunContextUtil;
import com.creditsim.simulator.audit.TickBalanceAuditor;
import com.creditsim.simulator.clearing.ClearingCoordinator;
import com.creditsim.simulator.clearing.ClearingJob;
import com.creditsim.simulator.clearing.ClearingTask;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.drift.TrustDriftEngine;
import com.creditsim.simulator.drift.TrustDriftResult;
import com.creditsim.simulator.executor.ExecutionResult;
import com.creditsim.simulator.executor.PaymentExecutor;
import com.creditsim.simulator.ledger.LedgerService;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.metrics.BottleneckAnalyzer;
import com.creditsim.simulator.metrics.EquivalentMetrics;
import com.creditsim.simulator.metrics.TickMetricsCalculator;
import com.creditsim.simulator.persistence.MetricsStore;
import com.creditsim.simulator.planner.PaymentPlanner;
import com.creditsim.simulator.run.RunRegistry;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.RunStatusPublisher;
import com.creditsim.simulator.run.TickContext;
import com.creditsim.simulator.run.TickSummary;
import com.creditsim.simulator.scenario.ScenarioGraph;
import com.creditsim.simulator.strategy.AdaptiveClearingPolicy;
import com.creditsim.simulator.strategy.ClearingDecision;
import com.creditsim.simulator.strategy.TickSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs exactly one tick of a running run.
 *
 * <p>Phases, all in one ledger session:
 * <pre>
 *   seed (first tick) → due events → debt snapshot → plan → execute
 *     → failure ceilings → commit + clearing (own session) → decay → balance audit → metrics → commit
 * </pre>
 * The main session is committed before clearing opens its own, since the ledger holds a
 * single write lock per session. Any uncaught failure rolls the session back and counts a
 * tick failure; enough consecutive failures end the run in {@code error}. Ticks of one run
 * must not overlap; {@code TickScheduler} drives them one after another.
 */
@Service
public class TickOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TickOrchestrator.class);

    public static final String TICK_FAILED          = "REAL_MODE_TICK_FAILED";
    public static final String TICK_FAILED_REPEATED = "REAL_MODE_TICK_FAILED_REPEATED";
    public static final String TOO_MANY_TIMEOUTS    = "REAL_MODE_TOO_MANY_TIMEOUTS";
    public static final String TOO_MANY_ERRORS      = "REAL_MODE_TOO_MANY_ERRORS";

    private final RunRegistry           registry;
    private final LedgerService         ledger;
    private final ScenarioEventApplier  eventApplier;
    private final PaymentPlanner        planner;
    private final PaymentExecutor       executor;
    private final ClearingCoordinator   clearing;
    private final TrustDriftEngine      trustDrift;
    private final TickMetricsCalculator metricsCalculator;
    private final MetricsStore          metricsStore;
    private final RunStatusPublisher    statusPublisher;
    private final TickBalanceAuditor    auditor;

    public TickOrchestrator(RunRegistry registry,
                            LedgerService ledger,
                            ScenarioEventApplier eventApplier,
                            PaymentPlanner planner,
                            PaymentExecutor executor,
                            ClearingCoordinator clearing,
                            TrustDriftEngine trustDrift,
                            TickMetricsCalculator metricsCalculator,
                            MetricsStore metricsStore,
                            RunStatusPublisher statusPublisher,
                            TickBalanceAuditor auditor) {
        this.registry          = registry;
        this.ledger            = ledger;
        this.eventApplier      = eventApplier;
        this.planner           = planner;
        this.executor          = executor;
        this.clearing          = clearing;
        this.trustDrift        = trustDrift;
        this.metricsCalculator = metricsCalculator;
        this.metricsStore      = metricsStore;
        this.statusPublisher   = statusPublisher;
        this.auditor           = auditor;
    }

    /**
     * Executes the current tick of {@code runId}. Never errors for tick-level failures:
     * those are rolled back and turned into run state.
     */
    public Mono<Void> tick(String runId) {
        return Mono.defer(() -> {
                RunState run = registry.get(runId);
                if (!run.isRunning()) {
                    return Mono.<Void>empty();
                }
                return clearing.awaitPending(run).then(Mono.defer(() -> runInSession(run)));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .transform(tick -> RunContextUtil.withRunId(tick, runId));
    }

    private Mono<Void> runInSession(RunState run) {
        long started = System.nanoTime();
        LedgerSession session = ledger.openSession();
        return Mono.defer(() -> phases(run, session, started))
            .then(Mono.fromRunnable(() -> {
                session.commit();
                run.resetTickFailures();
            }))
            .onErrorResume(e -> {
                session.rollback();
                return onTickFailure(run, e);
            })
            .doOnCancel(session::close)
            .then();
    }

    // ── phases ─────────────────────────────────────────────────────────────────

    private Mono<Void> phases(RunState run, LedgerSession session, long started) {
        ScenarioGraph graph = run.getGraph();
        long          tick  = run.getTickIndex();

        seed(run, session);
        List<Participant> participants = graph.participants();
        if (participants.size() < 2) {
            if (run.shouldWarnThisTick("too-few-participants")) {
                log.warn("[Tick] Fewer than 2 participants, nothing to do. runId={} tick={}", run.getRunId(), tick);
            }
            return Mono.empty();
        }

        return eventApplier.applyDue(run, session)
            .flatMap(fired -> {
                DebtSnapshot snapshot = snapshot(run, session);
                List<PaymentIntent> intents = planner.plan(run, graph, snapshot);
                log.debug("[Tick] Planned. runId={} tick={} intents={} eventsFired={}",
                          run.getRunId(), tick, intents.size(), fired);

                return executor.execute(new TickContext(run, session), intents,
                        pid -> Mono.justOrEmpty(graph.participant(pid)))
                    .flatMap(result -> afterExecution(run, session, snapshot, intents, result, started));
            });
    }

    private Mono<Void> afterExecution(RunState run, LedgerSession session, DebtSnapshot snapshot,
                                      List<PaymentIntent> intents, ExecutionResult result, long started) {
        SimulatorSettings settings = run.getSettings();
        boolean fatal = false;

        if (result.aborted()) {
            fatal = failRun(run, TOO_MANY_TIMEOUTS,
                "Timeouts in tick " + run.getTickIndex() + " reached " + settings.maxTimeoutsPerTick());
        } else if (settings.maxErrorsTotal() > 0 && run.getErrors() >= settings.maxErrorsTotal()) {
            fatal = failRun(run, TOO_MANY_ERRORS,
                "Errors reached " + run.getErrors() + " of " + settings.maxErrorsTotal());
        }

        Mono<Map<String, BigDecimal>> clearingStep = fatal
            ? Mono.just(Map.of())
            : runClearing(run, session, snapshot, result);

        boolean skipDecay = fatal;
        return clearingStep.flatMap(volumes -> {
            Mono<Void> decay = skipDecay ? Mono.empty() : decay(run, session);
            return decay
                .then(Mono.fromRunnable(() -> audit(run, session, snapshot, result, volumes)))
                .then(Mono.defer(() -> persistTick(run, session, intents, result, volumes, started)));
        });
    }

    private void seed(RunState run, LedgerSession session) {
        if (run.isSeeded()) return;
        ScenarioGraph graph = run.getGraph();
        if (!session.isSeeded(graph.scenarioId())) {
            session.seed(graph.source());
            log.info("[Tick] Ledger seeded. runId={} scenarioId={} participants={} trustlines={}",
                     run.getRunId(), graph.scenarioId(), graph.participants().size(), graph.trustLines().size());
        }
        trustDrift.init(run);
        run.markSeeded();
    }

    private DebtSnapshot snapshot(RunState run, LedgerSession session) {
        try {
            return DebtSnapshot.of(session.debts());
        } catch (RuntimeException e) {
            if (run.shouldWarnThisTick("snapshot-load")) {
                log.warn("[Tick] Debt snapshot load failed, planning without capacity data. runId={} tick={} error={}",
                         run.getRunId(), run.getTickIndex(), e.getMessage());
            }
            return DebtSnapshot.empty();
        }
    }

    // ── clearing ───────────────────────────────────────────────────────────────

    private Mono<Map<String, BigDecimal>> runClearing(RunState run, LedgerSession session,
                                                      DebtSnapshot snapshot, ExecutionResult result) {
        List<ClearingJob> jobs = clearingJobs(run, snapshot, result);
        if (jobs.isEmpty()) {
            return Mono.just(Map.of());
        }
        session.commit();
        long tick    = run.getTickIndex();
        long started = System.nanoTime();
        return clearing.runClearing(run, jobs)
            .doOnNext(volumes -> {
                AdaptiveClearingPolicy policy = run.getClearingPolicy();
                if (policy == null) return;
                long costMs = (System.nanoTime() - started) / 1_000_000L;
                volumes.forEach((eq, volume) -> policy.recordResult(eq, tick, volume, costMs));
            });
    }

    List<ClearingJob> clearingJobs(RunState run, DebtSnapshot snapshot, ExecutionResult result) {
        SimulatorSettings settings = run.getSettings();
        List<String> equivalents = run.getGraph().equivalents();
        long tick = run.getTickIndex();
        List<ClearingJob> jobs = new ArrayList<>();

        AdaptiveClearingPolicy policy = run.getClearingPolicy();
        if (settings.isAdaptive() && policy != null) {
            for (String eq : equivalents) {
                ExecutionResult.EquivalentStats st = result.equivalent(eq);
                policy.recordSignals(eq, new TickSignals(st.attempts(), result.noCapacityRejections(eq),
                    snapshot.totalDebt(eq)));
                ClearingDecision decision = policy.evaluate(eq, tick);
                log.debug("[Tick] Clearing decision. runId={} tick={} eq={} run={} reason={} depth={} budgetMs={}",
                          run.getRunId(), tick, eq, decision.shouldRun(), decision.reason(),
                          decision.maxDepth(), decision.timeBudgetMs());
                if (decision.shouldRun()) {
                    jobs.add(new ClearingJob(eq, decision.maxDepth(), decision.timeBudgetMs()));
                }
            }
            return jobs;
        }

        int everyN = settings.clearingEveryNTicks();
        if (everyN > 0 && tick % everyN == 0) {
            for (String eq : equivalents) {
                jobs.add(new ClearingJob(eq, settings.clearingMaxDepth(), settings.clearingTimeBudgetMs()));
            }
        }
        return jobs;
    }

    // ── decay ──────────────────────────────────────────────────────────────────

    private Mono<Void> decay(RunState run, LedgerSession session) {
        ClearingTask detached = run.getClearingTask();
        if (detached != null && detached.isRunning()) {
            if (run.shouldWarnThisTick("decay-skipped")) {
                log.warn("[Tick] Clearing still running, decay deferred. runId={} tick={}",
                         run.getRunId(), run.getTickIndex());
            }
            return Mono.empty();
        }
        TrustDriftResult decayed;
        try {
            decayed = trustDrift.applyDecay(run, session, DebtSnapshot.of(session.debts()), run.getTickIndex());
        } catch (RuntimeException e) {
            log.warn("[Tick] Trust decay failed. runId={} tick={} error={}", run.getRunId(), run.getTickIndex(), e.getMessage());
            return Mono.empty();
        }
        if (decayed.updatedCount() == 0) {
            return Mono.empty();
        }
        return trustDrift.persist(run, decayed)
            .onErrorResume(e -> {
                log.warn("[Tick] Scenario patch after decay failed. runId={} error={}", run.getRunId(), e.getMessage());
                return Mono.empty();
            });
    }

    // ── audit ──────────────────────────────────────────────────────────────────

    private void audit(RunState run, LedgerSession session, DebtSnapshot snapshot,
                       ExecutionResult result, Map<String, BigDecimal> volumes) {
        if (result.committed() == 0) return;
        try {
            auditor.auditTick(run, snapshot, session.debts(), result.outcomes(), volumes);
        } catch (RuntimeException e) {
            if (run.shouldWarnThisTick("audit")) {
                log.warn("[Tick] Balance audit failed. runId={} tick={} error={}",
                         run.getRunId(), run.getTickIndex(), e.getMessage());
            }
        }
    }

    // ── metrics and status ─────────────────────────────────────────────────────

    private Mono<Void> persistTick(RunState run, LedgerSession session, List<PaymentIntent> intents,
                                   ExecutionResult result, Map<String, BigDecimal> volumes, long started) {
        SimulatorSettings settings = run.getSettings();
        long tick = run.getTickIndex();
        long durationMs = (System.nanoTime() - started) / 1_000_000L;
        run.setLastTick(new TickSummary(tick, run.getSimTimeMs(), intents.size(), result.committed(),
            result.rejected(), result.errors(), result.timeouts(), durationMs));

        List<Mono<Void>> writes = new ArrayList<>();
        int metricsEvery = settings.metricsEveryNTicks();
        if (metricsEvery <= 1 || tick % metricsEvery == 0) {
            List<EquivalentMetrics> metrics = metricsCalculator.compute(run, session, result, volumes);
            writes.add(metricsStore.writeTickMetrics(run.getRunId(), run.getSimTimeMs(), metrics));
        }
        int bottlenecksEvery = settings.bottlenecksEveryNTicks();
        if (bottlenecksEvery <= 1 || tick % bottlenecksEvery == 0) {
            Instant computedAt = run.getClock().instant();
            for (String eq : run.getGraph().equivalents()) {
                writes.add(metricsStore.writeBottlenecks(run.getRunId(), eq, computedAt,
                    BottleneckAnalyzer.analyze(eq, result.byEdge().values(), BottleneckAnalyzer.DEFAULT_LIMIT)));
            }
        }
        long nowMs = run.getClock().millis();
        if (settings.artifactsEveryMs() > 0 && nowMs - run.getLastArtifactAtMs() >= settings.artifactsEveryMs()) {
            run.setLastArtifactAtMs(nowMs);
            writes.add(metricsStore.writeRunStatus(run.getRunId(), run.getScenarioId(), run.toStatusPayload()));
        }

        return Flux.concat(writes)
            .then()
            .onErrorResume(e -> {
                if (run.shouldWarnThisTick("metrics-write")) {
                    log.warn("[Tick] Metrics write failed. runId={} tick={} error={}", run.getRunId(), tick, e.getMessage());
                }
                return Mono.empty();
            })
            .doOnSuccess(v -> log.debug("[Tick] Done. runId={} tick={} planned={} committed={} rejected={} errors={} durationMs={}",
                                        run.getRunId(), tick, intents.size(), result.committed(), result.rejected(),
                                        result.errors(), durationMs));
    }

    // ── failures ───────────────────────────────────────────────────────────────

    private Mono<Void> onTickFailure(RunState run, Throwable e) {
        return Mono.deferContextual(ctx -> {
            int consecutive = run.recordTickFailure();
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            run.recordError(TICK_FAILED, message);
            RunContextUtil.withMdc(RunContextUtil.getRunId(ctx), () ->
                log.warn("TICK_FAILED tick={} consecutive={} error={}",
                         run.getTickIndex(), consecutive, message, e));

            int ceiling = run.getSettings().maxConsecTickFailures();
            if (ceiling > 0 && consecutive >= ceiling) {
                RunContextUtil.withMdc(RunContextUtil.getRunId(ctx), () ->
                    failRun(run, TICK_FAILED_REPEATED, consecutive + " consecutive tick failures, last: " + message));
            }
            return Mono.empty();
        });
    }

    /**
     * Ends {@code run} in {@code error}; cancels a detached clearing pass and announces the
     * new status.
     *
     * @return {@code true} when this call failed the run
     */
    public boolean failRun(RunState run, String code, String message) {
        if (!run.fail(code, message)) {
            return false;
        }
        clearing.cancel(run);
        log.error("RUN_FAILED runId={} tick={} code={} message={}", run.getRunId(), run.getTickIndex(), code, message);
        statusPublisher.publish(run).subscribe();
        return true;
    }
}
