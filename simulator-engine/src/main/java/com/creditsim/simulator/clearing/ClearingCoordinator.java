package com.creditsim.simulator.clearing;

import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs a clearing pass over several equivalents as one background task under a hard
 * wall-clock timeout.
 *
 * <p>A pass that misses the timeout is asked to stop and left detached on the run.
 * While it is still running, no new pass is started and the next tick waits for it
 * for at most half the hard timeout.
 */
@Component
public class ClearingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ClearingCoordinator.class);

    private static final double MIN_HARD_TIMEOUT_SEC = 2.0;
    private static final double HARD_TIMEOUT_FACTOR  = 4.0;
    private static final double HARD_TIMEOUT_FLOOR   = 0.1;

    private final ClearingEngine engine;

    public ClearingCoordinator(ClearingEngine engine) {
        this.engine = engine;
    }

    static Duration hardTimeout(long timeBudgetMs, double capSec) {
        double sec = Math.max(MIN_HARD_TIMEOUT_SEC, timeBudgetMs / 1000.0 * HARD_TIMEOUT_FACTOR);
        if (capSec > 0) {
            sec = Math.min(sec, capSec);
        }
        sec = Math.max(HARD_TIMEOUT_FLOOR, sec);
        return Duration.ofMillis(Math.round(sec * 1000));
    }

    /**
     * Clears each job's equivalent in order; emits the cleared volume per equivalent. Emits
     * an empty map when a previous pass is still running or this pass hit the hard timeout.
     * The hard timeout is derived from the summed budgets of all jobs.
     */
    public Mono<Map<String, BigDecimal>> runClearing(RunState run, List<ClearingJob> jobs) {
        if (jobs.isEmpty()) {
            return Mono.just(Map.of());
        }
        ClearingTask pending = run.getClearingTask();
        if (pending != null && pending.isRunning()) {
            if (run.shouldWarnThisTick("clearing-in-flight")) {
                log.warn("[Clearing] Previous pass still running, skipped. runId={} tick={} startedTick={}",
                         run.getRunId(), run.getTickIndex(), pending.getTick());
            }
            return Mono.just(Map.of());
        }

        long totalBudgetMs = jobs.stream().mapToLong(ClearingJob::timeBudgetMs).sum();
        Duration hard = hardTimeout(totalBudgetMs, run.getSettings().clearingHardTimeoutCapSec());
        ClearingTask task = ClearingTask.start(run.getTickIndex(), self -> {
            Map<String, BigDecimal> volumes = new LinkedHashMap<>();
            for (ClearingJob job : jobs) {
                if (self.isCancelRequested()) break;
                ClearingResult result = engine.clearBlocking(run, job.equivalent(), job.maxDepth(),
                    job.timeBudgetMs(), self::isCancelRequested);
                volumes.put(job.equivalent(), result.clearedAmount());
            }
            return volumes;
        });
        run.setClearingTask(task);

        return task.result()
            .timeout(hard)
            .doOnNext(v -> run.clearClearingTask(task))
            .onErrorResume(TimeoutException.class, e -> {
                task.cancel();
                log.warn("[Clearing] Hard timeout, pass detached. runId={} tick={} hardTimeoutMs={}",
                         run.getRunId(), run.getTickIndex(), hard.toMillis());
                return Mono.just(Map.of());
            })
            .onErrorResume(e -> {
                run.clearClearingTask(task);
                log.warn("[Clearing] Pass failed. runId={} tick={} error={}",
                         run.getRunId(), run.getTickIndex(), e.getMessage());
                return Mono.just(Map.of());
            });
    }

    /**
     * Waits for a detached pass before the next tick touches the ledger. Gives up after half
     * the hard timeout; a stopping or finished run cancels the pass instead of waiting.
     */
    public Mono<Void> awaitPending(RunState run) {
        ClearingTask task = run.getClearingTask();
        if (task == null) {
            return Mono.empty();
        }
        if (!task.isRunning()) {
            run.clearClearingTask(task);
            return Mono.empty();
        }
        if (!run.isRunning() && run.getStatus() != RunStatus.PAUSED) {
            task.cancel();
            return Mono.empty();
        }
        Duration hard  = hardTimeout(run.getSettings().clearingTimeBudgetMs(),
                                     run.getSettings().clearingHardTimeoutCapSec());
        Duration grace = Duration.ofMillis(Math.max(100, hard.toMillis() / 2));
        return task.result()
            .timeout(grace)
            .doOnNext(v -> run.clearClearingTask(task))
            .onErrorResume(e -> {
                log.debug("[Clearing] Pending pass not finished within grace. runId={} graceMs={} error={}",
                          run.getRunId(), grace.toMillis(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    /**
     * Requests cancellation of any pass attached to {@code run} and waits for it to return,
     * for at most {@code grace}. The pass rolls its own session back once it sees the request.
     */
    public Mono<Void> cancelAndAwait(RunState run, Duration grace) {
        return Mono.defer(() -> {
            ClearingTask task = run.getClearingTask();
            if (task == null || !task.isRunning()) {
                return Mono.<Void>empty();
            }
            cancel(run);
            return task.result()
                .timeout(grace)
                .doOnNext(v -> run.clearClearingTask(task))
                .onErrorResume(e -> {
                    log.warn("[Clearing] Cancelled pass still running after {}ms. runId={} startedTick={} error={}",
                             grace.toMillis(), run.getRunId(), task.getTick(), e.getMessage());
                    return Mono.empty();
                })
                .then();
        });
    }

    /** Requests cancellation of any pass still attached to {@code run}. */
    public void cancel(RunState run) {
        ClearingTask task = run.getClearingTask();
        if (task != null && task.isRunning()) {
            task.cancel();
            log.info("[Clearing] Cancellation requested. runId={} startedTick={}", run.getRunId(), task.getTick());
        }
    }
}
