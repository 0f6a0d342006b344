package com.creditsim.simulator.job;

import com.creditsim.simulator.orchestrator.TickOrchestrator;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.RunStatus;
import com.creditsim.simulator.run.RunStatusPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * Drives the tick loop of each run.
 *
 * <p>Every run has its own loop:
 * <pre>
 *   delay(tickInterval) → advance clock → tick → run_status → repeat
 * </pre>
 * Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the next
 * one, so ticks of a run never overlap. A paused run keeps cycling without ticking; a
 * stopping or terminal run ends its loop. Tick errors are absorbed and the loop continues.
 *
 * <p>{@link #stop} cancels the pending cycle and waits, up to {@link #STOP_GRACE}, until the
 * cycle has torn down, so that a tick's in-flight payments and ledger session are released
 * before the run is reported stopped.
 */
@Component
public class TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    static final Duration STOP_GRACE = Duration.ofSeconds(10);

    private final TickOrchestrator   orchestrator;
    private final RunStatusPublisher statusPublisher;

    public TickScheduler(TickOrchestrator orchestrator, RunStatusPublisher statusPublisher) {
        this.orchestrator    = orchestrator;
        this.statusPublisher = statusPublisher;
    }

    public void start(RunState run) {
        Duration interval = interval(run);
        log.info("TICK_LOOP_STARTED runId={} tickIntervalMs={} simStepMs={}",
                 run.getRunId(), interval.toMillis(), run.getSettings().simStepMs());
        scheduleNextTick(run, interval);
    }

    /**
     * Disposes the pending cycle; a tick already in progress is cancelled with it.
     * Completes once that cycle has finished tearing down.
     */
    public Mono<Void> stop(RunState run) {
        return Mono.defer(() -> {
            Disposable loop = run.getTickLoop();
            if (loop == null || loop.isDisposed()) {
                return Mono.<Void>empty();
            }
            loop.dispose();
            return run.getPendingCycle()
                .timeout(STOP_GRACE)
                .doOnSuccess(v -> log.info("TICK_LOOP_STOPPED runId={} tick={}", run.getRunId(), run.getTickIndex()))
                .onErrorResume(e -> {
                    log.warn("[Scheduler] Cycle did not finish within {}ms of stop. runId={} tick={}",
                             STOP_GRACE.toMillis(), run.getRunId(), run.getTickIndex());
                    return Mono.empty();
                });
        });
    }

    // ── loop ───────────────────────────────────────────────────────────────────

    private void scheduleNextTick(RunState run, Duration delay) {
        Sinks.Empty<Void> done = Sinks.empty();
        run.setPendingCycle(done.asMono());
        Disposable next = Mono.delay(delay)
            .then(Mono.defer(() -> cycle(run)))
            .doFinally(signal -> done.tryEmitEmpty())
            .subscribe(
                v -> { },
                err -> {
                    log.error("Tick cycle failed. runId={} tick={}, rescheduling", run.getRunId(), run.getTickIndex(), err);
                    reschedule(run);
                },
                () -> reschedule(run)
            );
        run.setTickLoop(next);
    }

    private void reschedule(RunState run) {
        RunStatus status = run.getStatus();
        if (status == RunStatus.STOPPING || status.isTerminal()) {
            log.info("TICK_LOOP_ENDED runId={} state={} tick={}", run.getRunId(), status.wireName(), run.getTickIndex());
            return;
        }
        scheduleNextTick(run, interval(run));
    }

    Mono<Void> cycle(RunState run) {
        if (!run.isRunning()) {
            return Mono.empty();
        }
        run.advanceClock(run.getSettings().simStepMs());
        return orchestrator.tick(run.getRunId())
            .onErrorResume(e -> {
                log.error("Tick failed outside the tick pipeline. runId={} tick={}", run.getRunId(), run.getTickIndex(), e);
                return Mono.empty();
            })
            .then(Mono.fromRunnable(() -> statusPublisher.announce(run)));
    }

    private static Duration interval(RunState run) {
        return Duration.ofMillis(Math.max(1, run.getSettings().tickIntervalMs()));
    }
}
