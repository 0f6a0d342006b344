package com.creditsim.simulator.clearing;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Handle of a clearing pass running on its own bounded-elastic thread.
 *
 * <p>Stored on the run so that a pass which outlived its hard timeout is detached,
 * not restarted: cancellation only raises a flag the pass checks between cycles,
 * and {@link #isRunning()} stays {@code true} until the pass actually returns.
 */
public final class ClearingTask {

    private final long                                tick;
    private final AtomicBoolean                       cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean                       finished        = new AtomicBoolean(false);
    private final Sinks.One<Map<String, BigDecimal>>  result          = Sinks.one();

    private ClearingTask(long tick) {
        this.tick = tick;
    }

    /** Starts {@code body} in the background; its return value is the cleared volume per equivalent. */
    public static ClearingTask start(long tick, Function<ClearingTask, Map<String, BigDecimal>> body) {
        ClearingTask task = new ClearingTask(tick);
        Mono.fromCallable(() -> {
                try {
                    return body.apply(task);
                } finally {
                    task.finished.set(true);
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                v -> task.result.tryEmitValue(v),
                e -> task.result.tryEmitError(e)
            );
        return task;
    }

    public Mono<Map<String, BigDecimal>> result() {
        return result.asMono();
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isRunning() {
        return !finished.get();
    }

    public long getTick() {
        return tick;
    }
}
