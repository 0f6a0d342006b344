package com.creditsim.simulator.executor;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Non-blocking mutual exclusion around calls into the shared tick session.
 *
 * <p>Waiters are served FIFO. A waiter cancelled before it gets the token leaves the
 * queue; a token granted to an already-cancelled waiter is passed on, so cancellation
 * never strands the token.
 */
public final class LedgerAccessToken {

    private final Object        lock    = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private boolean             held;

    /** Subscribes to {@code body} only while holding the token; releases on any termination. */
    public <T> Mono<T> withToken(Supplier<Mono<T>> body) {
        return Mono.usingWhen(
            acquire(),
            permit -> Mono.defer(body),
            permit -> Mono.fromRunnable(permit::release),
            (permit, error) -> Mono.fromRunnable(permit::release),
            permit -> Mono.fromRunnable(permit::release));
    }

    public boolean isHeld() {
        synchronized (lock) {
            return held;
        }
    }

    Mono<Permit> acquire() {
        return Mono.defer(() -> {
            Waiter waiter;
            synchronized (lock) {
                if (!held) {
                    held = true;
                    return Mono.just(new Permit());
                }
                waiter = new Waiter();
                waiters.addLast(waiter);
            }
            return waiter.sink.asMono().doOnCancel(() -> abandon(waiter));
        });
    }

    private void abandon(Waiter waiter) {
        Permit granted;
        synchronized (lock) {
            if (waiters.remove(waiter)) return;
            granted = waiter.granted;
        }
        if (granted != null) {
            granted.release();
        }
    }

    private void handOver() {
        Waiter next;
        Permit permit;
        synchronized (lock) {
            next = waiters.pollFirst();
            if (next == null) {
                held = false;
                return;
            }
            permit = new Permit();
            next.granted = permit;
        }
        next.sink.tryEmitValue(permit);
    }

    private static final class Waiter {
        final Sinks.One<Permit> sink = Sinks.one();
        volatile Permit granted;
    }

    final class Permit {
        private final AtomicBoolean released = new AtomicBoolean(false);

        void release() {
            if (released.compareAndSet(false, true)) {
                handOver();
            }
        }
    }
}
