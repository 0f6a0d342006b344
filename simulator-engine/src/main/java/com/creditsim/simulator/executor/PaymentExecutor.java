package com.creditsim.simulator.executor;

import com.creditsim.common.event.EdgePatch;
import com.creditsim.common.event.NodePatch;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TxFailedPayload;
import com.creditsim.common.event.TxUpdatedPayload;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.event.EdgePatchBuilder;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.ledger.LedgerRejectionException;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.ledger.LedgerTimeoutException;
import com.creditsim.simulator.ledger.PaymentReceipt;
import com.creditsim.simulator.ledger.PaymentRequest;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.TickContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a planned batch against the tick's ledger session.
 *
 * <p>Up to {@code maxInFlight} intents are in progress at once, but every call into the
 * shared session goes through one {@link LedgerAccessToken}. Outcomes may complete in any
 * order; they are broadcast and counted strictly by {@code seq} through an
 * {@link OrderedEmitter}. Reaching the per-tick timeout ceiling cancels the remaining
 * intents and marks the result aborted.
 */
@Service
public class PaymentExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaymentExecutor.class);

    static final int STALL_WARN_EVERY = 5;

    private final SimulatorEventBus eventBus;
    private final EdgePatchBuilder  patchBuilder;

    public PaymentExecutor(SimulatorEventBus eventBus, EdgePatchBuilder patchBuilder) {
        this.eventBus     = eventBus;
        this.patchBuilder = patchBuilder;
    }

    /**
     * @param senderLookup resolves a sender; completes empty when the participant is unknown
     */
    public Mono<ExecutionResult> execute(TickContext ctx, List<PaymentIntent> intents,
                                         Function<String, Mono<Participant>> senderLookup) {
        if (intents.isEmpty()) {
            return Mono.just(ExecutionResult.empty());
        }
        RunState          run      = ctx.run();
        SimulatorSettings settings = run.getSettings();
        int      maxInFlight    = Math.max(1, settings.maxInFlight());
        int      timeoutCeiling = settings.maxTimeoutsPerTick();
        Duration paymentTimeout = Duration.ofMillis(settings.paymentTimeoutMs());

        LedgerAccessToken              token        = new LedgerAccessToken();
        ExecutionAccumulator           accumulator  = new ExecutionAccumulator();
        OrderedEmitter<PaymentOutcome> emitter      = new OrderedEmitter<>(o -> emit(ctx, o, accumulator));
        AtomicInteger                  timeoutsSeen = new AtomicInteger();
        AtomicBoolean                  aborted      = new AtomicBoolean(false);

        return Flux.fromIterable(intents)
            .flatMap(intent -> attempt(ctx, intent, senderLookup, token, paymentTimeout), maxInFlight)
            .doOnNext(outcome -> {
                if (outcome.kind() == PaymentOutcome.Kind.TIMEOUT) {
                    timeoutsSeen.incrementAndGet();
                }
                emitter.offer(outcome.seq(), outcome);
            })
            .takeUntil(outcome -> {
                if (timeoutCeiling > 0 && timeoutsSeen.get() >= timeoutCeiling) {
                    aborted.set(true);
                    return true;
                }
                return false;
            })
            .doOnCancel(() -> {
                int flushed = emitter.flush();
                log.info("[Executor] Cancelled. runId={} tick={} flushed={}", ctx.runId(), ctx.tickIndex(), flushed);
            })
            .then(Mono.fromCallable(() -> {
                emitter.flush();
                ExecutionResult result = accumulator.build(aborted.get());
                if (result.aborted()) {
                    log.warn("[Executor] Aborted on timeout ceiling. runId={} tick={} timeouts={} ceiling={}",
                             ctx.runId(), ctx.tickIndex(), result.timeouts(), timeoutCeiling);
                }
                trackStall(run, result);
                return result;
            }));
    }

    // ── one intent ─────────────────────────────────────────────────────────────

    private Mono<PaymentOutcome> attempt(TickContext ctx, PaymentIntent intent,
                                         Function<String, Mono<Participant>> senderLookup,
                                         LedgerAccessToken token, Duration paymentTimeout) {
        return senderLookup.apply(intent.senderId())
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(sender -> sender.isPresent()
                ? callLedger(ctx, intent, token, paymentTimeout)
                : Mono.just(PaymentOutcome.error(intent, RejectionCodes.SENDER_NOT_FOUND,
                    "Sender not found: " + intent.senderId())))
            .onErrorResume(e -> Mono.just(classify(intent, e)));
    }

    private Mono<PaymentOutcome> callLedger(TickContext ctx, PaymentIntent intent,
                                            LedgerAccessToken token, Duration paymentTimeout) {
        LedgerSession  session = ctx.session();
        PaymentRequest request = new PaymentRequest(intent.senderId(), intent.receiverId(),
            intent.equivalent(), intent.amount(), idempotencyKey(ctx.runId(), ctx.tickIndex(), intent));

        return token.withToken(() -> {
            LedgerSession.Savepoint savepoint = session.savepoint();
            return session.attemptPayment(request)
                .timeout(paymentTimeout, Mono.error(() -> new LedgerTimeoutException(
                    "Payment timed out after " + paymentTimeout.toMillis() + "ms")))
                .map(receipt -> {
                    if (receipt.status() == PaymentReceipt.Status.COMMITTED) {
                        session.releaseSavepoint(savepoint);
                        return committed(ctx, intent, receipt);
                    }
                    session.rollbackTo(savepoint);
                    return PaymentOutcome.rejected(intent, RejectionCodes.fromDiagnostic(receipt.errorCode()),
                        receipt.message());
                })
                .doOnError(e -> session.rollbackTo(savepoint))
                .doOnCancel(() -> session.rollbackTo(savepoint));
        });
    }

    /** Patches are best-effort: a failure here never fails the committed payment. */
    private PaymentOutcome committed(TickContext ctx, PaymentIntent intent, PaymentReceipt receipt) {
        List<EdgePatch> edges = List.of();
        List<NodePatch> nodes = List.of();
        try {
            edges = patchBuilder.forRoute(ctx.session(), ctx.graph(), intent.equivalent(), receipt.route());
            nodes = patchBuilder.nodes(ctx.session(), ctx.graph(), intent.equivalent(), receipt.route());
        } catch (RuntimeException e) {
            if (ctx.run().shouldWarnThisTick("edge-patch")) {
                log.warn("[Executor] Edge patch failed. runId={} seq={} error={}",
                         ctx.runId(), intent.seq(), e.getMessage());
            }
        }
        return PaymentOutcome.committed(intent, receipt.route(), edges, nodes);
    }

    static PaymentOutcome classify(PaymentIntent intent, Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof LedgerTimeoutException || e instanceof TimeoutException) {
            return PaymentOutcome.timeout(intent, e.getMessage());
        }
        if (e instanceof LedgerRejectionException rejection && rejection.isClientError()) {
            return PaymentOutcome.rejected(intent, RejectionCodes.map(rejection), rejection.getMessage());
        }
        return PaymentOutcome.error(intent, RejectionCodes.INTERNAL_ERROR,
            e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    // ── emission (always in seq order) ─────────────────────────────────────────

    private void emit(TickContext ctx, PaymentOutcome outcome, ExecutionAccumulator accumulator) {
        RunState      run    = ctx.run();
        PaymentIntent intent = outcome.intent();
        accumulator.add(outcome);
        run.incrementAttempts();

        switch (outcome.kind()) {
            case COMMITTED -> {
                run.incrementCommitted();
                eventBus.publish(ctx.runId(), SimulatorEvent.TX_UPDATED, new TxUpdatedPayload(
                    intent.seq(), intent.equivalent(), intent.senderId(), intent.receiverId(),
                    intent.amount(), outcome.routeLength(), outcome.edges(), outcome.nodes()));
            }
            case REJECTED -> {
                run.incrementRejected();
                publishFailure(ctx, outcome);
            }
            case TIMEOUT -> {
                run.incrementTimeouts();
                run.recordError(outcome.code(), outcome.message());
                publishFailure(ctx, outcome);
            }
            case ERROR -> {
                run.recordError(outcome.code(), outcome.message());
                log.warn("[Executor] Payment error. runId={} seq={} code={} message={}",
                         ctx.runId(), intent.seq(), outcome.code(), outcome.message());
                publishFailure(ctx, outcome);
            }
        }
    }

    private void publishFailure(TickContext ctx, PaymentOutcome outcome) {
        PaymentIntent intent = outcome.intent();
        eventBus.publish(ctx.runId(), SimulatorEvent.TX_FAILED, new TxFailedPayload(
            intent.seq(), intent.equivalent(), intent.senderId(), intent.receiverId(),
            intent.amount(), outcome.code(), outcome.message()));
    }

    private void trackStall(RunState run, ExecutionResult result) {
        int stalled = run.recordTickOutcome(result.attempts(), result.committed(), result.errors());
        if (stalled > 0 && stalled % STALL_WARN_EVERY == 0) {
            log.warn("[Executor] All payments rejected. runId={} consecutiveTicks={} tick={}",
                     run.getRunId(), stalled, run.getTickIndex());
        }
    }

    // ── idempotency ────────────────────────────────────────────────────────────

    static String idempotencyKey(String runId, long tick, PaymentIntent intent) {
        String material = String.join("|", runId, Long.toString(tick), intent.senderId(), intent.receiverId(),
            intent.equivalent(), intent.amount().toPlainString(), Integer.toString(intent.seq()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return "sim:" + HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
