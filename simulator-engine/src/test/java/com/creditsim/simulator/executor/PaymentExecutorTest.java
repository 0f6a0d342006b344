package com.creditsim.simulator.executor;

import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TxFailedPayload;
import com.creditsim.common.event.TxUpdatedPayload;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.simulator.Fixtures;
import com.creditsim.simulator.StalledLedgerSession;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.event.EdgePatchBuilder;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.ledger.InMemoryLedger;
import com.creditsim.simulator.ledger.LedgerRejectionException;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.ledger.PaymentReceipt;
import com.creditsim.simulator.ledger.PaymentRequest;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.TickContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.creditsim.simulator.Fixtures.UAH;
import static org.junit.jupiter.api.Assertions.*;

class PaymentExecutorTest {

    private final SimulatorEventBus bus      = new SimulatorEventBus(Fixtures.CLOCK);
    private final PaymentExecutor   executor = new PaymentExecutor(bus, new EdgePatchBuilder());
    private final List<SimulatorEvent> events = new CopyOnWriteArrayList<>();
    private Disposable subscription;

    private static PaymentIntent intent(int seq, String from, String to, String amount) {
        return new PaymentIntent(seq, UAH, from, to, new BigDecimal(amount));
    }

    @BeforeEach
    void listen() {
        subscription = bus.stream("run-1").subscribe(events::add);
    }

    @AfterEach
    void stopListening() {
        subscription.dispose();
    }

    @Nested
    @DisplayName("against the in-memory ledger")
    class AgainstLedger {

        private RunState      run;
        private LedgerSession session;

        @BeforeEach
        void setUp() {
            InMemoryLedger ledger = new InMemoryLedger(new RoutingCache(), Duration.ofSeconds(1));
            LedgerSession seed = ledger.openSession();
            seed.seed(Fixtures.ring());
            seed.commit();
            run = Fixtures.run(Fixtures.ring(), SimulatorSettings.defaults().withMaxInFlight(4), 1L, 100);
            run.advanceClock(1000);
            session = ledger.openSession();
        }

        private Mono<ExecutionResult> execute(List<PaymentIntent> intents) {
            return executor.execute(new TickContext(run, session), intents,
                pid -> Mono.justOrEmpty(run.getGraph().participant(pid)));
        }

        @Test
        @DisplayName("classifies commit, rejection and unknown sender, in seq order")
        void mixedBatch() {
            List<PaymentIntent> intents = List.of(
                intent(0, "A", "B", "10.00"),
                intent(1, "A", "B", "5000.00"),
                intent(2, "GHOST", "B", "1.00"),
                intent(3, "B", "C", "3.00"));

            StepVerifier.create(execute(intents))
                .assertNext(result -> {
                    assertEquals(4, result.attempts());
                    assertEquals(2, result.committed());
                    assertEquals(1, result.rejected());
                    assertEquals(1, result.errors());
                    assertEquals(0, result.timeouts());
                    assertFalse(result.aborted());
                    assertEquals(1, result.noCapacityRejections(UAH));
                    assertEquals(4, result.equivalent(UAH).attempts());
                    assertEquals(1.0, result.equivalent(UAH).avgRouteLength(), 1e-9);
                })
                .verifyComplete();

            List<String> types = events.stream().map(SimulatorEvent::type).collect(Collectors.toList());
            assertEquals(List.of(SimulatorEvent.TX_UPDATED, SimulatorEvent.TX_FAILED,
                                 SimulatorEvent.TX_FAILED, SimulatorEvent.TX_UPDATED), types);
            assertEquals(RejectionCodes.ROUTING_NO_CAPACITY, ((TxFailedPayload) events.get(1).payload()).errorCode());
            assertEquals(RejectionCodes.SENDER_NOT_FOUND, ((TxFailedPayload) events.get(2).payload()).errorCode());

            TxUpdatedPayload first = (TxUpdatedPayload) events.get(0).payload();
            assertEquals(0, first.seq());
            assertEquals(1, first.routeLength());
            assertFalse(first.edges().isEmpty());

            assertEquals(4, run.getAttempts());
            assertEquals(2, run.getCommitted());
            assertEquals(1, run.getRejected());
            assertEquals(1, run.getErrors());
            assertEquals(RejectionCodes.SENDER_NOT_FOUND, run.getLastError().code());
        }

        @Test
        @DisplayName("event ids increase in seq order")
        void eventIdsFollowSeq() {
            List<PaymentIntent> intents = List.of(
                intent(0, "A", "B", "1.00"), intent(1, "B", "C", "1.00"),
                intent(2, "C", "A", "1.00"), intent(3, "D", "A", "1.00"));
            execute(intents).block();

            List<Integer> seqs = events.stream()
                .map(e -> ((TxUpdatedPayload) e.payload()).seq())
                .collect(Collectors.toList());
            assertEquals(List.of(0, 1, 2, 3), seqs);
            for (int i = 1; i < events.size(); i++) {
                assertTrue(events.get(i).eventId() > events.get(i - 1).eventId());
            }
        }

        @Test
        @DisplayName("a rejected payment leaves the session unchanged")
        void rejectionRollsBack() {
            execute(List.of(intent(0, "A", "B", "5000.00"))).block();
            assertEquals(0, BigDecimal.ZERO.compareTo(session.debt("A", "B", UAH)));
        }

        @Test
        @DisplayName("an empty plan does nothing")
        void emptyPlan() {
            StepVerifier.create(execute(List.of()))
                .assertNext(result -> assertEquals(0, result.attempts()))
                .verifyComplete();
            assertTrue(events.isEmpty());
        }
    }

    @Test
    @DisplayName("reaching the timeout ceiling aborts the rest of the batch")
    void timeoutCeiling() {
        SimulatorSettings settings = SimulatorSettings.defaults()
            .withPaymentTimeoutMs(50)
            .withFailureBudgets(2, 200, 3)
            .withMaxInFlight(1);
        RunState run = Fixtures.run(Fixtures.ring(), settings, 1L, 100);
        run.advanceClock(1000);
        StalledLedgerSession stalled = new StalledLedgerSession();

        List<PaymentIntent> intents = List.of(
            intent(0, "A", "B", "1.00"), intent(1, "A", "B", "1.00"), intent(2, "A", "B", "1.00"),
            intent(3, "A", "B", "1.00"), intent(4, "A", "B", "1.00"));

        StepVerifier.create(executor.execute(new TickContext(run, stalled), intents,
                pid -> Mono.justOrEmpty(run.getGraph().participant(pid))))
            .assertNext(result -> {
                assertTrue(result.aborted());
                assertEquals(2, result.timeouts());
                assertEquals(2, result.errors());
                assertEquals(2, result.attempts());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertTrue(stalled.payments.get() >= 2);
        assertTrue(stalled.rollbacksTo.get() >= 2);
        assertEquals(2, run.getTimeouts());
        assertEquals(2, run.getErrors());
        assertEquals(RejectionCodes.PAYMENT_TIMEOUT, run.getLastError().code());
    }

    @Test
    @DisplayName("outcomes completing out of order are still broadcast in seq order")
    void outOfOrderCompletions() {
        int batch = 12;
        RunState run = Fixtures.run(Fixtures.ring(), SimulatorSettings.defaults().withMaxInFlight(batch), 1L, 100);
        run.advanceClock(1000);
        Random jitter = new Random(7L);
        List<String> ledgerOrder = new CopyOnWriteArrayList<>();
        LedgerSession delayed = new StalledLedgerSession() {
            @Override
            public Mono<PaymentReceipt> attemptPayment(PaymentRequest request) {
                ledgerOrder.add(request.idempotencyKey());
                return Mono.delay(Duration.ofMillis(jitter.nextInt(8)))
                    .thenReturn(PaymentReceipt.committed("tx-" + ledgerOrder.size(),
                        List.of(request.senderId(), request.receiverId())));
            }
        };
        List<PaymentIntent> intents = IntStream.range(0, batch)
            .mapToObj(i -> intent(i, "A", "B", "1.00"))
            .collect(Collectors.toList());
        AtomicInteger lookups = new AtomicInteger();

        // lookups start in seq order, so later intents reach the ledger first
        StepVerifier.create(executor.execute(new TickContext(run, delayed), intents,
                pid -> Mono.delay(Duration.ofMillis(10L * (batch - lookups.getAndIncrement())))
                    .then(Mono.justOrEmpty(run.getGraph().participant(pid)))))
            .assertNext(result -> assertEquals(batch, result.committed()))
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        List<String> expectedLedgerOrder = new ArrayList<>();
        for (int i = batch - 1; i >= 0; i--) {
            expectedLedgerOrder.add(PaymentExecutor.idempotencyKey("run-1", run.getTickIndex(), intents.get(i)));
        }
        assertEquals(expectedLedgerOrder, ledgerOrder);

        List<Integer> seqs = events.stream()
            .filter(e -> SimulatorEvent.TX_UPDATED.equals(e.type()))
            .map(e -> ((TxUpdatedPayload) e.payload()).seq())
            .collect(Collectors.toList());
        assertEquals(IntStream.range(0, batch).boxed().collect(Collectors.toList()), seqs);
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).eventId() > events.get(i - 1).eventId());
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        private final PaymentIntent intent = intent(0, "A", "B", "1.00");

        @Test
        @DisplayName("timeouts")
        void timeouts() {
            assertEquals(PaymentOutcome.Kind.TIMEOUT, PaymentExecutor.classify(intent, new TimeoutException("slow")).kind());
        }

        @Test
        @DisplayName("client rejections keep their mapped code")
        void rejections() {
            PaymentOutcome o = PaymentExecutor.classify(intent, LedgerRejectionException.noRoute("none"));
            assertEquals(PaymentOutcome.Kind.REJECTED, o.kind());
            assertEquals(RejectionCodes.ROUTING_NO_ROUTE, o.code());

            PaymentOutcome nf = PaymentExecutor.classify(intent,
                LedgerRejectionException.notFound("Participant not found: X"));
            assertEquals(RejectionCodes.PARTICIPANT_NOT_FOUND, nf.code());
        }

        @Test
        @DisplayName("anything else is an internal error")
        void internal() {
            PaymentOutcome o = PaymentExecutor.classify(intent, new IllegalStateException("boom"));
            assertEquals(PaymentOutcome.Kind.ERROR, o.kind());
            assertEquals(RejectionCodes.INTERNAL_ERROR, o.code());
            assertTrue(o.isError());
        }
    }

    @Test
    @DisplayName("idempotency keys are stable per run, tick and intent")
    void idempotencyKey() {
        PaymentIntent i = intent(3, "A", "B", "12.34");
        String key = PaymentExecutor.idempotencyKey("run-1", 7, i);
        assertEquals(key, PaymentExecutor.idempotencyKey("run-1", 7, i));
        assertNotEquals(key, PaymentExecutor.idempotencyKey("run-1", 8, i));
        assertTrue(key.startsWith("sim:"));
        assertEquals(36, key.length());
    }
}
