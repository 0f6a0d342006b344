package com.creditsim.simulator.ledger;

import com.creditsim.common.exception.SimulatorException;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Scenario;
import com.creditsim.simulator.cache.RoutingCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.creditsim.simulator.Fixtures.UAH;
import static com.creditsim.simulator.Fixtures.line;
import static com.creditsim.simulator.Fixtures.person;
import static com.creditsim.simulator.Fixtures.ring;
import static com.creditsim.simulator.Fixtures.scenario;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryLedgerTest {

    private InMemoryLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger(new RoutingCache(), Duration.ofMillis(100));
    }

    private void seed(Scenario scenario) {
        LedgerSession s = ledger.openSession();
        s.seed(scenario);
        s.commit();
    }

    private static PaymentRequest pay(String from, String to, String amount, String key) {
        return new PaymentRequest(from, to, UAH, new BigDecimal(amount), key);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @BeforeEach
        void seedRing() {
            seed(ring());
        }

        @Test
        @DisplayName("direct payment creates debt of sender to receiver")
        void directPayment() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.attemptPayment(pay("A", "B", "100.00", "k1")))
                .assertNext(r -> {
                    assertEquals(PaymentReceipt.Status.COMMITTED, r.status());
                    assertEquals(List.of("A", "B"), r.route());
                    assertEquals(1, r.routeLength());
                })
                .verifyComplete();
            assertAmount("100.00", s.debt("A", "B", UAH));
        }

        @Test
        @DisplayName("paying back reduces the reverse debt before creating new debt")
        void reverseDebtFirst() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "100.00", "k1")).block();
            s.attemptPayment(pay("B", "A", "30.00", "k2")).block();
            assertAmount("70.00", s.debt("A", "B", UAH));
            assertAmount("0", s.debt("B", "A", UAH));
        }

        @Test
        @DisplayName("amount above every path capacity is rejected with E002")
        void noCapacity() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.attemptPayment(pay("A", "B", "5000.00", "k1")))
                .expectErrorSatisfies(e -> {
                    LedgerRejectionException rej = assertInstanceOf(LedgerRejectionException.class, e);
                    assertEquals("E002", rej.getCode());
                    assertEquals(LedgerRejectionException.Kind.ROUTING, rej.getKind());
                    assertTrue(rej.isClientError());
                })
                .verify();
        }

        @Test
        @DisplayName("unknown participant is NOT_FOUND")
        void unknownParticipant() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.attemptPayment(pay("A", "ZED", "1.00", "k1")))
                .expectErrorSatisfies(e -> {
                    LedgerRejectionException rej = assertInstanceOf(LedgerRejectionException.class, e);
                    assertEquals(404, rej.getStatusCode());
                    assertEquals(LedgerRejectionException.Kind.NOT_FOUND, rej.getKind());
                })
                .verify();
        }

        @Test
        @DisplayName("non-positive amount is BAD_REQUEST")
        void nonPositiveAmount() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.attemptPayment(pay("A", "B", "0", "k1")))
                .expectErrorSatisfies(e -> assertEquals("BAD_REQUEST", ((SimulatorException) e).getCode()))
                .verify();
        }

        @Test
        @DisplayName("a repeated idempotency key returns the first receipt without paying twice")
        void idempotent() {
            LedgerSession s = ledger.openSession();
            PaymentReceipt first  = s.attemptPayment(pay("A", "B", "10.00", "same")).block();
            PaymentReceipt second = s.attemptPayment(pay("A", "B", "10.00", "same")).block();
            assertNotNull(first);
            assertEquals(first, second);
            assertAmount("10.00", s.debt("A", "B", UAH));
        }
    }

    @Test
    @DisplayName("payment to a participant without trust lines is rejected with E001")
    void noRoute() {
        seed(scenario("island",
            List.of(person("A"), person("B"), person("E")),
            List.of(line("B", "A", "100"))));
        LedgerSession s = ledger.openSession();
        StepVerifier.create(s.attemptPayment(pay("A", "E", "1.00", "k1")))
            .expectErrorSatisfies(e -> assertEquals("E001", ((LedgerRejectionException) e).getCode()))
            .verify();
    }

    @Test
    @DisplayName("multi-hop payment moves debt along every hop")
    void multiHop() {
        seed(scenario("chain",
            List.of(person("A"), person("B"), person("C")),
            List.of(line("B", "A", "100"), line("C", "B", "100"))));
        LedgerSession s = ledger.openSession();
        PaymentReceipt r = s.attemptPayment(pay("A", "C", "40.00", "k1")).block();
        assertNotNull(r);
        assertEquals(List.of("A", "B", "C"), r.route());
        assertAmount("40.00", s.debt("A", "B", UAH));
        assertAmount("40.00", s.debt("B", "C", UAH));
    }

    @Nested
    @DisplayName("transactions")
    class Transactions {

        @BeforeEach
        void seedRing() {
            seed(ring());
        }

        @Test
        @DisplayName("commit publishes to later sessions")
        void commitPublishes() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "25.00", "k1")).block();
            s.commit();
            assertAmount("25.00", ledger.openSession().debt("A", "B", UAH));
        }

        @Test
        @DisplayName("rollback discards uncommitted writes and frees the lock")
        void rollbackDiscards() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "25.00", "k1")).block();
            s.rollback();

            LedgerSession next = ledger.openSession();
            assertAmount("0", next.debt("A", "B", UAH));
            next.setDebt("A", "B", UAH, new BigDecimal("1.00"));
            next.commit();
        }

        @Test
        @DisplayName("rollbackTo a savepoint undoes only the nested writes")
        void savepoint() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "10.00", "k1")).block();
            LedgerSession.Savepoint sp = s.savepoint();
            s.attemptPayment(pay("A", "C", "20.00", "k2")).block();
            s.rollbackTo(sp);
            assertAmount("10.00", s.debt("A", "B", UAH));
            assertAmount("0", s.debt("A", "C", UAH));
        }

        @Test
        @DisplayName("a second writer times out while the first holds the lock")
        void lockTimeout() {
            LedgerSession first = ledger.openSession();
            first.setDebt("A", "B", UAH, new BigDecimal("1.00"));

            LedgerSession second = ledger.openSession();
            SimulatorException e = assertThrows(SimulatorException.class,
                () -> second.setDebt("B", "C", UAH, new BigDecimal("1.00")));
            assertEquals("LEDGER_LOCK_TIMEOUT", e.getCode());

            first.commit();
            second.setDebt("B", "C", UAH, new BigDecimal("1.00"));
            second.commit();
        }

        @Test
        @DisplayName("reads never take the lock")
        void readsAreFree() {
            LedgerSession writer = ledger.openSession();
            writer.setDebt("A", "B", UAH, new BigDecimal("5.00"));

            LedgerSession reader = ledger.openSession();
            assertEquals(4, reader.participants().size());
            assertAmount("0", reader.debt("A", "B", UAH));
            writer.rollback();
        }

        @Test
        @DisplayName("committed receipts answer a repeated key from a later session")
        void receiptsOutliveTheSession() {
            LedgerSession s = ledger.openSession();
            PaymentReceipt first = s.attemptPayment(pay("A", "B", "10.00", "once")).block();
            s.commit();

            LedgerSession next = ledger.openSession();
            assertEquals(first, next.attemptPayment(pay("A", "B", "10.00", "once")).block());
            assertAmount("10.00", next.debt("A", "B", UAH));
            next.rollback();
            assertEquals(1, ledger.receiptCount());
        }

        @Test
        @DisplayName("rolling back to a savepoint forgets the nested receipt only")
        void savepointForgetsReceipt() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "10.00", "k1")).block();
            LedgerSession.Savepoint sp = s.savepoint();
            s.attemptPayment(pay("A", "C", "20.00", "k2")).block();
            s.rollbackTo(sp);

            s.attemptPayment(pay("A", "C", "20.00", "k2")).block();
            s.attemptPayment(pay("A", "B", "10.00", "k1")).block();
            assertAmount("20.00", s.debt("A", "C", UAH));
            assertAmount("10.00", s.debt("A", "B", UAH));
            s.commit();
            assertEquals(2, ledger.receiptCount());
        }

        @Test
        @DisplayName("receipts of a rolled back session are not kept")
        void rollbackDropsReceipts() {
            LedgerSession s = ledger.openSession();
            s.attemptPayment(pay("A", "B", "10.00", "k1")).block();
            s.rollback();
            assertEquals(0, ledger.receiptCount());
        }

        @Test
        @DisplayName("close frees the lock once and refuses later writes")
        void closeIsIdempotent() {
            LedgerSession s = ledger.openSession();
            s.setDebt("A", "B", UAH, new BigDecimal("1.00"));
            s.close();

            LedgerSession holder = ledger.openSession();
            holder.setDebt("B", "C", UAH, new BigDecimal("1.00"));

            s.close();
            s.rollback();
            s.commit();
            SimulatorException closed = assertThrows(SimulatorException.class,
                () -> s.setDebt("A", "B", UAH, new BigDecimal("2.00")));
            assertEquals("LEDGER_SESSION_CLOSED", closed.getCode());

            LedgerSession third = ledger.openSession();
            SimulatorException busy = assertThrows(SimulatorException.class,
                () -> third.setDebt("C", "D", UAH, new BigDecimal("1.00")));
            assertEquals("LEDGER_LOCK_TIMEOUT", busy.getCode());
            holder.commit();
            assertAmount("0", ledger.openSession().debt("A", "B", UAH));
        }

        @Test
        @DisplayName("seeding the same scenario twice is a no-op")
        void seedIdempotent() {
            LedgerSession s = ledger.openSession();
            assertTrue(s.isSeeded("ring"));
            s.seed(ring());
            assertEquals(8, s.trustLines().size());
            s.commit();
        }
    }

    @Nested
    @DisplayName("settleCycle")
    class SettleCycle {

        private final List<Debt> cycle = List.of(
            new Debt("A", "B", UAH, BigDecimal.ZERO),
            new Debt("B", "C", UAH, BigDecimal.ZERO),
            new Debt("C", "A", UAH, BigDecimal.ZERO));

        @BeforeEach
        void seedCycle() {
            seed(ring());
            LedgerSession s = ledger.openSession();
            s.setDebt("A", "B", UAH, new BigDecimal("50.00"));
            s.setDebt("B", "C", UAH, new BigDecimal("50.00"));
            s.setDebt("C", "A", UAH, new BigDecimal("60.00"));
            s.commit();
        }

        @Test
        @DisplayName("reduces every edge by the amount")
        void settles() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.settleCycle(UAH, cycle, new BigDecimal("50.00")))
                .expectNext(true)
                .verifyComplete();
            assertAmount("0", s.debt("A", "B", UAH));
            assertAmount("0", s.debt("B", "C", UAH));
            assertAmount("10.00", s.debt("C", "A", UAH));
            assertTrue(s.debts().stream().noneMatch(d -> d.debtor().equals("A")));
        }

        @Test
        @DisplayName("refuses an amount larger than the smallest edge and changes nothing")
        void refusesOversettle() {
            LedgerSession s = ledger.openSession();
            StepVerifier.create(s.settleCycle(UAH, cycle, new BigDecimal("55.00")))
                .expectNext(false)
                .verifyComplete();
            assertAmount("50.00", s.debt("A", "B", UAH));
            s.rollback();
        }
    }
}
