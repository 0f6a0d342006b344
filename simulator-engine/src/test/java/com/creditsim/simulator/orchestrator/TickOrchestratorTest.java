package com.creditsim.simulator.orchestrator;

import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.simulator.EngineHarness;
import com.creditsim.simulator.Fixtures;
import com.creditsim.simulator.StalledLedgerSession;
import com.creditsim.simulator.cache.RoutingCache;
import com.creditsim.simulator.clearing.ClearingJob;
import com.creditsim.simulator.config.SimulatorSettings;
import com.creditsim.simulator.executor.ExecutionResult;
import com.creditsim.simulator.ledger.InMemoryLedger;
import com.creditsim.simulator.ledger.LedgerService;
import com.creditsim.simulator.metrics.EquivalentMetrics;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.run.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.creditsim.simulator.Fixtures.UAH;
import static org.junit.jupiter.api.Assertions.*;

class TickOrchestratorTest {

    private final List<EngineHarness> harnesses = new CopyOnWriteArrayList<>();

    private EngineHarness harness(LedgerService ledger) {
        EngineHarness h = new EngineHarness(ledger);
        harnesses.add(h);
        return h;
    }

    private static InMemoryLedger newLedger() {
        return new InMemoryLedger(new RoutingCache(), Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        harnesses.forEach(EngineHarness::close);
    }

    @Nested
    @DisplayName("a healthy tick")
    class Healthy {

        @Test
        @DisplayName("seeds the ledger, executes the plan and records the tick")
        void firstTick() {
            InMemoryLedger ledger = newLedger();
            EngineHarness h = harness(ledger);
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);

            h.tick(run);

            assertTrue(run.isSeeded());
            assertTrue(ledger.openSession().isSeeded("ring"));
            assertNotNull(run.getLastTick());
            assertEquals(1, run.getLastTick().tickIndex());
            int planned = run.getLastTick().planned();
            assertTrue(planned > 0);
            assertEquals(planned, run.getLastTick().committed() + run.getLastTick().rejected()
                + run.getLastTick().errors());
            assertEquals(planned, run.getAttempts());
            assertTrue(run.getCommitted() > 0);
            assertEquals(run.getCommitted(), h.count(SimulatorEvent.TX_UPDATED));
            assertEquals(0, h.count(SimulatorEvent.AUDIT_DRIFT));
            assertEquals(RunStatus.RUNNING, run.getStatus());
            assertEquals(0, run.getConsecTickFailures());
        }

        @Test
        @DisplayName("writes metrics every tick and the status row once per artifact window")
        void writesArtifacts() {
            EngineHarness h = harness(newLedger());
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);

            h.tick(run);
            h.tick(run);

            assertTrue(h.metricsStore.metric("run-1", UAH, EquivalentMetrics.SUCCESS_RATE, 1000L).isPresent());
            assertTrue(h.metricsStore.metric("run-1", UAH, EquivalentMetrics.ACTIVE_TRUSTLINES, 2000L).isPresent());
            assertEquals(8.0, h.metricsStore.metric("run-1", UAH, EquivalentMetrics.ACTIVE_TRUSTLINES, 2000L).get());
            // Fixed clock: the first tick opens the window, the second falls inside it.
            assertEquals(1, h.metricsStore.runStatus("run-1").orElseThrow().tickIndex());
        }

        @Test
        @DisplayName("the same seed gives the same ledger")
        void deterministic() {
            InMemoryLedger first  = newLedger();
            InMemoryLedger second = newLedger();
            EngineHarness a = harness(first);
            EngineHarness b = harness(second);
            RunState runA = a.start(Fixtures.ring(), SimulatorSettings.defaults(), 99L);
            RunState runB = b.start(Fixtures.ring(), SimulatorSettings.defaults(), 99L);

            for (int i = 0; i < 3; i++) {
                a.tick(runA);
                b.tick(runB);
            }

            assertEquals(new HashSet<>(first.openSession().debts()), new HashSet<>(second.openSession().debts()));
            assertEquals(runA.getCommitted(), runB.getCommitted());
            assertEquals(runA.getRejected(), runB.getRejected());
        }

        @Test
        @DisplayName("a paused run is left untouched")
        void pausedRun() {
            InMemoryLedger ledger = newLedger();
            EngineHarness h = harness(ledger);
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);
            run.transitionTo(RunStatus.PAUSED, "pause");

            StepVerifier.create(h.orchestrator.tick("run-1")).verifyComplete();

            assertFalse(run.isSeeded());
            assertNull(run.getLastTick());
            assertFalse(ledger.openSession().isSeeded("ring"));
        }
    }

    @Nested
    @DisplayName("clearing cadence")
    class Cadence {

        @Test
        @DisplayName("static policy clears every equivalent on every n-th tick")
        void staticCadence() {
            EngineHarness h = harness(newLedger());
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);

            for (int i = 0; i < 24; i++) run.advanceClock(1000);
            assertTrue(h.orchestrator.clearingJobs(run, DebtSnapshot.empty(), ExecutionResult.empty()).isEmpty());

            run.advanceClock(1000);
            List<ClearingJob> jobs = h.orchestrator.clearingJobs(run, DebtSnapshot.empty(), ExecutionResult.empty());
            assertEquals(List.of(new ClearingJob(UAH, 6, 250)), jobs);
        }

        @Test
        @DisplayName("a zero cadence never clears")
        void disabled() {
            EngineHarness h = harness(newLedger());
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults().withClearing(0, "static"), 7L);
            run.advanceClock(1000);

            assertTrue(h.orchestrator.clearingJobs(run, DebtSnapshot.empty(), ExecutionResult.empty()).isEmpty());
        }
    }

    @Nested
    @DisplayName("failure ceilings")
    class Failures {

        @Test
        @DisplayName("a tick over the timeout budget ends the run in error")
        void tooManyTimeouts() {
            StalledLedgerSession stalled = new StalledLedgerSession();
            EngineHarness h = harness(() -> stalled);
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults()
                .withPaymentTimeoutMs(50)
                .withFailureBudgets(2, 200, 3)
                .withMaxInFlight(1), 7L);

            h.tick(run);

            assertEquals(RunStatus.ERROR, run.getStatus());
            assertEquals(TickOrchestrator.TOO_MANY_TIMEOUTS, run.getLastError().code());
            assertEquals(2, run.getTimeouts());
            assertTrue(h.count(SimulatorEvent.RUN_STATUS) >= 1);
        }

        @Test
        @DisplayName("repeated tick failures are rolled back and end the run")
        void repeatedFailures() {
            AtomicInteger rollbacks = new AtomicInteger();
            StalledLedgerSession broken = new StalledLedgerSession() {
                @Override
                public boolean isSeeded(String scenarioId) {
                    throw new IllegalStateException("ledger offline");
                }

                @Override
                public void rollback() {
                    rollbacks.incrementAndGet();
                }
            };
            EngineHarness h = harness(() -> broken);
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);

            h.tick(run);
            assertEquals(RunStatus.RUNNING, run.getStatus());
            assertEquals(TickOrchestrator.TICK_FAILED, run.getLastError().code());
            assertEquals(1, run.getConsecTickFailures());

            h.tick(run);
            h.tick(run);

            assertEquals(RunStatus.ERROR, run.getStatus());
            assertEquals(TickOrchestrator.TICK_FAILED_REPEATED, run.getLastError().code());
            assertEquals(3, rollbacks.get());
            assertNull(run.getLastTick());
        }

        @Test
        @DisplayName("failRun only fails a live run once")
        void failOnce() {
            EngineHarness h = harness(newLedger());
            RunState run = h.start(Fixtures.ring(), SimulatorSettings.defaults(), 7L);

            assertTrue(h.orchestrator.failRun(run, "X", "first"));
            assertFalse(h.orchestrator.failRun(run, "Y", "second"));
            assertEquals("X", run.getLastError().code());
        }
    }
}
