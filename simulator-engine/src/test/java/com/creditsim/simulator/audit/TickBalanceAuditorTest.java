package com.creditsim.simulator.audit;

import com.creditsim.common.event.AuditDriftPayload;
import com.creditsim.common.event.ParticipantDrift;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.simulator.Fixtures;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.executor.PaymentOutcome;
import com.creditsim.simulator.run.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.creditsim.simulator.Fixtures.UAH;
import static org.junit.jupiter.api.Assertions.*;

class TickBalanceAuditorTest {

    private static Debt debt(String debtor, String creditor, String amount) {
        return new Debt(debtor, creditor, UAH, new BigDecimal(amount));
    }

    private static PaymentOutcome paid(int seq, String from, String to, String amount, String... route) {
        return PaymentOutcome.committed(new PaymentIntent(seq, UAH, from, to, new BigDecimal(amount)),
            List.of(route), null, null);
    }

    private static PaymentOutcome rejected(int seq, String from, String to, String amount) {
        return PaymentOutcome.rejected(new PaymentIntent(seq, UAH, from, to, new BigDecimal(amount)),
            "ROUTING_NO_CAPACITY", "no capacity");
    }

    @Test
    @DisplayName("a multi-hop payment only moves the end points' net positions")
    void multiHopBalanced() {
        List<Debt> before = List.of(debt("B", "A", "10.00"));
        List<Debt> after  = List.of(debt("B", "A", "10.00"), debt("A", "B", "40.00"), debt("B", "C", "40.00"));

        AuditResult audit = TickBalanceAuditor.audit(UAH, 3, before, after,
            List.of(paid(0, "A", "C", "40.00", "A", "B", "C"), rejected(1, "C", "A", "99.00")), BigDecimal.ZERO);

        assertTrue(audit.ok());
        assertEquals(0, new BigDecimal("40.00").compareTo(audit.tickVolume()));
    }

    @Test
    @DisplayName("clearing a cycle keeps every net position")
    void clearingBalanced() {
        List<Debt> before = List.of(debt("A", "B", "50.00"), debt("B", "C", "50.00"), debt("C", "A", "50.00"));

        AuditResult audit = TickBalanceAuditor.audit(UAH, 25, before, List.of(), List.of(), new BigDecimal("50.00"));

        assertTrue(audit.ok());
    }

    @Test
    @DisplayName("debt that moved without a committed payment is reported per participant")
    void detectsDrift() {
        List<Debt> before = List.of();
        List<Debt> after  = List.of(debt("A", "B", "10.00"), debt("C", "D", "5.00"));

        AuditResult audit = TickBalanceAuditor.audit(UAH, 4, before, after,
            List.of(paid(0, "A", "B", "10.00", "A", "B")), BigDecimal.ZERO);

        assertFalse(audit.ok());
        assertEquals(List.of(
            new ParticipantDrift("C", BigDecimal.ZERO, new BigDecimal("-5.00"), new BigDecimal("-5.00")),
            new ParticipantDrift("D", BigDecimal.ZERO, new BigDecimal("5.00"), new BigDecimal("5.00"))),
            audit.drifts());
        assertEquals(0, new BigDecimal("5.00").compareTo(audit.totalDrift()));
        assertEquals(0, audit.netImbalance().signum());
        assertEquals(AuditResult.SEVERITY_CRITICAL, audit.severity());
    }

    @Test
    @DisplayName("a drift under 1% of the tick volume is only a warning")
    void smallDriftWarns() {
        AuditResult audit = new AuditResult(UAH, 1, List.of(
            new ParticipantDrift("A", BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ONE)),
            new BigDecimal("0.50"), new BigDecimal("1000.00"), BigDecimal.ZERO);
        assertEquals(AuditResult.SEVERITY_WARNING, audit.severity());
    }

    @Test
    @DisplayName("a drifting equivalent is published as audit.drift")
    void publishes() {
        SimulatorEventBus bus = new SimulatorEventBus(Fixtures.CLOCK);
        RunState run = Fixtures.run(Fixtures.ring());
        run.advanceClock(1000);
        List<SimulatorEvent> events = new CopyOnWriteArrayList<>();
        Disposable sub = bus.stream(run.getRunId()).subscribe(events::add);

        List<AuditResult> drifting = new TickBalanceAuditor(bus).auditTick(run, DebtSnapshot.empty(),
            List.of(debt("A", "B", "7.00")), List.of(), Map.of());
        sub.dispose();

        assertEquals(1, drifting.size());
        assertEquals(1, events.size());
        assertEquals(SimulatorEvent.AUDIT_DRIFT, events.get(0).type());
        AuditDriftPayload payload = (AuditDriftPayload) events.get(0).payload();
        assertEquals(UAH, payload.equivalent());
        assertEquals(1, payload.tickIndex());
        assertEquals(TickBalanceAuditor.SOURCE, payload.source());
        assertEquals(2, payload.drifts().size());
    }
}
