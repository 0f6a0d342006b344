package com.creditsim.simulator.audit;

import com.creditsim.common.event.AuditDriftPayload;
import com.creditsim.common.event.ParticipantDrift;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.DebtSnapshot;
import com.creditsim.common.model.PaymentIntent;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.executor.PaymentOutcome;
import com.creditsim.simulator.run.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Best-effort integrity check run at the end of every tick.
 *
 * <p>Each committed payment moves the sender's net position (incoming minus outgoing
 * debt) down by its amount and the receiver's up by the same amount, whatever the route.
 * Clearing and trust drift leave net positions untouched. A participant whose observed
 * change differs from the expected one, or net positions that no longer sum to zero,
 * are reported as {@code audit.drift}.
 */
@Component
public class TickBalanceAuditor {

    private static final Logger log = LoggerFactory.getLogger(TickBalanceAuditor.class);

    public static final String SOURCE = "post_tick_audit";

    private final SimulatorEventBus eventBus;

    public TickBalanceAuditor(SimulatorEventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Audits every equivalent of {@code run} and publishes one event per drifting equivalent.
     *
     * @param before   debts at the start of payment execution
     * @param after    debts once the tick's payments, clearing and decay are in
     * @param outcomes outcomes of the tick's payments
     * @param cleared  cleared volume per equivalent
     * @return the audits that found a drift
     */
    public List<AuditResult> auditTick(RunState run, DebtSnapshot before, Collection<Debt> after,
                                       List<PaymentOutcome> outcomes, Map<String, BigDecimal> cleared) {
        List<AuditResult> drifting = new ArrayList<>();
        for (String eq : run.getGraph().equivalents()) {
            AuditResult audit = audit(eq, run.getTickIndex(), before.debts(), after, outcomes,
                cleared.getOrDefault(eq, BigDecimal.ZERO));
            if (audit.ok()) continue;

            drifting.add(audit);
            log.warn("AUDIT_DRIFT runId={} tick={} eq={} totalDrift={} netImbalance={} severity={} participants={}",
                     run.getRunId(), audit.tickIndex(), eq, audit.totalDrift(), audit.netImbalance(),
                     audit.severity(), audit.drifts().size());
            eventBus.publish(run.getRunId(), SimulatorEvent.AUDIT_DRIFT, new AuditDriftPayload(
                eq, audit.tickIndex(), audit.severity(), audit.totalDrift(), audit.drifts(), SOURCE));
        }
        return drifting;
    }

    static AuditResult audit(String equivalent, long tickIndex, Collection<Debt> before, Collection<Debt> after,
                             List<PaymentOutcome> outcomes, BigDecimal clearedVolume) {
        Map<String, BigDecimal> expected = new TreeMap<>();
        BigDecimal volume = BigDecimal.ZERO;
        for (PaymentOutcome outcome : outcomes) {
            PaymentIntent intent = outcome.intent();
            if (outcome.kind() != PaymentOutcome.Kind.COMMITTED || !equivalent.equals(intent.equivalent())) continue;
            expected.merge(intent.senderId(), intent.amount().negate(), BigDecimal::add);
            expected.merge(intent.receiverId(), intent.amount(), BigDecimal::add);
            volume = volume.add(intent.amount().abs());
        }
        if (clearedVolume != null) {
            volume = volume.add(clearedVolume.abs());
        }

        Map<String, BigDecimal> netBefore = netPositions(before, equivalent);
        Map<String, BigDecimal> netAfter  = netPositions(after, equivalent);
        BigDecimal imbalance = netAfter.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        TreeSet<String> participants = new TreeSet<>(expected.keySet());
        participants.addAll(netBefore.keySet());
        participants.addAll(netAfter.keySet());

        List<ParticipantDrift> drifts = new ArrayList<>();
        BigDecimal driftSum = BigDecimal.ZERO;
        for (String pid : participants) {
            BigDecimal want   = expected.getOrDefault(pid, BigDecimal.ZERO);
            BigDecimal actual = netAfter.getOrDefault(pid, BigDecimal.ZERO)
                .subtract(netBefore.getOrDefault(pid, BigDecimal.ZERO));
            BigDecimal drift  = actual.subtract(want);
            if (drift.signum() != 0) {
                drifts.add(new ParticipantDrift(pid, want, actual, drift));
                driftSum = driftSum.add(drift.abs());
            }
        }
        return new AuditResult(equivalent, tickIndex, drifts, driftSum.divide(BigDecimal.valueOf(2)), volume, imbalance);
    }

    /** Incoming minus outgoing debt per participant. */
    static Map<String, BigDecimal> netPositions(Collection<Debt> debts, String equivalent) {
        Map<String, BigDecimal> net = new TreeMap<>();
        for (Debt d : debts) {
            if (!equivalent.equals(d.equivalent()) || d.amount() == null || d.amount().signum() == 0) continue;
            net.merge(d.creditor(), d.amount(), BigDecimal::add);
            net.merge(d.debtor(), d.amount().negate(), BigDecimal::add);
        }
        return net;
    }
}
