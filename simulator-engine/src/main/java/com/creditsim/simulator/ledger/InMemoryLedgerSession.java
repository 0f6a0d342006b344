package com.creditsim.simulator.ledger;

import com.creditsim.common.exception.SimulatorException;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.TrustLine;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

final class InMemoryLedgerSession implements LedgerSession {

    private final InMemoryLedger ledger;

    /**
     * Private copy of the committed state; non-null exactly while this session holds the
     * write lock. Whoever swaps it back to {@code null} releases the lock.
     */
    private final AtomicReference<LedgerState> working = new AtomicReference<>();
    private final AtomicBoolean                 closed  = new AtomicBoolean(false);

    /** Receipts of the open transaction, in commit order. Swapped, never cleared in place. */
    private volatile Map<String, PaymentReceipt> pendingReceipts = new LinkedHashMap<>();

    InMemoryLedgerSession(InMemoryLedger ledger) {
        this.ledger = ledger;
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    @Override
    public List<Participant> participants() {
        return new ArrayList<>(view().participants.values());
    }

    @Override
    public Optional<Participant> participant(String participantId) {
        return Optional.ofNullable(view().participants.get(participantId));
    }

    @Override
    public List<TrustLine> trustLines() {
        return new ArrayList<>(view().trustLines.values());
    }

    @Override
    public Optional<TrustLine> trustLine(String creditor, String debtor, String equivalent) {
        return Optional.ofNullable(view().trustLines.get(TrustLine.key(creditor, debtor, equivalent)));
    }

    @Override
    public List<Debt> debts() {
        return new ArrayList<>(view().debts.values());
    }

    @Override
    public BigDecimal debt(String debtor, String creditor, String equivalent) {
        return view().debt(debtor, creditor, equivalent);
    }

    @Override
    public boolean isSeeded(String scenarioId) {
        return view().seeded.contains(scenarioId);
    }

    // ── writes ────────────────────────────────────────────────────────────────

    @Override
    public void seed(Scenario scenario) {
        if (isSeeded(scenario.scenarioId())) return;
        LedgerState s = writable();
        for (Participant p : scenario.participants()) {
            s.participants.putIfAbsent(p.id(), p);
        }
        for (TrustLine tl : scenario.trustlines()) {
            s.trustLines.putIfAbsent(tl.key(), tl);
            ledger.routingCache().invalidate(tl.equivalent());
        }
        s.seeded.add(scenario.scenarioId());
    }

    @Override
    public void upsertParticipant(Participant participant) {
        writable().participants.put(participant.id(), participant);
    }

    @Override
    public void upsertTrustLine(TrustLine trustLine) {
        writable().trustLines.put(trustLine.key(), trustLine);
        ledger.routingCache().invalidate(trustLine.equivalent());
    }

    @Override
    public void setDebt(String debtor, String creditor, String equivalent, BigDecimal amount) {
        writable().putDebt(debtor, creditor, equivalent, amount);
    }

    @Override
    public Mono<PaymentReceipt> attemptPayment(PaymentRequest request) {
        return Mono.fromCallable(() -> pay(request));
    }

    @Override
    public Mono<Boolean> settleCycle(String equivalent, List<Debt> cycle, BigDecimal amount) {
        return Mono.fromCallable(() -> settle(equivalent, cycle, amount));
    }

    // ── transaction control ──────────────────────────────────────────────────

    @Override
    public Savepoint savepoint() {
        return new StateSavepoint(writable().copy(), pendingReceipts.size());
    }

    @Override
    public void rollbackTo(Savepoint savepoint) {
        StateSavepoint sp = (StateSavepoint) savepoint;
        LedgerState current = working.get();
        if (current == null || !working.compareAndSet(current, sp.state.copy())) {
            return;
        }
        Iterator<String> keys = pendingReceipts.keySet().iterator();
        for (int i = 0; keys.hasNext(); i++) {
            keys.next();
            if (i >= sp.receiptCount) keys.remove();
        }
        ledger.routingCache().invalidateAll();
    }

    @Override
    public void releaseSavepoint(Savepoint savepoint) {
        // nothing to free: savepoints are plain copies
    }

    @Override
    public void commit() {
        LedgerState s = working.getAndSet(null);
        if (s == null) return;
        Map<String, PaymentReceipt> receipts = pendingReceipts;
        pendingReceipts = new LinkedHashMap<>();
        ledger.publish(s);
        ledger.recordReceipts(receipts);
        ledger.releaseWriteLock();
    }

    @Override
    public void rollback() {
        if (working.getAndSet(null) == null) return;
        pendingReceipts = new LinkedHashMap<>();
        ledger.routingCache().invalidateAll();
        ledger.releaseWriteLock();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            rollback();
        }
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private LedgerState view() {
        LedgerState s = working.get();
        return s != null ? s : ledger.committed();
    }

    private LedgerState writable() {
        LedgerState s = working.get();
        if (s != null) {
            return s;
        }
        ensureOpen();
        ledger.acquireWriteLock();
        LedgerState copy = ledger.committed().copy();
        working.set(copy);
        if (closed.get()) {
            // closed while the lock was being taken: give it back unless close already did
            if (working.compareAndSet(copy, null)) {
                ledger.releaseWriteLock();
            }
            ensureOpen();
        }
        return copy;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new SimulatorException("LEDGER_SESSION_CLOSED", "Ledger session is closed");
        }
    }

    private PaymentReceipt pay(PaymentRequest req) {
        if (req.amount() == null || req.amount().signum() <= 0) {
            throw LedgerRejectionException.badRequest("Amount must be positive");
        }
        LedgerState s = writable();
        PaymentReceipt previous = pendingReceipts.get(req.idempotencyKey());
        if (previous == null) {
            previous = ledger.receipt(req.idempotencyKey());
        }
        if (previous != null) {
            return previous;
        }

        Participant sender = s.participants.get(req.senderId());
        if (sender == null) {
            throw LedgerRejectionException.notFound("Participant not found: " + req.senderId());
        }
        if (!s.participants.containsKey(req.receiverId())) {
            throw LedgerRejectionException.notFound("Participant not found: " + req.receiverId());
        }
        if (!sender.isActive()) {
            throw new LedgerRejectionException(LedgerRejectionException.Kind.FORBIDDEN, "FORBIDDEN",
                "Sender is not active: " + req.senderId(), 403);
        }
        boolean knownEquivalent = s.trustLines.values().stream()
            .anyMatch(tl -> req.equivalent().equals(tl.equivalent()));
        if (!knownEquivalent) {
            throw LedgerRejectionException.notFound("Equivalent not found: " + req.equivalent());
        }

        List<String> path = ledger.router().route(s, req.senderId(), req.receiverId(), req.equivalent(), req.amount());
        PaymentRouter.apply(s, path, req.equivalent(), req.amount());

        s.txCounter++;
        PaymentReceipt receipt = PaymentReceipt.committed("tx-" + s.txCounter, path);
        pendingReceipts.put(req.idempotencyKey(), receipt);
        return receipt;
    }

    private boolean settle(String equivalent, List<Debt> cycle, BigDecimal amount) {
        if (cycle.isEmpty() || amount.signum() <= 0) return false;
        LedgerState s = writable();
        for (Debt edge : cycle) {
            if (s.debt(edge.debtor(), edge.creditor(), equivalent).compareTo(amount) < 0) {
                return false;
            }
        }
        for (Debt edge : cycle) {
            BigDecimal current = s.debt(edge.debtor(), edge.creditor(), equivalent);
            s.putDebt(edge.debtor(), edge.creditor(), equivalent, current.subtract(amount));
        }
        return true;
    }

    private record StateSavepoint(LedgerState state, int receiptCount) implements Savepoint {}
}
