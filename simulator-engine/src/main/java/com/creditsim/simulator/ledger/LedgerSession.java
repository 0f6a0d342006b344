package com.creditsim.simulator.ledger;

import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.TrustLine;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Transactional unit of work against the ledger.
 *
 * <p>Not safe for concurrent use: callers that fan out must serialize calls on
 * the same session.
 */
public interface LedgerSession {

    // ── reads ─────────────────────────────────────────────────────────────────

    List<Participant> participants();

    Optional<Participant> participant(String participantId);

    List<TrustLine> trustLines();

    Optional<TrustLine> trustLine(String creditor, String debtor, String equivalent);

    List<Debt> debts();

    BigDecimal debt(String debtor, String creditor, String equivalent);

    boolean isSeeded(String scenarioId);

    // ── writes ────────────────────────────────────────────────────────────────

    /** Creates participants, equivalents and trust lines of {@code scenario}. Idempotent. */
    void seed(Scenario scenario);

    void upsertParticipant(Participant participant);

    void upsertTrustLine(TrustLine trustLine);

    void setDebt(String debtor, String creditor, String equivalent, BigDecimal amount);

    /**
     * Routes and applies one payment. Emits a committed receipt, or fails with
     * {@link LedgerRejectionException} / {@link LedgerTimeoutException}.
     */
    Mono<PaymentReceipt> attemptPayment(PaymentRequest request);

    /**
     * Reduces every debt of {@code cycle} by {@code amount} atomically.
     * Emits {@code false} when any debt in the cycle is smaller than {@code amount}.
     */
    Mono<Boolean> settleCycle(String equivalent, List<Debt> cycle, BigDecimal amount);

    // ── transaction control ──────────────────────────────────────────────────

    Savepoint savepoint();

    void rollbackTo(Savepoint savepoint);

    void releaseSavepoint(Savepoint savepoint);

    void commit();

    void rollback();

    /**
     * Rolls back pending work and refuses any later write. Safe to call from another
     * thread than the one using the session, and more than once.
     */
    default void close() {
        rollback();
    }

    /** Marker for a nested sub-transaction. */
    interface Savepoint {}
}
