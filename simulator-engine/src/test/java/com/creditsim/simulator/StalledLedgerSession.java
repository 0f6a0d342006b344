package com.creditsim.simulator;

import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.ledger.PaymentReceipt;
import com.creditsim.simulator.ledger.PaymentRequest;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Session whose payments never answer; counts calls, rollbacks and closes. */
public class StalledLedgerSession implements LedgerSession {

    public final AtomicInteger payments    = new AtomicInteger();
    public final AtomicInteger rollbacksTo = new AtomicInteger();
    public final AtomicInteger closes      = new AtomicInteger();

    @Override public List<Participant> participants()                    { return List.of(); }
    @Override public Optional<Participant> participant(String id)        { return Optional.empty(); }
    @Override public List<TrustLine> trustLines()                        { return List.of(); }
    @Override public Optional<TrustLine> trustLine(String c, String d, String eq) { return Optional.empty(); }
    @Override public List<Debt> debts()                                  { return List.of(); }
    @Override public BigDecimal debt(String debtor, String creditor, String eq) { return BigDecimal.ZERO; }
    @Override public boolean isSeeded(String scenarioId)                 { return true; }

    @Override public void seed(Scenario scenario) {}
    @Override public void upsertParticipant(Participant participant) {}
    @Override public void upsertTrustLine(TrustLine trustLine) {}
    @Override public void setDebt(String debtor, String creditor, String eq, BigDecimal amount) {}

    @Override
    public Mono<PaymentReceipt> attemptPayment(PaymentRequest request) {
        payments.incrementAndGet();
        return Mono.never();
    }

    @Override
    public Mono<Boolean> settleCycle(String equivalent, List<Debt> cycle, BigDecimal amount) {
        return Mono.just(false);
    }

    @Override public Savepoint savepoint()                     { return new Savepoint() {}; }
    @Override public void rollbackTo(Savepoint savepoint)      { rollbacksTo.incrementAndGet(); }
    @Override public void releaseSavepoint(Savepoint savepoint) {}
    @Override public void commit() {}
    @Override public void rollback() {}
    @Override public void close()    { closes.incrementAndGet(); }
}
