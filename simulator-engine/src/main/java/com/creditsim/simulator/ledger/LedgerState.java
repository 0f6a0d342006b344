package com.creditsim.simulator.ledger;

import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.TrustLine;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of the ledger's network and balances. A committed instance is never
 * mutated; sessions work on a {@link #copy()}. Payment receipts are kept by
 * {@link InMemoryLedger} outside this state so that copies stay proportional to the network.
 */
final class LedgerState {

    final Map<String, Participant> participants = new LinkedHashMap<>();
    final Map<String, TrustLine>   trustLines   = new LinkedHashMap<>();
    final Map<String, Debt>        debts        = new LinkedHashMap<>();
    final Set<String>              seeded       = new HashSet<>();
    long                           txCounter;

    LedgerState copy() {
        LedgerState c = new LedgerState();
        c.participants.putAll(participants);
        c.trustLines.putAll(trustLines);
        c.debts.putAll(debts);
        c.seeded.addAll(seeded);
        c.txCounter = txCounter;
        return c;
    }

    BigDecimal debt(String debtor, String creditor, String equivalent) {
        Debt d = debts.get(debtKey(debtor, creditor, equivalent));
        return d != null ? d.amount() : BigDecimal.ZERO;
    }

    void putDebt(String debtor, String creditor, String equivalent, BigDecimal amount) {
        String key = debtKey(debtor, creditor, equivalent);
        if (amount.signum() <= 0) {
            debts.remove(key);
        } else {
            debts.put(key, new Debt(debtor, creditor, equivalent, amount));
        }
    }

    static String debtKey(String debtor, String creditor, String equivalent) {
        return debtor + "|" + creditor + "|" + equivalent;
    }
}
