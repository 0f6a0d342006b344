package com.creditsim.common.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time aggregation of outstanding debt per (debtor, creditor, equivalent).
 *
 * <p>Built once per tick from the ledger and never carried into the next tick.
 * Per-debtor and per-creditor totals are pre-aggregated for constant-time lookups
 * during planning.
 */
public final class DebtSnapshot {

    private static final DebtSnapshot EMPTY = new DebtSnapshot(List.of());

    private final Map<String, BigDecimal> byEdge     = new HashMap<>();
    private final Map<String, BigDecimal> outgoing   = new HashMap<>();
    private final Map<String, BigDecimal> incoming   = new HashMap<>();
    private final Map<String, BigDecimal> totalByEq  = new HashMap<>();
    private final List<Debt>              debts;

    private DebtSnapshot(Collection<Debt> source) {
        this.debts = List.copyOf(source);
        for (Debt d : debts) {
            if (d.amount() == null || d.amount().signum() <= 0) continue;
            byEdge.merge(edgeKey(d.debtor(), d.creditor(), d.equivalent()), d.amount(), BigDecimal::add);
            outgoing.merge(nodeKey(d.debtor(), d.equivalent()), d.amount(), BigDecimal::add);
            incoming.merge(nodeKey(d.creditor(), d.equivalent()), d.amount(), BigDecimal::add);
            totalByEq.merge(d.equivalent(), d.amount(), BigDecimal::add);
        }
    }

    public static DebtSnapshot of(Collection<Debt> debts) {
        return new DebtSnapshot(debts);
    }

    public static DebtSnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return byEdge.isEmpty();
    }

    /** What {@code debtor} currently owes {@code creditor}. */
    public BigDecimal amount(String debtor, String creditor, String equivalent) {
        return byEdge.getOrDefault(edgeKey(debtor, creditor, equivalent), BigDecimal.ZERO);
    }

    public BigDecimal outgoingTotal(String debtor, String equivalent) {
        return outgoing.getOrDefault(nodeKey(debtor, equivalent), BigDecimal.ZERO);
    }

    public BigDecimal incomingTotal(String creditor, String equivalent) {
        return incoming.getOrDefault(nodeKey(creditor, equivalent), BigDecimal.ZERO);
    }

    public BigDecimal totalDebt(String equivalent) {
        return totalByEq.getOrDefault(equivalent, BigDecimal.ZERO);
    }

    public List<Debt> debts() {
        return Collections.unmodifiableList(debts);
    }

    private static String edgeKey(String debtor, String creditor, String equivalent) {
        return debtor + "|" + creditor + "|" + equivalent;
    }

    private static String nodeKey(String pid, String equivalent) {
        return pid + "|" + equivalent;
    }
}
