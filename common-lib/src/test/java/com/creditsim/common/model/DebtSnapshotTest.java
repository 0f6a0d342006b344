package com.creditsim.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DebtSnapshotTest {

    private static Debt debt(String debtor, String creditor, String eq, String amount) {
        return new Debt(debtor, creditor, eq, new BigDecimal(amount));
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        private final DebtSnapshot snapshot = DebtSnapshot.of(List.of(
            debt("A", "B", "UAH", "10.00"),
            debt("A", "C", "UAH", "5.50"),
            debt("C", "B", "UAH", "2.00"),
            debt("A", "B", "EUR", "7.00")));

        @Test
        @DisplayName("edge amount is per (debtor, creditor, equivalent)")
        void edgeAmount() {
            assertEquals(0, new BigDecimal("10.00").compareTo(snapshot.amount("A", "B", "UAH")));
            assertEquals(0, new BigDecimal("7.00").compareTo(snapshot.amount("A", "B", "EUR")));
            assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.amount("B", "A", "UAH")));
        }

        @Test
        @DisplayName("outgoing and incoming totals per node and equivalent")
        void nodeTotals() {
            assertEquals(0, new BigDecimal("15.50").compareTo(snapshot.outgoingTotal("A", "UAH")));
            assertEquals(0, new BigDecimal("12.00").compareTo(snapshot.incomingTotal("B", "UAH")));
            assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.outgoingTotal("B", "UAH")));
        }

        @Test
        @DisplayName("total debt per equivalent")
        void totalDebt() {
            assertEquals(0, new BigDecimal("17.50").compareTo(snapshot.totalDebt("UAH")));
            assertEquals(0, new BigDecimal("7.00").compareTo(snapshot.totalDebt("EUR")));
            assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.totalDebt("USD")));
        }
    }

    @Test
    @DisplayName("zero and negative amounts are ignored")
    void nonPositiveIgnored() {
        DebtSnapshot snapshot = DebtSnapshot.of(List.of(
            debt("A", "B", "UAH", "0"),
            debt("B", "C", "UAH", "-3")));
        assertTrue(snapshot.isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(snapshot.totalDebt("UAH")));
        assertEquals(2, snapshot.debts().size());
    }

    @Test
    @DisplayName("empty() has no debts")
    void emptySnapshot() {
        assertTrue(DebtSnapshot.empty().isEmpty());
        assertTrue(DebtSnapshot.empty().debts().isEmpty());
    }
}
