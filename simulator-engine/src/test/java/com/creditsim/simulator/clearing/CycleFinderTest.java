package com.creditsim.simulator.clearing;

import com.creditsim.common.model.Debt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CycleFinderTest {

    private static Debt debt(String debtor, String creditor, String amount) {
        return new Debt(debtor, creditor, "UAH", new BigDecimal(amount));
    }

    private final List<Debt> debts = List.of(
        debt("A", "B", "50"), debt("B", "C", "40"), debt("C", "A", "30"),
        debt("A", "D", "5"), debt("D", "A", "7"),
        debt("C", "E", "9"),
        debt("E", "F", "0"), debt("F", "E", "3"),
        new Debt("A", "B", "EUR", new BigDecimal("1")), new Debt("B", "A", "EUR", new BigDecimal("1")));

    private static List<String> signatures(List<List<Debt>> cycles) {
        return cycles.stream().map(CycleFinder::signature).collect(Collectors.toList());
    }

    @Test
    @DisplayName("finds each cycle once, shortest first, rotated to its smallest id")
    void findsCycles() {
        List<List<Debt>> cycles = CycleFinder.find(debts, "UAH", 6);
        assertEquals(List.of("A>D", "A>B>C"), signatures(cycles));
        assertEquals("A", cycles.get(1).get(0).debtor());
        assertEquals("A", cycles.get(1).get(2).creditor());
    }

    @Test
    @DisplayName("depth bounds the cycle length")
    void depthBound() {
        assertEquals(List.of("A>D"), signatures(CycleFinder.find(debts, "UAH", 2)));
        assertTrue(CycleFinder.find(debts, "UAH", 1).isEmpty());
    }

    @Test
    @DisplayName("ignores other equivalents and zero debts")
    void filters() {
        assertEquals(List.of("A>B"), signatures(CycleFinder.find(debts, "EUR", 6)));
        assertTrue(CycleFinder.find(List.of(debt("E", "F", "0"), debt("F", "E", "3")), "UAH", 6).isEmpty());
    }

    @Test
    @DisplayName("a dense graph yields exactly the cycle cap, never one more")
    void capsCycleCount() {
        List<String> ids = List.of("A", "B", "C", "D", "E", "F", "G", "H");
        List<Debt> dense = new ArrayList<>();
        for (String from : ids) {
            for (String to : ids) {
                if (!from.equals(to)) dense.add(debt(from, to, "1"));
            }
        }

        List<List<Debt>> cycles = CycleFinder.find(dense, "UAH", 4);

        assertEquals(CycleFinder.MAX_CYCLES, cycles.size());
        assertEquals(cycles.size(), signatures(cycles).stream().distinct().count());
    }

    @Test
    @DisplayName("prioritize moves one seeded pick to the front and keeps the rest in order")
    void prioritize() {
        List<List<Debt>> cycles = CycleFinder.find(debts, "UAH", 6);
        List<List<Debt>> first  = CycleFinder.prioritize(cycles, 17L);
        List<List<Debt>> second = CycleFinder.prioritize(cycles, 17L);
        assertEquals(first, second);
        assertEquals(cycles.size(), first.size());
        assertTrue(first.containsAll(cycles));
    }
}
