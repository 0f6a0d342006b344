package com.creditsim.simulator.metrics;

import com.creditsim.simulator.executor.ExecutionResult.EdgeStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BottleneckAnalyzerTest {

    private static EdgeStats edge(String from, String to, int attempts, int committed,
                                  int rejected, int errors, int timeouts) {
        return new EdgeStats("UAH", from, to, attempts, committed, rejected, errors, timeouts);
    }

    @Test
    @DisplayName("ranks by failure share, highest first")
    void ranksByScore() {
        List<EdgeBottleneck> items = BottleneckAnalyzer.analyze("UAH", List.of(
            edge("A", "B", 4, 3, 1, 0, 0),
            edge("B", "C", 2, 0, 2, 0, 0),
            edge("C", "D", 4, 2, 2, 0, 0)), BottleneckAnalyzer.DEFAULT_LIMIT);

        assertEquals(List.of("B->C", "C->D", "A->B"),
            items.stream().map(EdgeBottleneck::targetId).collect(Collectors.toList()));
        assertEquals(1.0, items.get(0).score(), 1e-9);
        assertEquals(0.25, items.get(2).score(), 1e-9);
        assertEquals(EdgeBottleneck.FREQUENT_ABORTS, items.get(0).reasonCode());
    }

    @Test
    @DisplayName("a timeout share of a fifth or more is reported as timeouts")
    void timeoutReason() {
        List<EdgeBottleneck> items = BottleneckAnalyzer.analyze("UAH", List.of(
            edge("A", "B", 5, 3, 1, 0, 1),
            edge("B", "C", 10, 8, 1, 0, 1)), 10);

        assertEquals(EdgeBottleneck.TOO_MANY_TIMEOUTS, items.get(0).reasonCode());
        assertEquals("A->B", items.get(0).targetId());
        assertEquals(EdgeBottleneck.FREQUENT_ABORTS, items.get(1).reasonCode());
    }

    @Test
    @DisplayName("clean edges, idle edges and other equivalents are left out")
    void filters() {
        List<EdgeBottleneck> items = BottleneckAnalyzer.analyze("UAH", List.of(
            edge("A", "B", 3, 3, 0, 0, 0),
            edge("B", "C", 0, 0, 0, 0, 0),
            new EdgeStats("EUR", "C", "D", 1, 0, 1, 0, 0)), 10);

        assertTrue(items.isEmpty());
    }

    @Test
    @DisplayName("the limit caps the list after ranking")
    void limit() {
        List<EdgeBottleneck> items = BottleneckAnalyzer.analyze("UAH", List.of(
            edge("A", "B", 2, 1, 1, 0, 0),
            edge("B", "C", 1, 0, 1, 0, 0),
            edge("C", "D", 1, 0, 0, 1, 0)), 1);

        assertEquals(1, items.size());
        assertEquals("C->D", items.get(0).targetId());
        assertTrue(BottleneckAnalyzer.analyze("UAH", List.of(edge("A", "B", 1, 0, 1, 0, 0)), 0).isEmpty());
    }
}
