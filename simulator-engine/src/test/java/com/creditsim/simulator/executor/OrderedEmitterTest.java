package com.creditsim.simulator.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderedEmitterTest {

    private final List<String> out = new ArrayList<>();
    private final OrderedEmitter<String> emitter = new OrderedEmitter<>(out::add);

    @Test
    @DisplayName("holds results back until the gap before them closes")
    void reorders() {
        emitter.offer(2, "c");
        emitter.offer(1, "b");
        assertTrue(out.isEmpty());
        emitter.offer(0, "a");
        assertEquals(List.of("a", "b", "c"), out);
        assertEquals(3, emitter.emittedUpTo());
    }

    @Test
    @DisplayName("flush emits the rest in order across gaps")
    void flush() {
        emitter.offer(0, "a");
        emitter.offer(4, "e");
        emitter.offer(2, "c");
        assertEquals(2, emitter.flush());
        assertEquals(List.of("a", "c", "e"), out);
        assertEquals(5, emitter.emittedUpTo());
    }

    @Test
    @DisplayName("the same seq twice is a bug")
    void duplicate() {
        emitter.offer(0, "a");
        assertThrows(IllegalStateException.class, () -> emitter.offer(0, "again"));
        emitter.offer(2, "c");
        assertThrows(IllegalStateException.class, () -> emitter.offer(2, "again"));
    }
}
