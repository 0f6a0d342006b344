package com.creditsim.simulator.event;

import com.creditsim.common.event.NotePayload;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TopologyChangedPayload;
import com.creditsim.simulator.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorEventBusTest {

    private final SimulatorEventBus bus = new SimulatorEventBus(Fixtures.CLOCK);

    private static NotePayload note(String text) {
        return new NotePayload(0, 0L, 1L, text, null);
    }

    @Test
    @DisplayName("event ids increase per run, independently across runs")
    void idsPerRun() {
        assertEquals(1, bus.publish("r1", SimulatorEvent.NOTE, note("a")).eventId());
        assertEquals(2, bus.publish("r1", SimulatorEvent.NOTE, note("b")).eventId());
        assertEquals(1, bus.publish("r2", SimulatorEvent.NOTE, note("c")).eventId());
        assertEquals(2, bus.lastEventId("r1"));
        assertEquals(0, bus.lastEventId("unknown"));
    }

    @Test
    @DisplayName("events are stamped from the injected clock")
    void clockStamp() {
        assertEquals(Fixtures.CLOCK.instant(), bus.publish("r1", SimulatorEvent.NOTE, note("a")).at());
    }

    @Test
    @DisplayName("a subscriber only sees its own run")
    void filteredStream() {
        List<SimulatorEvent> seen = new CopyOnWriteArrayList<>();
        Disposable sub = bus.stream("r1").subscribe(seen::add);
        bus.publish("r1", SimulatorEvent.NOTE, note("mine"));
        bus.publish("r2", SimulatorEvent.NOTE, note("theirs"));
        sub.dispose();

        assertEquals(1, seen.size());
        assertEquals("r1", seen.get(0).runId());
    }

    @Test
    @DisplayName("events published before anyone listens are not replayed")
    void noReplay() {
        bus.publish("r1", SimulatorEvent.NOTE, note("early"));
        List<SimulatorEvent> seen = new CopyOnWriteArrayList<>();
        Disposable sub = bus.stream("r1").subscribe(seen::add);
        bus.publish("r1", SimulatorEvent.NOTE, note("late"));
        sub.dispose();

        assertEquals(1, seen.size());
        assertEquals(2, seen.get(0).eventId());
    }

    @Test
    @DisplayName("an empty topology change is refused")
    void emptyTopology() {
        assertThrows(IllegalArgumentException.class, () ->
            bus.publish("r1", SimulatorEvent.TOPOLOGY_CHANGED, new TopologyChangedPayload("UAH", "inject", null, null)));
        assertEquals(0, bus.lastEventId("r1"));
    }
}
