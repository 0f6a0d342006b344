package com.creditsim.simulator.event;

import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TopologyChangedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hot stream of every run's domain events.
 *
 * <p>Event ids are assigned here, per run, strictly increasing. Publishing is
 * serialized so that id order and emission order always agree. Events published while
 * nobody listens, or that a slow subscriber cannot take, are dropped for that subscriber.
 */
@Component
public class SimulatorEventBus {

    private static final Logger log = LoggerFactory.getLogger(SimulatorEventBus.class);

    private final Sinks.Many<SimulatorEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public SimulatorEventBus(Clock clock) {
        this.clock = clock;
    }

    public synchronized SimulatorEvent publish(String runId, String type, Object payload) {
        if (payload instanceof TopologyChangedPayload topology && topology.isEmpty()) {
            throw new IllegalArgumentException("Empty topology.changed payload for run " + runId);
        }
        long eventId = counters.computeIfAbsent(runId, id -> new AtomicLong()).incrementAndGet();
        SimulatorEvent event = new SimulatorEvent(eventId, runId, type, clock.instant(), payload);
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("EVENT_DROPPED runId={} type={} eventId={} result={}", runId, type, eventId, result);
        }
        return event;
    }

    public Flux<SimulatorEvent> stream(String runId) {
        return sink.asFlux().filter(e -> runId.equals(e.runId()));
    }

    public long lastEventId(String runId) {
        AtomicLong counter = counters.get(runId);
        return counter != null ? counter.get() : 0L;
    }
}
