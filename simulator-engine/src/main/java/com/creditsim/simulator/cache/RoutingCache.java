package com.creditsim.simulator.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-equivalent routing topology: for every participant, the neighbors it shares an
 * active trust line with (either direction).
 *
 * <p>Build Once → Route Many: the graph is built lazily on the first routing request
 * and kept until something changes the topology. Every topology mutation (inject,
 * trust drift, status change) must call {@link #invalidate(String)} for the affected
 * equivalent; nothing expires on its own.
 */
@Component
public class RoutingCache {

    private static final Logger log = LoggerFactory.getLogger(RoutingCache.class);

    private final ConcurrentHashMap<String, Map<String, Set<String>>> graphs = new ConcurrentHashMap<>();

    public Map<String, Set<String>> graph(String equivalent, Supplier<Map<String, Set<String>>> builder) {
        return graphs.computeIfAbsent(equivalent, eq -> {
            Map<String, Set<String>> built = builder.get();
            log.debug("ROUTING_GRAPH_BUILT equivalent={} nodes={}", eq, built.size());
            return built;
        });
    }

    public void invalidate(String equivalent) {
        if (graphs.remove(equivalent) != null) {
            log.debug("ROUTING_GRAPH_EVICTED equivalent={}", equivalent);
        }
    }

    public void invalidateAll() {
        graphs.clear();
    }

    public boolean isCached(String equivalent) {
        return graphs.containsKey(equivalent);
    }
}
