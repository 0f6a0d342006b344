package com.creditsim.simulator.scenario;

import com.creditsim.common.model.BehaviorProfile;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.Scenario;
import com.creditsim.common.model.ScenarioEvent;
import com.creditsim.common.model.ScenarioSettings;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.cache.RoutingCache;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A run's own mutable copy of its scenario.
 *
 * <p>Inject events and trust drift patch limits and statuses in place. Every mutator
 * drops the per-equivalent payment adjacency and evicts the {@link RoutingCache} entry
 * for the affected equivalent, so planner and router never read a stale topology.
 * All methods are synchronized: clearing runs on its own task and patches limits
 * concurrently with the tick.
 */
public final class ScenarioGraph {

    private final Scenario                     source;
    private final RoutingCache                 routingCache;
    private final TreeSet<String>              equivalents      = new TreeSet<>();
    private final Map<String, Participant>     participants     = new LinkedHashMap<>();
    private final Map<String, TrustLine>       trustLines       = new LinkedHashMap<>();
    private final Map<String, BehaviorProfile> profiles         = new LinkedHashMap<>();
    private final Map<String, Map<String, List<String>>> paymentAdjacency = new HashMap<>();

    private ScenarioGraph(Scenario source, RoutingCache routingCache) {
        this.source       = source;
        this.routingCache = routingCache;
        source.participants().forEach(p -> participants.put(p.id(), p));
        source.trustlines().forEach(tl -> trustLines.put(tl.key(), tl));
        source.behaviorProfiles().forEach(bp -> profiles.put(bp.id(), bp));
        equivalents.addAll(source.equivalents());
        source.trustlines().forEach(tl -> equivalents.add(tl.equivalent()));
    }

    public static ScenarioGraph of(Scenario scenario, RoutingCache routingCache) {
        return new ScenarioGraph(scenario, routingCache);
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    public Scenario source()                { return source; }
    public String scenarioId()              { return source.scenarioId(); }
    public List<ScenarioEvent> events()     { return source.events(); }
    public ScenarioSettings settings()      { return source.settings(); }

    public synchronized List<String> equivalents() {
        return new ArrayList<>(equivalents);
    }

    public synchronized List<Participant> participants() {
        return new ArrayList<>(participants.values());
    }

    public synchronized Optional<Participant> participant(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public synchronized String groupOf(String participantId) {
        Participant p = participants.get(participantId);
        return p != null && p.groupId() != null && !p.groupId().isBlank() ? p.groupId().trim() : null;
    }

    public synchronized BehaviorProfile profileOf(String participantId) {
        Participant p = participants.get(participantId);
        if (p == null || p.behaviorProfileId() == null) return null;
        return profiles.get(p.behaviorProfileId().trim());
    }

    public synchronized List<TrustLine> trustLines() {
        return new ArrayList<>(trustLines.values());
    }

    public synchronized List<TrustLine> activeTrustLines() {
        return trustLines.values().stream()
            .filter(TrustLine::isActive)
            .collect(Collectors.toList());
    }

    public synchronized Optional<TrustLine> trustLine(String creditor, String debtor, String equivalent) {
        return Optional.ofNullable(trustLines.get(TrustLine.key(creditor, debtor, equivalent)));
    }

    /**
     * Payment-direction adjacency (debtor → creditors) of active trust lines with a
     * positive limit, neighbors sorted. Built lazily, dropped on any mutation.
     */
    public synchronized Map<String, List<String>> paymentAdjacency(String equivalent) {
        return paymentAdjacency.computeIfAbsent(equivalent, eq -> {
            Map<String, TreeSet<String>> building = new TreeMap<>();
            for (TrustLine tl : trustLines.values()) {
                if (!eq.equals(tl.equivalent()) || !tl.isActive()) continue;
                if (tl.limit() == null || tl.limit().signum() <= 0) continue;
                building.computeIfAbsent(tl.to(), k -> new TreeSet<>()).add(tl.from());
            }
            Map<String, List<String>> built = new TreeMap<>();
            building.forEach((sender, receivers) -> built.put(sender, List.copyOf(receivers)));
            return Collections.unmodifiableMap(built);
        });
    }

    // ── mutators ──────────────────────────────────────────────────────────────

    /** @return the updated line, or empty when the line is unknown */
    public synchronized Optional<TrustLine> updateTrustLineLimit(String creditor, String debtor,
                                                                 String equivalent, BigDecimal limit) {
        String key = TrustLine.key(creditor, debtor, equivalent);
        TrustLine current = trustLines.get(key);
        if (current == null) return Optional.empty();
        TrustLine updated = current.withLimit(limit);
        trustLines.put(key, updated);
        invalidate(equivalent);
        return Optional.of(updated);
    }

    public synchronized Optional<TrustLine> updateTrustLineStatus(String creditor, String debtor,
                                                                  String equivalent, String status) {
        String key = TrustLine.key(creditor, debtor, equivalent);
        TrustLine current = trustLines.get(key);
        if (current == null) return Optional.empty();
        TrustLine updated = current.withStatus(status);
        trustLines.put(key, updated);
        invalidate(equivalent);
        return Optional.of(updated);
    }

    /** @return {@code false} when a line with the same key already exists */
    public synchronized boolean addTrustLine(TrustLine trustLine) {
        if (trustLines.containsKey(trustLine.key())) return false;
        trustLines.put(trustLine.key(), trustLine);
        equivalents.add(trustLine.equivalent());
        invalidate(trustLine.equivalent());
        return true;
    }

    /** @return {@code false} when the participant already exists */
    public synchronized boolean addParticipant(Participant participant) {
        if (participants.containsKey(participant.id())) return false;
        participants.put(participant.id(), participant);
        return true;
    }

    public synchronized Optional<Participant> updateParticipantStatus(String participantId, String status) {
        Participant current = participants.get(participantId);
        if (current == null) return Optional.empty();
        Participant updated = current.withStatus(status);
        participants.put(participantId, updated);
        equivalents.forEach(this::invalidate);
        return Optional.of(updated);
    }

    private void invalidate(String equivalent) {
        paymentAdjacency.remove(equivalent);
        routingCache.invalidate(equivalent);
    }
}
