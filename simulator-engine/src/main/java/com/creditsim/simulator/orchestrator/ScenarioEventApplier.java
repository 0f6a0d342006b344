package com.creditsim.simulator.orchestrator;

import com.creditsim.common.event.EdgePatch;
import com.creditsim.common.event.NodePatch;
import com.creditsim.common.event.NotePayload;
import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.event.TopologyChangedPayload;
import com.creditsim.common.model.Amounts;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.ScenarioEvent;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.drift.TrustDriftEngine;
import com.creditsim.simulator.event.EdgePatchBuilder;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.run.RunState;
import com.creditsim.simulator.scenario.ScenarioGraph;
import com.creditsim.simulator.scenario.ScenarioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Fires scenario timeline events that are due at the run's simulated time.
 *
 * <p>{@code note} events are forwarded as-is. {@code inject} events mutate the network
 * through four ops, each idempotent and best-effort: a failing or inapplicable op is
 * skipped and counted, never fatal. Applied ops are committed right away, mirrored into
 * the run's {@link ScenarioGraph} and the scenario store, and announced as one
 * {@code topology.changed} per affected equivalent carrying only what changed.
 * {@code stress} events are not fired here; the planner reads them every tick.
 */
@Component
public class ScenarioEventApplier {

    private static final Logger log = LoggerFactory.getLogger(ScenarioEventApplier.class);

    public static final String OP_INJECT_DEBT        = "inject_debt";
    public static final String OP_ADD_PARTICIPANT    = "add_participant";
    public static final String OP_CREATE_TRUSTLINE   = "create_trustline";
    public static final String OP_FREEZE_PARTICIPANT = "freeze_participant";

    public static final String REASON_INJECT = "inject";

    static final int MAX_EFFECTS = 500;

    private static final Set<String> PARTICIPANT_TYPES    = Set.of("person", "business", "hub");
    private static final Set<String> PARTICIPANT_STATUSES = Set.of("active", "suspended", "left", "deleted");

    private final SimulatorEventBus eventBus;
    private final EdgePatchBuilder  patchBuilder;
    private final ScenarioStore     scenarioStore;
    private final TrustDriftEngine  trustDrift;

    public ScenarioEventApplier(SimulatorEventBus eventBus, EdgePatchBuilder patchBuilder,
                                ScenarioStore scenarioStore, TrustDriftEngine trustDrift) {
        this.eventBus      = eventBus;
        this.patchBuilder  = patchBuilder;
        this.scenarioStore = scenarioStore;
        this.trustDrift    = trustDrift;
    }

    /** Fires every due, not yet fired note and inject event; emits how many fired. */
    public Mono<Integer> applyDue(RunState run, LedgerSession session) {
        List<ScenarioEvent> events = run.getGraph().events();
        List<Mono<Void>> persists = new ArrayList<>();
        int fired = 0;
        for (int i = 0; i < events.size(); i++) {
            ScenarioEvent event = events.get(i);
            if (event == null || run.isEventFired(i)) continue;
            long time = event.time() != null ? event.time() : 0L;
            if (time > run.getSimTimeMs()) continue;

            if (event.isType(ScenarioEvent.TYPE_NOTE)) {
                run.markEventFired(i);
                note(run, i, time, event.description(), null);
                fired++;
            } else if (event.isType(ScenarioEvent.TYPE_INJECT)) {
                run.markEventFired(i);
                persists.add(inject(run, session, i, time, event));
                fired++;
            }
        }
        int count = fired;
        return Flux.concat(persists).then(Mono.just(count));
    }

    // ── inject ─────────────────────────────────────────────────────────────────

    private Mono<Void> inject(RunState run, LedgerSession session, int index, long time, ScenarioEvent event) {
        if (!run.getSettings().injectEnabled()) {
            note(run, index, time, "inject skipped (inject disabled)", null);
            return Mono.empty();
        }
        List<Map<String, Object>> effects = event.effects();
        if (effects == null || effects.isEmpty()) {
            return Mono.empty();
        }

        InjectBatch batch = new InjectBatch(maxTotalAmount(event.metadata()));
        ScenarioGraph graph = run.getGraph();
        for (Map<String, Object> effect : effects.subList(0, Math.min(effects.size(), MAX_EFFECTS))) {
            String op = effect == null ? "" : text(effect, "op");
            try {
                boolean applied = switch (op) {
                    case OP_INJECT_DEBT        -> injectDebt(graph, session, effect, batch);
                    case OP_ADD_PARTICIPANT    -> addParticipant(graph, session, effect, batch);
                    case OP_CREATE_TRUSTLINE   -> createTrustLine(graph, session, effect, batch);
                    case OP_FREEZE_PARTICIPANT -> freezeParticipant(graph, session, effect, batch);
                    default -> false;
                };
                if (applied) batch.applied++; else batch.skipped++;
            } catch (RuntimeException e) {
                batch.skipped++;
                log.warn("[Inject] Op failed. runId={} eventIndex={} op={} error={}",
                         run.getRunId(), index, op, e.getMessage());
            }
        }

        try {
            session.commit();
        } catch (RuntimeException e) {
            session.rollback();
            log.warn("[Inject] Commit failed. runId={} eventIndex={} error={}", run.getRunId(), index, e.getMessage());
            note(run, index, time, "inject failed (ledger error)", null);
            return Mono.empty();
        }

        mirror(run, batch);
        publishTopology(run, session, batch);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("applied", batch.applied);
        stats.put("skipped", batch.skipped);
        stats.put("totalAmount", Amounts.truncate(batch.totalApplied).toPlainString());
        note(run, index, time, "inject applied", stats);
        log.info("[Inject] Applied. runId={} eventIndex={} applied={} skipped={} affectedEquivalents={}",
                 run.getRunId(), index, batch.applied, batch.skipped, batch.affectedEquivalents);

        return persist(run, batch);
    }

    private boolean injectDebt(ScenarioGraph graph, LedgerSession session, Map<String, Object> effect, InjectBatch batch) {
        String eq       = equivalent(graph, effect);
        String creditor = text(effect, "creditor", "from");
        String debtor   = text(effect, "debtor", "to");
        BigDecimal raw  = Amounts.parse(effect.get("amount"));
        if (eq == null || creditor.isEmpty() || debtor.isEmpty() || raw == null) return false;

        BigDecimal amount = Amounts.truncate(raw);
        if (amount.signum() <= 0) return false;
        if (batch.maxTotalAmount != null && batch.totalApplied.add(amount).compareTo(batch.maxTotalAmount) > 0) {
            return false;
        }
        if (session.participant(creditor).isEmpty() || session.participant(debtor).isEmpty()) return false;

        TrustLine line = session.trustLine(creditor, debtor, eq).orElse(null);
        if (line == null || !line.isActive() || line.limit() == null || line.limit().signum() <= 0) return false;

        BigDecimal updated = Amounts.truncate(session.debt(debtor, creditor, eq).add(amount));
        if (updated.compareTo(line.limit()) > 0) return false;

        session.setDebt(debtor, creditor, eq, updated);
        batch.totalApplied = batch.totalApplied.add(amount);
        batch.affectedEquivalents.add(eq);
        batch.debtEdges.computeIfAbsent(eq, k -> new LinkedHashSet<>())
            .add(new AbstractMap.SimpleImmutableEntry<>(creditor, debtor));
        return true;
    }

    @SuppressWarnings("unchecked")
    private boolean addParticipant(ScenarioGraph graph, LedgerSession session, Map<String, Object> effect, InjectBatch batch) {
        if (!(effect.get("participant") instanceof Map<?, ?> rawData)) {
            log.warn("[Inject] add_participant without participant object");
            return false;
        }
        Map<String, Object> data = (Map<String, Object>) rawData;
        String id = text(data, "id");
        if (id.isEmpty()) return false;
        if (session.participant(id).isPresent()) {
            log.info("[Inject] add_participant skipped, exists. pid={}", id);
            return false;
        }

        String type   = text(data, "type").toLowerCase(Locale.ROOT);
        String status = text(data, "status").toLowerCase(Locale.ROOT);
        String name   = text(data, "name");
        Participant participant = new Participant(id, name.isEmpty() ? id : name,
            PARTICIPANT_TYPES.contains(type) ? type : "person",
            PARTICIPANT_STATUSES.contains(status) ? status : Participant.STATUS_ACTIVE,
            text(data, "groupId"), text(data, "behaviorProfileId"));
        session.upsertParticipant(participant);
        batch.newParticipants.add(participant);

        Object initial = effect.containsKey("initialTrustlines") ? effect.get("initialTrustlines") : effect.get("initial_trustlines");
        if (initial instanceof List<?> lines) {
            for (Object item : lines) {
                if (!(item instanceof Map<?, ?> rawLine)) continue;
                Map<String, Object> lineSpec = (Map<String, Object>) rawLine;
                String sponsor = text(lineSpec, "sponsor");
                String eq      = equivalent(graph, lineSpec);
                BigDecimal limit = Amounts.parse(lineSpec.get("limit"));
                if (sponsor.isEmpty() || eq == null || limit == null || limit.signum() <= 0) continue;
                if (session.participant(sponsor).isEmpty()) {
                    log.warn("[Inject] add_participant sponsor not found. sponsor={}", sponsor);
                    continue;
                }
                String direction = text(lineSpec, "direction");
                boolean sponsorCredits = direction.isEmpty() || "sponsor_credits_new".equals(direction);
                String from = sponsorCredits ? sponsor : id;
                String to   = sponsorCredits ? id : sponsor;
                if (session.trustLine(from, to, eq).isPresent()) continue;

                TrustLine line = new TrustLine(from, to, eq, Amounts.truncate(limit), TrustLine.STATUS_ACTIVE);
                session.upsertTrustLine(line);
                batch.newTrustLines.add(line);
                batch.affectedEquivalents.add(eq);
            }
        }
        return true;
    }

    private boolean createTrustLine(ScenarioGraph graph, LedgerSession session, Map<String, Object> effect, InjectBatch batch) {
        String from = text(effect, "from");
        String to   = text(effect, "to");
        String eq   = equivalent(graph, effect);
        BigDecimal limit = Amounts.parse(effect.get("limit"));
        if (from.isEmpty() || to.isEmpty() || eq == null || limit == null || limit.signum() <= 0) return false;
        if (session.participant(from).isEmpty() || session.participant(to).isEmpty()) {
            log.warn("[Inject] create_trustline participant not found. from={} to={}", from, to);
            return false;
        }
        if (session.trustLine(from, to, eq).isPresent()) {
            log.info("[Inject] create_trustline skipped, exists. from={} to={} eq={}", from, to, eq);
            return false;
        }
        TrustLine line = new TrustLine(from, to, eq, Amounts.truncate(limit), TrustLine.STATUS_ACTIVE);
        session.upsertTrustLine(line);
        batch.newTrustLines.add(line);
        batch.affectedEquivalents.add(eq);
        return true;
    }

    private boolean freezeParticipant(ScenarioGraph graph, LedgerSession session, Map<String, Object> effect, InjectBatch batch) {
        String pid = text(effect, "participantId", "participant_id");
        if (pid.isEmpty()) return false;
        Participant participant = session.participant(pid).orElse(null);
        if (participant == null) {
            log.warn("[Inject] freeze_participant not found. pid={}", pid);
            return false;
        }
        if (Participant.STATUS_SUSPENDED.equalsIgnoreCase(participant.status())) {
            log.info("[Inject] freeze_participant skipped, already suspended. pid={}", pid);
            return false;
        }
        Participant suspended = participant.withStatus(Participant.STATUS_SUSPENDED);
        session.upsertParticipant(suspended);
        batch.frozenParticipants.add(suspended);

        Object flag = effect.containsKey("freezeTrustlines") ? effect.get("freezeTrustlines") : effect.get("freeze_trustlines");
        boolean freezeLines = flag == null || Boolean.parseBoolean(String.valueOf(flag));
        for (TrustLine line : session.trustLines()) {
            if (!pid.equals(line.from()) && !pid.equals(line.to())) continue;
            batch.affectedEquivalents.add(line.equivalent());
            if (freezeLines && line.isActive()) {
                TrustLine frozen = line.withStatus(TrustLine.STATUS_FROZEN);
                session.upsertTrustLine(frozen);
                batch.frozenTrustLines.add(frozen);
            }
        }
        return true;
    }

    // ── after commit ───────────────────────────────────────────────────────────

    private void mirror(RunState run, InjectBatch batch) {
        ScenarioGraph graph = run.getGraph();
        batch.newParticipants.forEach(graph::addParticipant);
        for (TrustLine line : batch.newTrustLines) {
            graph.addTrustLine(line);
            trustDrift.register(run, line);
        }
        batch.frozenParticipants.forEach(p -> graph.updateParticipantStatus(p.id(), p.status()));
        batch.frozenTrustLines.forEach(tl -> graph.updateTrustLineStatus(tl.from(), tl.to(), tl.equivalent(), tl.status()));
    }

    private void publishTopology(RunState run, LedgerSession session, InjectBatch batch) {
        ScenarioGraph graph = run.getGraph();
        Set<String> nodeIds = new LinkedHashSet<>();
        batch.newParticipants.forEach(p -> nodeIds.add(p.id()));
        batch.frozenParticipants.forEach(p -> nodeIds.add(p.id()));

        for (String eq : batch.affectedEquivalents) {
            try {
                Map<String, EdgePatch> edges = new LinkedHashMap<>();
                for (TrustLine line : batch.frozenTrustLines) {
                    if (eq.equals(line.equivalent())) edges.putIfAbsent(line.key(), patchBuilder.edge(session, line));
                }
                for (TrustLine line : batch.newTrustLines) {
                    if (eq.equals(line.equivalent())) edges.putIfAbsent(line.key(), patchBuilder.edge(session, line));
                }
                Set<Map.Entry<String, String>> debtEdges = batch.debtEdges.getOrDefault(eq, Set.of());
                for (EdgePatch patch : patchBuilder.forEdges(session, graph, eq, debtEdges)) {
                    edges.putIfAbsent(TrustLine.key(patch.from(), patch.to(), patch.equivalent()), patch);
                }
                List<NodePatch> nodes = patchBuilder.nodes(session, graph, eq, nodeIds);
                TopologyChangedPayload payload = new TopologyChangedPayload(eq, REASON_INJECT, nodes, new ArrayList<>(edges.values()));
                if (payload.isEmpty()) continue;
                eventBus.publish(run.getRunId(), SimulatorEvent.TOPOLOGY_CHANGED, payload);
            } catch (RuntimeException e) {
                log.warn("[Inject] Topology broadcast failed. runId={} eq={} error={}", run.getRunId(), eq, e.getMessage());
            }
        }
    }

    private Mono<Void> persist(RunState run, InjectBatch batch) {
        String scenarioId = run.getScenarioId();
        List<Mono<Void>> patches = new ArrayList<>();
        batch.newParticipants.forEach(p -> patches.add(scenarioStore.patchParticipant(scenarioId, p)));
        batch.frozenParticipants.forEach(p -> patches.add(scenarioStore.patchParticipant(scenarioId, p)));
        batch.newTrustLines.forEach(tl -> patches.add(scenarioStore.patchTrustLine(scenarioId, tl)));
        batch.frozenTrustLines.forEach(tl -> patches.add(scenarioStore.patchTrustLine(scenarioId, tl)));
        return Flux.concat(patches)
            .then()
            .onErrorResume(e -> {
                log.warn("[Inject] Scenario patch failed. runId={} error={}", run.getRunId(), e.getMessage());
                return Mono.empty();
            });
    }

    // ── helpers ────────────────────────────────────────────────────────────────

    private void note(RunState run, int index, long time, String description, Map<String, Object> stats) {
        eventBus.publish(run.getRunId(), SimulatorEvent.NOTE,
            new NotePayload(index, time, run.getTickIndex(), description, stats));
    }

    /**
     * Effect's equivalent, or the scenario's only equivalent; {@code null} when unknown.
     * Codes compare case-insensitively and resolve to the scenario's own spelling.
     */
    static String equivalent(ScenarioGraph graph, Map<String, Object> effect) {
        String eq = text(effect, "equivalent");
        List<String> known = graph.equivalents();
        if (eq.isEmpty()) {
            if (known.size() == 1) return known.get(0);
            log.warn("[Inject] Effect names no equivalent and the scenario has {}. op={}",
                known.size(), text(effect, "op"));
            return null;
        }
        for (String code : known) {
            if (code.equalsIgnoreCase(eq)) return code;
        }
        log.warn("[Inject] Unknown equivalent, effect skipped. equivalent={} op={} known={}",
            eq, text(effect, "op"), known);
        return null;
    }

    static String text(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return "";
    }

    private static BigDecimal maxTotalAmount(Map<String, Object> metadata) {
        if (metadata == null) return null;
        Object raw = metadata.containsKey("maxTotalAmount") ? metadata.get("maxTotalAmount") : metadata.get("max_total_amount");
        BigDecimal value = Amounts.parse(raw);
        return value != null && value.signum() > 0 ? value : null;
    }

    private static final class InjectBatch {
        final BigDecimal        maxTotalAmount;
        final Set<String>       affectedEquivalents = new TreeSet<>();
        final List<Participant> newParticipants     = new ArrayList<>();
        final List<Participant> frozenParticipants  = new ArrayList<>();
        final List<TrustLine>   newTrustLines       = new ArrayList<>();
        final List<TrustLine>   frozenTrustLines    = new ArrayList<>();
        final Map<String, Set<Map.Entry<String, String>>> debtEdges = new TreeMap<>();
        BigDecimal totalApplied = BigDecimal.ZERO;
        int applied;
        int skipped;

        InjectBatch(BigDecimal maxTotalAmount) {
            this.maxTotalAmount = maxTotalAmount;
        }
    }
}
