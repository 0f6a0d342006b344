package com.creditsim.simulator.event;

import com.creditsim.common.event.EdgePatch;
import com.creditsim.common.event.NodePatch;
import com.creditsim.common.model.Debt;
import com.creditsim.common.model.Participant;
import com.creditsim.common.model.TrustLine;
import com.creditsim.simulator.ledger.LedgerSession;
import com.creditsim.simulator.scenario.ScenarioGraph;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds incremental node/edge visualization patches from the scenario mirror (limits,
 * statuses) and a ledger session (debts).
 */
@Component
public class EdgePatchBuilder {

    public EdgePatch edge(LedgerSession session, TrustLine line) {
        BigDecimal limit = line.limit() != null ? line.limit() : BigDecimal.ZERO;
        BigDecimal used  = session.debt(line.to(), line.from(), line.equivalent());
        BigDecimal available = limit.subtract(used).max(BigDecimal.ZERO);
        return new EdgePatch(line.from(), line.to(), line.equivalent(), limit, used, available,
            line.isActive() ? TrustLine.STATUS_ACTIVE : line.status());
    }

    /** Patches for every trust line, in either direction, between consecutive route hops. */
    public List<EdgePatch> forRoute(LedgerSession session, ScenarioGraph graph, String equivalent, List<String> route) {
        Map<String, EdgePatch> patches = new LinkedHashMap<>();
        for (int i = 0; i + 1 < route.size(); i++) {
            String payer = route.get(i);
            String payee = route.get(i + 1);
            addLine(patches, session, graph.trustLine(payee, payer, equivalent));
            addLine(patches, session, graph.trustLine(payer, payee, equivalent));
        }
        return new ArrayList<>(patches.values());
    }

    /** Patches for the given (creditor, debtor) pairs. */
    public List<EdgePatch> forEdges(LedgerSession session, ScenarioGraph graph, String equivalent,
                                    Collection<Map.Entry<String, String>> creditorDebtorPairs) {
        Map<String, EdgePatch> patches = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : creditorDebtorPairs) {
            addLine(patches, session, graph.trustLine(pair.getKey(), pair.getValue(), equivalent));
        }
        return new ArrayList<>(patches.values());
    }

    /** Net balance (owed to minus owing) of each participant in {@code equivalent}. */
    public List<NodePatch> nodes(LedgerSession session, ScenarioGraph graph, String equivalent,
                                 Collection<String> participantIds) {
        Set<String> ids = new LinkedHashSet<>(participantIds);
        Map<String, BigDecimal> net = new LinkedHashMap<>();
        ids.forEach(id -> net.put(id, BigDecimal.ZERO));
        for (Debt d : session.debts()) {
            if (!equivalent.equals(d.equivalent())) continue;
            if (net.containsKey(d.creditor())) net.merge(d.creditor(), d.amount(), BigDecimal::add);
            if (net.containsKey(d.debtor()))   net.merge(d.debtor(), d.amount().negate(), BigDecimal::add);
        }
        List<NodePatch> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            String status = graph.participant(id).map(Participant::status).orElse(Participant.STATUS_ACTIVE);
            out.add(new NodePatch(id, status != null ? status : Participant.STATUS_ACTIVE, net.get(id)));
        }
        return out;
    }

    private void addLine(Map<String, EdgePatch> patches, LedgerSession session, Optional<TrustLine> line) {
        line.ifPresent(tl -> patches.putIfAbsent(tl.key(), edge(session, tl)));
    }
}
