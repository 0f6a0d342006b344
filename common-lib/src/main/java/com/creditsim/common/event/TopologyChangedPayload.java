package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Incremental topology change for one equivalent. Carries only the nodes and
 * edges that changed; a payload where every list is empty is never emitted.
 */
public record TopologyChangedPayload(
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("reason")     String reason,
    @JsonProperty("nodes")      List<NodePatch> nodes,
    @JsonProperty("edges")      List<EdgePatch> edges
) {

    public TopologyChangedPayload {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }
}
