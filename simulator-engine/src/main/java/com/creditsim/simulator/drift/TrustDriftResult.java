package com.creditsim.simulator.drift;

import com.creditsim.common.model.TrustLine;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Lines whose limit changed in one growth or decay pass, grouped by equivalent. */
public record TrustDriftResult(int updatedCount, Map<String, List<TrustLine>> updatedByEquivalent) {

    public static TrustDriftResult none() {
        return new TrustDriftResult(0, Map.of());
    }

    public List<TrustLine> updated() {
        return updatedByEquivalent.values().stream()
            .flatMap(List::stream)
            .collect(Collectors.toList());
    }
}
