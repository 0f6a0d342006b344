package com.creditsim.simulator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /api/v1/runs}; a missing intensity starts at 100%. */
public record CreateRunRequest(
    @JsonProperty("scenarioId")       String scenarioId,
    @JsonProperty("seed")             long seed,
    @JsonProperty("intensityPercent") Integer intensityPercent
) {

    public int intensityOrDefault() {
        return intensityPercent != null ? intensityPercent : 100;
    }
}
