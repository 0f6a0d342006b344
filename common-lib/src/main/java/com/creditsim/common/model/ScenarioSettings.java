package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scenario-level tuning. Every block and every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScenarioSettings(
    @JsonProperty("warmup")     Warmup warmup,
    @JsonProperty("flow")       Flow flow,
    @JsonProperty("trustDrift") TrustDrift trustDrift
) {

    public static ScenarioSettings empty() {
        return new ScenarioSettings(null, null, null);
    }

    /** Linear intensity ramp over the first {@code ticks} ticks, starting at {@code floor}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Warmup(
        @JsonProperty("ticks") Integer ticks,
        @JsonProperty("floor") Double floor
    ) {}

    /** Directed group flows and reciprocity bonus. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Flow(
        @JsonProperty("enabled")          Boolean enabled,
        @JsonProperty("defaultAffinity")  Double defaultAffinity,
        @JsonProperty("reciprocityBonus") Double reciprocityBonus
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrustDrift(
        @JsonProperty("enabled")           Boolean enabled,
        @JsonProperty("growthRate")        Double growthRate,
        @JsonProperty("decayRate")         Double decayRate,
        @JsonProperty("maxGrowth")         Double maxGrowth,
        @JsonProperty("minLimitRatio")     Double minLimitRatio,
        @JsonProperty("overloadThreshold") Double overloadThreshold
    ) {}
}
