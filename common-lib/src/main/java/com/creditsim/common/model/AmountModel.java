package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-equivalent payment size distribution of a behavior profile.
 * Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AmountModel(
    @JsonProperty("p50") Double p50,
    @JsonProperty("p90") Double p90,
    @JsonProperty("min") Double min,
    @JsonProperty("max") Double max
) {}
