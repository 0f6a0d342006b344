package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Timeline entry of a scenario, scheduled at simulated {@code time} ms.
 *
 * <p>{@code effects} are kept as loose maps: stress effects carry
 * {@code op/field/value/scope}, inject effects carry {@code op} plus op-specific keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScenarioEvent(
    @JsonProperty("time")        Long time,
    @JsonProperty("type")        String type,
    @JsonProperty("description") String description,
    @JsonProperty("durationMs")  Long durationMs,
    @JsonProperty("effects")     List<Map<String, Object>> effects,
    @JsonProperty("metadata")    Map<String, Object> metadata
) {

    public static final String TYPE_NOTE   = "note";
    public static final String TYPE_STRESS = "stress";
    public static final String TYPE_INJECT = "inject";

    public boolean isType(String expected) {
        return type != null && expected.equals(type.trim());
    }
}
