package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static scenario document: the network, its behavior profiles and its event timeline.
 * Read-only once stored; a run works on its own mutable mirror.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Scenario(
    @JsonProperty("scenarioId")       String scenarioId,
    @JsonProperty("equivalents")      List<String> equivalents,
    @JsonProperty("participants")     List<Participant> participants,
    @JsonProperty("trustlines")       List<TrustLine> trustlines,
    @JsonProperty("behaviorProfiles") List<BehaviorProfile> behaviorProfiles,
    @JsonProperty("events")           List<ScenarioEvent> events,
    @JsonProperty("settings")         ScenarioSettings settings
) {

    public Scenario {
        equivalents      = equivalents      != null ? List.copyOf(equivalents)      : List.of();
        participants     = participants     != null ? List.copyOf(participants)     : List.of();
        trustlines       = trustlines       != null ? List.copyOf(trustlines)       : List.of();
        behaviorProfiles = behaviorProfiles != null ? List.copyOf(behaviorProfiles) : List.of();
        events           = events           != null ? List.copyOf(events)           : List.of();
        settings         = settings         != null ? settings                      : ScenarioSettings.empty();
    }
}
