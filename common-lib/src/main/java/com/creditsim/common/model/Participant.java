package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A network member. Status {@code active} participants can send and receive;
 * {@code suspended} ones are frozen by an inject event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Participant(
    @JsonProperty("id")                String id,
    @JsonProperty("name")              String name,
    @JsonProperty("type")              String type,
    @JsonProperty("status")            String status,
    @JsonProperty("groupId")           String groupId,
    @JsonProperty("behaviorProfileId") String behaviorProfileId
) {

    public static final String STATUS_ACTIVE    = "active";
    public static final String STATUS_SUSPENDED = "suspended";

    public boolean isActive() {
        return status == null || status.isBlank() || STATUS_ACTIVE.equalsIgnoreCase(status.trim());
    }

    public Participant withStatus(String newStatus) {
        return new Participant(id, name, type, newStatus, groupId, behaviorProfileId);
    }
}
