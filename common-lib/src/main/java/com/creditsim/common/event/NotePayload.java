package com.creditsim.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Diagnostic timeline entry: a fired {@code note}, or the outcome of an {@code inject}. */
public record NotePayload(
    @JsonProperty("eventIndex")  int eventIndex,
    @JsonProperty("time")        long time,
    @JsonProperty("tickIndex")   long tickIndex,
    @JsonProperty("description") String description,
    @JsonProperty("stats")       Map<String, Object> stats
) {}
