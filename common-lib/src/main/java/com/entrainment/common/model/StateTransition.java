package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Directed edge between two consciousness states.
 */
public record StateTransition(
    @JsonProperty("fromState")              String fromState,
    @JsonProperty("toState")                String toState,
    @JsonProperty("typicalDurationMinutes") NumericRange typicalDurationMinutes,
    @JsonProperty("difficulty")             TransitionDifficulty difficulty,
    @JsonProperty("method")                 String method,
    @JsonProperty("preparationNeeded")      boolean preparationNeeded,
    @JsonProperty("safetyNotes")            List<String> safetyNotes
) {
    public StateTransition {
        safetyNotes = List.copyOf(safetyNotes);
    }

    public boolean connects(String from, String to) {
        return fromState.equals(from) && toState.equals(to);
    }
}
