package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable reference description of a consciousness state.
 *
 * @param id                    stable identifier used in journeys ({@code "theta_exploration"})
 * @param depth                 ordinal distance from waking baseline, 1 (surface) … 5 (transcendent)
 * @param requiredLevel         lowest experience level allowed to enter the state
 */
public record ConsciousnessState(
    @JsonProperty("id")                     String id,
    @JsonProperty("name")                   String name,
    @JsonProperty("dominantBand")           String dominantBand,
    @JsonProperty("frequencyRange")         NumericRange frequencyRange,
    @JsonProperty("depth")                  int depth,
    @JsonProperty("qualities")              List<String> qualities,
    @JsonProperty("typicalDurationMinutes") NumericRange typicalDurationMinutes,
    @JsonProperty("preparationNeeded")      boolean preparationNeeded,
    @JsonProperty("integrationNeeded")      boolean integrationNeeded,
    @JsonProperty("requiredLevel")          ExperienceLevel requiredLevel,
    @JsonProperty("safetyConsiderations")   List<String> safetyConsiderations
) {
    public ConsciousnessState {
        if (depth < 1 || depth > 5) {
            throw new IllegalArgumentException("depth must be within 1..5, was " + depth);
        }
        qualities            = List.copyOf(qualities);
        safetyConsiderations = List.copyOf(safetyConsiderations);
    }

    public boolean allowedFor(ExperienceLevel level) {
        return level != null && level.atLeast(requiredLevel);
    }
}
