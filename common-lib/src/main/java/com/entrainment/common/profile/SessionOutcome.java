package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What happened in a completed session, as reported by the session runner.
 *
 * @param stateComfortLevels     comfort per visited state; unreported states count as 0.8
 * @param frequencyEffectiveness effectiveness per brainwave band used; unreported bands count as 0.5
 * @param averageCoherence       mean biofield coherence; {@code null} leaves the baseline unchanged
 * @param overallComfort         {@code null} counts as 0.8
 * @param effectiveness          {@code null} counts as 0.5
 */
public record SessionOutcome(
    @JsonProperty("duration_minutes")        int durationMinutes,
    @JsonProperty("consciousness_states")    List<String> consciousnessStates,
    @JsonProperty("state_comfort_levels")    Map<String, Double> stateComfortLevels,
    @JsonProperty("frequency_effectiveness") Map<String, Double> frequencyEffectiveness,
    @JsonProperty("average_coherence")       Double averageCoherence,
    @JsonProperty("overall_comfort")         Double overallComfort,
    @JsonProperty("effectiveness")           Double effectiveness,
    @JsonProperty("notes")                   String notes
) {
    public SessionOutcome {
        consciousnessStates    = consciousnessStates == null ? List.of() : List.copyOf(consciousnessStates);
        stateComfortLevels     = stateComfortLevels == null ? Map.of() : Map.copyOf(stateComfortLevels);
        frequencyEffectiveness = frequencyEffectiveness == null ? Map.of() : Map.copyOf(frequencyEffectiveness);
        notes = notes == null ? "" : notes;
    }

    public double durationHours() {
        return durationMinutes / 60.0;
    }
}
