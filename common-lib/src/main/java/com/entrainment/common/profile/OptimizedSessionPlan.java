package com.entrainment.common.profile;

import com.entrainment.common.model.NeuralLoadLimit;
import com.entrainment.common.model.SessionConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Session parameters tuned to a profile and an intention.
 *
 * @param coherenceTarget upper bound of the profile's optimal coherence range
 * @param limits          ceilings for the profile's level; {@code null} when the level is unknown
 */
public record OptimizedSessionPlan(
    @JsonProperty("intention")             SessionIntention intention,
    @JsonProperty("durationMinutes")       int durationMinutes,
    @JsonProperty("intensityLevel")        double intensityLevel,
    @JsonProperty("consciousnessJourney")  List<String> consciousnessJourney,
    @JsonProperty("primaryFocus")          String primaryFocus,
    @JsonProperty("coherenceTarget")       Double coherenceTarget,
    @JsonProperty("stabilityPreference")   String stabilityPreference,
    @JsonProperty("limits")                NeuralLoadLimit limits
) {
    public OptimizedSessionPlan {
        consciousnessJourney = List.copyOf(consciousnessJourney);
    }

    /** The plan as a configuration ready for validation. */
    public SessionConfiguration toConfiguration(String name) {
        return SessionConfiguration.of(name, durationMinutes, intensityLevel, consciousnessJourney);
    }
}
