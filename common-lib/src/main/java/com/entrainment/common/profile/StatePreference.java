package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param affinityLevel how much the user enjoys the state, in [0,1]
 */
public record StatePreference(
    @JsonProperty("state_name")               String stateName,
    @JsonProperty("affinity_level")           double affinityLevel,
    @JsonProperty("optimal_duration_minutes") int optimalDurationMinutes,
    @JsonProperty("preparation_time_needed")  int preparationTimeNeeded,
    @JsonProperty("integration_time_needed")  int integrationTimeNeeded,
    @JsonProperty("response_notes")           String responseNotes
) {
    public StatePreference {
        responseNotes = responseNotes == null ? "" : responseNotes;
    }

    public StatePreference withAffinityLevel(double affinity) {
        return new StatePreference(stateName, affinity, optimalDurationMinutes, preparationTimeNeeded,
            integrationTimeNeeded, responseNotes);
    }
}
