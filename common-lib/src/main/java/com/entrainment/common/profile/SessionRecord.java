package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** One entry of the bounded recent-outcome log kept in {@link SessionHistory}. */
public record SessionRecord(
    @JsonProperty("date")             Instant date,
    @JsonProperty("duration_minutes") int durationMinutes,
    @JsonProperty("comfort_level")    double comfortLevel,
    @JsonProperty("effectiveness")    double effectiveness,
    @JsonProperty("states_explored")  List<String> statesExplored,
    @JsonProperty("notes")            String notes
) {
    public SessionRecord {
        statesExplored = statesExplored == null ? List.of() : List.copyOf(statesExplored);
        notes = notes == null ? "" : notes;
    }
}
