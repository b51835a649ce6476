package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Usage history. The favorite and challenging lists hold at most {@value #MAX_STATE_LIST}
 * entries and the outcome log at most {@value #MAX_RECENT_OUTCOMES}; the oldest entry is
 * evicted first.
 */
public record SessionHistory(
    @JsonProperty("total_sessions")          int totalSessions,
    @JsonProperty("total_hours")             double totalHours,
    @JsonProperty("favorite_states")         List<String> favoriteStates,
    @JsonProperty("challenging_states")      List<String> challengingStates,
    @JsonProperty("average_comfort_level")   double averageComfortLevel,
    @JsonProperty("progress_metrics")        Map<String, Double> progressMetrics,
    @JsonProperty("recent_session_outcomes") List<SessionRecord> recentSessionOutcomes
) {
    public static final int MAX_STATE_LIST      = 5;
    public static final int MAX_RECENT_OUTCOMES = 10;

    public SessionHistory {
        favoriteStates        = favoriteStates == null ? List.of() : List.copyOf(favoriteStates);
        challengingStates     = challengingStates == null ? List.of() : List.copyOf(challengingStates);
        progressMetrics       = progressMetrics == null ? Map.of() : Map.copyOf(progressMetrics);
        recentSessionOutcomes = recentSessionOutcomes == null ? List.of() : List.copyOf(recentSessionOutcomes);
    }

    public static SessionHistory empty() {
        return new SessionHistory(0, 0.0, List.of(), List.of(), 0.0, Map.of(), List.of());
    }
}
