package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-lived, per-user neural profile.
 *
 * <p>Immutable. Updates produce a new instance through the {@code with*} methods, so a
 * profile shared between threads needs no locking. {@code schemaVersion} identifies the
 * serialized layout and is checked once by {@link ProfileCodec} on import.
 *
 * @param preferredSessionDurationMinutes duration the user usually asks for
 * @param optimalTimeOfDay                {@code morning | afternoon | evening | night}
 */
public record NeuralProfile(
    @JsonProperty("schema_version")              int schemaVersion,
    @JsonProperty("profile_id")                  String profileId,
    @JsonProperty("name")                        String name,
    @JsonProperty("profile_type")                ProfileType profileType,
    @JsonProperty("created_date")                Instant createdDate,
    @JsonProperty("last_updated")                Instant lastUpdated,
    @JsonProperty("dominant_brainwave_pattern")  String dominantBrainwavePattern,
    @JsonProperty("neural_sensitivity")          SensitivityLevel neuralSensitivity,
    @JsonProperty("brainwave_preferences")       Map<String, BrainwavePreference> brainwavePreferences,
    @JsonProperty("state_preferences")           Map<String, StatePreference> statePreferences,
    @JsonProperty("biofield_profile")            BiofieldProfile biofieldProfile,
    @JsonProperty("safety_profile")              SafetyProfile safetyProfile,
    @JsonProperty("session_history")             SessionHistory sessionHistory,
    @JsonProperty("preferred_session_duration")  int preferredSessionDurationMinutes,
    @JsonProperty("optimal_time_of_day")         String optimalTimeOfDay,
    @JsonProperty("environmental_preferences")   Map<String, Object> environmentalPreferences,
    @JsonProperty("integration_preferences")     Map<String, Object> integrationPreferences
) {
    public static final int CURRENT_SCHEMA_VERSION = 2;

    public NeuralProfile {
        brainwavePreferences     = ordered(brainwavePreferences);
        statePreferences         = ordered(statePreferences);
        environmentalPreferences = ordered(environmentalPreferences);
        integrationPreferences   = ordered(integrationPreferences);
    }

    // ── convenience views ───────────────────────────────────────────────────

    /** Experience level from the safety profile; {@code null} when absent or unknown. */
    @JsonIgnore
    public ExperienceLevel experienceLevel() {
        return safetyProfile == null ? null : safetyProfile.experienceLevel();
    }

    @JsonIgnore
    public List<String> healthConditions() {
        return safetyProfile == null ? List.of() : safetyProfile.healthConditions();
    }

    // ── copy-on-write updates ───────────────────────────────────────────────

    public NeuralProfile withProfileType(ProfileType type) {
        return new NeuralProfile(schemaVersion, profileId, name, type, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withLastUpdated(Instant updated) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, updated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withBrainwavePreferences(Map<String, BrainwavePreference> preferences) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, preferences, statePreferences, biofieldProfile,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withStatePreferences(Map<String, StatePreference> preferences) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, preferences, biofieldProfile,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withBiofieldProfile(BiofieldProfile biofield) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofield,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withSafetyProfile(SafetyProfile safety) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safety, sessionHistory, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withSessionHistory(SessionHistory history) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safetyProfile, history, preferredSessionDurationMinutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withPreferredSessionDuration(int minutes) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safetyProfile, sessionHistory, minutes, optimalTimeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    public NeuralProfile withOptimalTimeOfDay(String timeOfDay) {
        return new NeuralProfile(schemaVersion, profileId, name, profileType, createdDate, lastUpdated,
            dominantBrainwavePattern, neuralSensitivity, brainwavePreferences, statePreferences, biofieldProfile,
            safetyProfile, sessionHistory, preferredSessionDurationMinutes, timeOfDay,
            environmentalPreferences, integrationPreferences);
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
