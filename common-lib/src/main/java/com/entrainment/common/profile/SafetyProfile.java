package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health and experience information that gates what a user may run.
 *
 * <p>{@code experienceLevel} is {@code null} when the stored value did not name a known
 * level; validation reports it instead of guessing.
 */
public record SafetyProfile(
    @JsonProperty("experience_level")       ExperienceLevel experienceLevel,
    @JsonProperty("health_conditions")      List<String> healthConditions,
    @JsonProperty("medications")            List<String> medications,
    @JsonProperty("contraindications")      List<String> contraindications,
    @JsonProperty("comfort_preferences")    Map<String, Object> comfortPreferences,
    @JsonProperty("emergency_contacts")     List<Map<String, String>> emergencyContacts,
    @JsonProperty("special_considerations") List<String> specialConsiderations
) {
    public SafetyProfile {
        healthConditions      = healthConditions == null ? List.of() : List.copyOf(healthConditions);
        medications           = medications == null ? List.of() : List.copyOf(medications);
        contraindications     = contraindications == null ? List.of() : List.copyOf(contraindications);
        comfortPreferences    = comfortPreferences == null
            ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(comfortPreferences));
        emergencyContacts     = emergencyContacts == null ? List.of() : List.copyOf(emergencyContacts);
        specialConsiderations = specialConsiderations == null ? List.of() : List.copyOf(specialConsiderations);
    }

    public static SafetyProfile forLevel(ExperienceLevel level) {
        return new SafetyProfile(level, List.of(), List.of(), List.of(), Map.of(), List.of(), List.of());
    }

    public SafetyProfile withHealthConditions(List<String> conditions) {
        return new SafetyProfile(experienceLevel, conditions, medications, contraindications, comfortPreferences,
            emergencyContacts, specialConsiderations);
    }

    /** Copy with health conditions, medications and emergency contacts removed. */
    public SafetyProfile withoutSensitiveData() {
        return new SafetyProfile(experienceLevel, List.of(), List.of(), contraindications, comfortPreferences,
            List.of(), specialConsiderations);
    }
}
