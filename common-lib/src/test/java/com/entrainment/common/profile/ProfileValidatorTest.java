package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProfileValidatorTest {

    private static List<String> codes(ValidationResult result) {
        return result.issues().stream().map(ValidationIssue::code).toList();
    }

    @Test
    @DisplayName("default intermediate profile → no issues")
    void cleanDefault() {
        ValidationResult result = ProfileValidator.validate(ProfileFixtures.profile("Ada", ExperienceLevel.INTERMEDIATE));
        assertTrue(result.issues().isEmpty(), () -> result.issues().toString());
    }

    @Test
    @DisplayName("unknown level → error")
    void unknownLevel() {
        ValidationResult result = ProfileValidator.validate(ProfileFixtures.profile("Ada", null));
        assertEquals(List.of("PROFILE_EXPERIENCE_LEVEL"), codes(result));
        assertFalse(result.isValid());
    }

    @Test
    @DisplayName("preferred duration above the beginner limit → warning")
    void durationLimit() {
        NeuralProfile profile = ProfileFixtures.profile("Ada", ExperienceLevel.BEGINNER).withPreferredSessionDuration(45);
        assertEquals(List.of("PROFILE_DURATION_LIMIT"), codes(ProfileValidator.validate(profile)));
    }

    @Test
    @DisplayName("absolute contraindication → critical, relative → warning, precaution → nothing")
    void contraindications() {
        NeuralProfile profile = ProfileFixtures.withConditions(
            ProfileFixtures.profile("Ada", ExperienceLevel.EXPERT),
            "active_seizure_disorder", "severe_anxiety_disorder", "sleep_disorders");

        ValidationResult result = ProfileValidator.validate(profile);

        assertEquals(1, result.count(ValidationSeverity.CRITICAL));
        assertEquals(1, result.count(ValidationSeverity.WARNING));
        assertFalse(result.isSafe());
    }

    @Test
    @DisplayName("unknown band and state, bad intensity and narrow preferences")
    void preferenceChecks() {
        NeuralProfile base = ProfileFixtures.profile("Ada", ExperienceLevel.ADVANCED);
        NeuralProfile profile = base
            .withBrainwavePreferences(Map.of("zeta", new BrainwavePreference("zeta", 1.4, null, "poor", "")))
            .withStatePreferences(Map.of("astral", new StatePreference("astral", 0.5, 200, 5, 5, "")));

        List<String> codes = codes(ProfileValidator.validate(profile));

        assertTrue(codes.containsAll(List.of("PROFILE_UNKNOWN_BAND", "PROFILE_INTENSITY",
            "PROFILE_UNKNOWN_STATE", "PROFILE_STATE_DURATION")));
        assertEquals(2, codes.stream().filter("PROFILE_RECOMMENDATION"::equals).count());
    }
}
