package com.entrainment.common.profile;

import com.entrainment.common.graph.BrainwaveBands;
import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NeuralLoadLimit;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import com.entrainment.common.threshold.Contraindications;
import com.entrainment.common.threshold.NeuralLoadLimits;

import java.util.Map;

/**
 * Checks a neural profile for consistency and safety concerns.
 *
 * <ul>
 *   <li>error: missing id or name, intensity outside [0,1], coherence baseline outside
 *       [0,1], unknown experience level</li>
 *   <li>critical: absolute contraindication</li>
 *   <li>warning: unknown band or state, state duration outside 1 – 120 minutes,
 *       preferred duration above the level's limit, relative contraindication</li>
 *   <li>info: suggestions to explore more bands or states, or to personalize a
 *       well-used beginner profile</li>
 * </ul>
 */
public final class ProfileValidator {

    static final int MIN_STATE_MINUTES = 1;
    static final int MAX_STATE_MINUTES = 120;

    private ProfileValidator() {}

    public static ValidationResult validate(NeuralProfile profile) {
        ValidationResult.Builder result = ValidationResult.builder();
        ConsciousnessStateGraph graph = ConsciousnessStateGraph.defaultGraph();

        if (isBlank(profile.profileId()) || isBlank(profile.name())) {
            result.add(ValidationSeverity.ERROR, "profile_id", "Missing required profile identification",
                null, "Provide both a profile id and a name", "PROFILE_IDENTITY");
        }

        for (Map.Entry<String, BrainwavePreference> entry : profile.brainwavePreferences().entrySet()) {
            String band = entry.getKey();
            String path = "brainwave_preferences." + band;
            if (!BrainwaveBands.isKnown(band)) {
                result.add(ValidationSeverity.WARNING, path, "Unknown brainwave frequency: " + band,
                    band, "", "PROFILE_UNKNOWN_BAND");
            }
            double intensity = entry.getValue().preferredIntensity();
            if (!(intensity >= 0.0 && intensity <= 1.0)) {
                result.add(ValidationSeverity.ERROR, path + ".preferred_intensity",
                    "Invalid intensity for " + band + ": " + intensity, intensity, "", "PROFILE_INTENSITY");
            }
        }

        for (Map.Entry<String, StatePreference> entry : profile.statePreferences().entrySet()) {
            String state = entry.getKey();
            String path = "state_preferences." + state;
            if (!graph.isKnownState(state)) {
                result.add(ValidationSeverity.WARNING, path, "Unknown consciousness state: " + state,
                    state, "", "PROFILE_UNKNOWN_STATE");
            }
            int minutes = entry.getValue().optimalDurationMinutes();
            if (minutes < MIN_STATE_MINUTES || minutes > MAX_STATE_MINUTES) {
                result.add(ValidationSeverity.WARNING, path + ".optimal_duration_minutes",
                    "Unusual duration for " + state + ": " + minutes + "min", minutes, "", "PROFILE_STATE_DURATION");
            }
        }

        BiofieldProfile biofield = profile.biofieldProfile();
        if (biofield != null && !(biofield.coherenceBaseline() >= 0.0 && biofield.coherenceBaseline() <= 1.0)) {
            result.add(ValidationSeverity.ERROR, "biofield_profile.coherence_baseline",
                "Invalid coherence baseline: " + biofield.coherenceBaseline(), biofield.coherenceBaseline(),
                "", "PROFILE_COHERENCE_BASELINE");
        }

        ExperienceLevel level = profile.experienceLevel();
        if (level == null) {
            result.add(ValidationSeverity.ERROR, "safety_profile.experience_level",
                "Invalid experience level", null, "Use beginner, intermediate, advanced or expert",
                "PROFILE_EXPERIENCE_LEVEL");
        } else {
            NeuralLoadLimit limit = NeuralLoadLimits.forLevel(level);
            if (profile.preferredSessionDurationMinutes() > limit.maxSessionDurationMinutes()) {
                result.add(ValidationSeverity.WARNING, "preferred_session_duration",
                    "Preferred duration (" + profile.preferredSessionDurationMinutes() + "min) exceeds safe limit for "
                        + level.wireName() + " (" + limit.maxSessionDurationMinutes() + "min)",
                    profile.preferredSessionDurationMinutes(),
                    "Reduce preferred duration to " + limit.maxSessionDurationMinutes() + " minutes",
                    "PROFILE_DURATION_LIMIT");
            }
        }

        for (String condition : profile.healthConditions()) {
            switch (Contraindications.classify(condition)) {
                case ABSOLUTE -> result.add(ValidationSeverity.CRITICAL, "safety_profile.health_conditions",
                    "Absolute contraindication: " + condition, condition, "", "CONTRAINDICATION_ABSOLUTE");
                case RELATIVE -> result.add(ValidationSeverity.WARNING, "safety_profile.health_conditions",
                    "Relative contraindication: " + condition, condition, "", "CONTRAINDICATION_RELATIVE");
                default -> { /* precautions are informational only */ }
            }
        }

        if (profile.brainwavePreferences().size() < 3) {
            recommend(result, "brainwave_preferences", "Consider exploring more brainwave frequencies");
        }
        if (profile.statePreferences().size() < 2) {
            recommend(result, "state_preferences", "Consider exploring additional consciousness states");
        }
        SessionHistory history = profile.sessionHistory();
        if (history != null && history.totalSessions() > 10 && profile.profileType() == ProfileType.BEGINNER) {
            recommend(result, "profile_type", "Consider upgrading to personalized profile type");
        }
        return result.build();
    }

    private static void recommend(ValidationResult.Builder result, String path, String recommendation) {
        result.add(ValidationSeverity.INFO, path, recommendation, null, recommendation, "PROFILE_RECOMMENDATION");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
