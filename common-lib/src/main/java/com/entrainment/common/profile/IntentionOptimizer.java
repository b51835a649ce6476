package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.threshold.NeuralLoadLimits;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives session parameters from a profile for a given intention.
 *
 * <pre>
 *   journey   = neutral → intention states the profile knows → neutral
 *               (neutral → deep_relaxation → neutral when it knows none)
 *   intensity = profile intensity for the focus band (0.5 when absent) × intensity modifier
 *   duration  = ⌊preferred duration × duration modifier⌋
 * </pre>
 */
public final class IntentionOptimizer {

    static final double DEFAULT_BASE_INTENSITY = 0.5;

    private static final List<String> FALLBACK_JOURNEY = List.of("neutral", "deep_relaxation", "neutral");

    private IntentionOptimizer() {}

    public static OptimizedSessionPlan optimize(NeuralProfile profile, SessionIntention intention) {
        List<String> known = intention.preferredStates().stream()
            .filter(profile.statePreferences()::containsKey)
            .toList();
        List<String> journey;
        if (known.isEmpty()) {
            journey = FALLBACK_JOURNEY;
        } else {
            journey = new ArrayList<>();
            journey.add("neutral");
            journey.addAll(known);
            journey.add("neutral");
        }

        BrainwavePreference focus = profile.brainwavePreferences().get(intention.frequencyFocus());
        double baseIntensity = focus == null ? DEFAULT_BASE_INTENSITY : focus.preferredIntensity();
        int duration = (int) (profile.preferredSessionDurationMinutes() * intention.durationModifier());

        BiofieldProfile biofield = profile.biofieldProfile();
        Double coherenceTarget = biofield == null || biofield.optimalCoherenceRange() == null
            ? null : biofield.optimalCoherenceRange().upper();
        String stability = biofield == null ? null : biofield.fieldStability();

        ExperienceLevel level = profile.experienceLevel();
        return new OptimizedSessionPlan(intention, duration, baseIntensity * intention.intensityModifier(),
            journey, intention.biofieldEmphasis(), coherenceTarget, stability,
            level == null ? null : NeuralLoadLimits.forLevel(level));
    }
}
