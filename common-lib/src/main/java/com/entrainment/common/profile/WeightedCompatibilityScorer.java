package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Default {@link CompatibilityScorer} using fixed component weights.
 *
 * <h3>Sub-scores</h3>
 * <pre>
 *   brainwave = mean over shared bands of  1 − |intensityₐ − intensity_b|      (0 when none shared)
 *   states    = mean over shared states of 1 − |affinityₐ − affinity_b|        (0 when none shared)
 *   biofield  = mean of 1 − |Δ| for coherence baseline, Schumann sensitivity, golden-ratio harmony
 *   session   = mean of 1 − min(1, |Δduration| / 60) and time-of-day (1.0 same, 0.5 different)
 *   safety    = 1 − |levelₐ − level_b| / 4, × 0.8 when either profile declares a health condition
 * </pre>
 *
 * <h3>Overall</h3>
 * <pre>
 *   overall = 0.25·brainwave + 0.25·states + 0.20·biofield + 0.15·session + 0.15·safety
 * </pre>
 *
 * <p>The health penalty deliberately departs from a "shared conditions only" rule: it
 * fires on the union of both profiles' conditions, so a condition only one profile
 * carries also reduces safety compatibility. The usual pairing of a profile with
 * epilepsy against a healthy one must score below a perfect match, which an
 * intersection would not do. The multiplier is applied once. An unknown experience
 * level counts as beginner. Stateless and thread-safe.
 */
public class WeightedCompatibilityScorer implements CompatibilityScorer {

    static final double BRAINWAVE_WEIGHT = 0.25;
    static final double STATES_WEIGHT    = 0.25;
    static final double BIOFIELD_WEIGHT  = 0.20;
    static final double SESSION_WEIGHT   = 0.15;
    static final double SAFETY_WEIGHT    = 0.15;

    static final double HEALTH_CONDITION_PENALTY = 0.8;
    static final double DURATION_SPAN_MINUTES    = 60.0;
    static final double TIME_OF_DAY_MISMATCH     = 0.5;

    @Override
    public CompatibilityScore score(NeuralProfile first, NeuralProfile second) {
        double brainwave = sharedSimilarity(first.brainwavePreferences(), second.brainwavePreferences(),
            BrainwavePreference::preferredIntensity);
        double states = sharedSimilarity(first.statePreferences(), second.statePreferences(),
            StatePreference::affinityLevel);
        double biofield = biofield(first.biofieldProfile(), second.biofieldProfile());
        double session  = session(first, second);
        double safety   = safety(first, second);

        double overall = BRAINWAVE_WEIGHT * brainwave
                       + STATES_WEIGHT    * states
                       + BIOFIELD_WEIGHT  * biofield
                       + SESSION_WEIGHT   * session
                       + SAFETY_WEIGHT    * safety;

        return new CompatibilityScore(clamp01(overall), brainwave, states, biofield, session, safety);
    }

    // ── sub-scores ───────────────────────────────────────────────────────────

    private static <P> double sharedSimilarity(Map<String, P> a, Map<String, P> b, ToDoubleFunction<P> value) {
        double total = 0.0;
        int shared = 0;
        for (Map.Entry<String, P> entry : a.entrySet()) {
            P other = b.get(entry.getKey());
            if (other == null) continue;
            total += similarity(value.applyAsDouble(entry.getValue()), value.applyAsDouble(other));
            shared++;
        }
        return shared == 0 ? 0.0 : total / shared;
    }

    private static double biofield(BiofieldProfile a, BiofieldProfile b) {
        if (a == null || b == null) return 0.0;
        return (similarity(a.coherenceBaseline(), b.coherenceBaseline())
              + similarity(a.schumannResonanceSensitivity(), b.schumannResonanceSensitivity())
              + similarity(a.goldenRatioHarmonyLevel(), b.goldenRatioHarmonyLevel())) / 3.0;
    }

    private static double session(NeuralProfile a, NeuralProfile b) {
        double gap = Math.abs(a.preferredSessionDurationMinutes() - b.preferredSessionDurationMinutes());
        double duration = 1.0 - Math.min(1.0, gap / DURATION_SPAN_MINUTES);
        double timeOfDay = Objects.equals(a.optimalTimeOfDay(), b.optimalTimeOfDay()) ? 1.0 : TIME_OF_DAY_MISMATCH;
        return (duration + timeOfDay) / 2.0;
    }

    private static double safety(NeuralProfile a, NeuralProfile b) {
        int levelGap = Math.abs(levelIndex(a.experienceLevel()) - levelIndex(b.experienceLevel()));
        double score = 1.0 - (double) levelGap / ExperienceLevel.LEVEL_COUNT;
        if (carriesHealthCondition(a.healthConditions(), b.healthConditions())) {
            score *= HEALTH_CONDITION_PENALTY;
        }
        return score;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    /** True when the profiles share a condition or either carries one the other lacks. */
    private static boolean carriesHealthCondition(List<String> a, List<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return !union.isEmpty();
    }

    private static int levelIndex(ExperienceLevel level) {
        return level == null ? 0 : level.index();
    }

    private static double similarity(double a, double b) {
        return clamp01(1.0 - Math.abs(a - b));
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
