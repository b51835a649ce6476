package com.entrainment.common.load;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.SessionConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Judges whether the user is ready for a proposed session right now.
 *
 * <h3>Scoring</h3>
 * Starts at 1.0 and is multiplied down by each concern:
 * <pre>
 *   session complexity above level ceiling   × 0.7
 *   previous session less than 24 h ago      × 0.9
 *   current stress above 0.7                 × 0.8
 * </pre>
 * Ready when the score is at least {@value #READY_THRESHOLD}. Complexity is the
 * {@link NeuralLoadEstimator} load; ceilings are 0.4 / 0.6 / 0.8 / 1.0 by level.
 * An unknown level is treated as beginner.
 */
public final class ReadinessAssessor {

    public static final double READY_THRESHOLD = 0.6;

    static final double COMPLEXITY_PENALTY  = 0.7;
    static final double RECENT_PENALTY      = 0.9;
    static final double STRESS_PENALTY      = 0.8;
    static final double MIN_REST_HOURS      = 24.0;
    static final double HIGH_STRESS         = 0.7;

    private static final double[] MAX_COMPLEXITY = { 0.4, 0.6, 0.8, 1.0 };

    private ReadinessAssessor() {}

    /** Highest session complexity recommended for a level. */
    public static double maxComplexity(ExperienceLevel level) {
        return MAX_COMPLEXITY[level == null ? 0 : level.index()];
    }

    public static ReadinessReport assess(ReadinessContext context, SessionConfiguration config) {
        List<String> concerns      = new ArrayList<>();
        List<String> preparations  = new ArrayList<>();
        List<String> modifications = new ArrayList<>();
        double score = 1.0;

        ExperienceLevel level = context.experienceLevel() == null
            ? ExperienceLevel.BEGINNER : context.experienceLevel();
        double complexity = NeuralLoadEstimator.estimate(config);
        double ceiling    = maxComplexity(level);

        if (complexity > ceiling) {
            concerns.add(String.format(Locale.ROOT,
                "Session complexity (%.1f%%) exceeds recommended level for %s (%.1f%%)",
                complexity * 100, level.wireName(), ceiling * 100));
            modifications.add("Reduce session complexity or gain more experience");
            score *= COMPLEXITY_PENALTY;
        }

        Double hours = context.hoursSinceLastSession();
        if (hours != null && hours < MIN_REST_HOURS) {
            concerns.add(String.format(Locale.ROOT,
                "Recent session %s hours ago - consider rest period", trim(hours)));
            preparations.add("Ensure adequate rest between sessions");
            score *= RECENT_PENALTY;
        }

        Double stress = context.currentStressLevel();
        if (stress != null && stress > HIGH_STRESS) {
            concerns.add("High current stress level - may affect session quality");
            preparations.add("Consider stress reduction before session");
            score *= STRESS_PENALTY;
        }

        return new ReadinessReport(score >= READY_THRESHOLD, score, complexity,
            concerns, preparations, modifications);
    }

    private static String trim(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }
}
