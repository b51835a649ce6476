package com.entrainment.common.threshold;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NeuralLoadLimit;
import com.entrainment.common.model.SafetyBand;
import com.entrainment.common.model.SessionConfiguration;
import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a session against the limits of the user's experience level and the user's
 * health conditions.
 *
 * <h3>Checks</h3>
 * <ul>
 *   <li>duration, intensity, gamma exposure and journey length above the level's
 *       ceiling → {@code critical}</li>
 *   <li>absolute contraindication → {@code critical}</li>
 *   <li>relative contraindication → {@code warning}</li>
 *   <li>unknown experience level → a single {@code critical}; nothing else is checked</li>
 * </ul>
 *
 * <h3>Safety level</h3>
 * <pre>
 *   absolute contraindication     → EXTREME_RISK
 *   any other critical            → HIGH_RISK
 *   warnings only                 → LOW_RISK
 *   nothing                       → MINIMAL_RISK
 * </pre>
 *
 * <p>Missing numeric fields count as zero. Stateless; no logging.
 */
public final class SafetyComplianceChecker {

    public static final String CODE_UNKNOWN_LEVEL          = "UNKNOWN_EXPERIENCE_LEVEL";
    public static final String CODE_DURATION_LIMIT         = "LIMIT_DURATION";
    public static final String CODE_INTENSITY_LIMIT        = "LIMIT_INTENSITY";
    public static final String CODE_GAMMA_LIMIT            = "LIMIT_GAMMA_EXPOSURE";
    public static final String CODE_TRANSITION_LIMIT       = "LIMIT_TRANSITIONS";
    public static final String CODE_ABSOLUTE_CONTRAINDICATION = "CONTRAINDICATION_ABSOLUTE";
    public static final String CODE_RELATIVE_CONTRAINDICATION = "CONTRAINDICATION_RELATIVE";

    static final String HEALTH_CONDITIONS_PATH = "safety_profile.health_conditions";

    private SafetyComplianceChecker() {}

    /**
     * @param level            the user's level; {@code null} when it could not be resolved
     * @param healthConditions the user's declared conditions; may be empty
     */
    public static ComplianceReport check(SessionConfiguration config, ExperienceLevel level,
                                         List<String> healthConditions) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<String> modifications = new ArrayList<>();

        if (level == null) {
            issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, "safety_profile.experience_level",
                "Unknown experience level", null, "Use beginner, intermediate, advanced or expert",
                CODE_UNKNOWN_LEVEL));
            return new ComplianceReport(issues, SafetyLevel.HIGH_RISK, modifications, List.of());
        }

        NeuralLoadLimit limit = NeuralLoadLimits.forLevel(level);
        String levelName = level.wireName();

        double duration = config.durationMinutes() == null ? 0 : config.durationMinutes();
        if (exceeds(duration, limit.maxSessionDurationMinutes())) {
            String fix = "Reduce duration to " + limit.maxSessionDurationMinutes() + " minutes";
            issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, SessionConfiguration.DURATION_MINUTES,
                String.format(Locale.ROOT, "Session duration (%smin) exceeds limit for %s (%dmin)",
                    minutes(duration), levelName, limit.maxSessionDurationMinutes()),
                duration, fix, CODE_DURATION_LIMIT));
            modifications.add(fix);
        }

        double intensity = config.frequencyIntensity() == null ? 0.0 : config.frequencyIntensity();
        if (exceeds(intensity, limit.maxFrequencyIntensity())) {
            String fix = "Reduce intensity to " + percent(limit.maxFrequencyIntensity());
            issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, SessionConfiguration.FREQUENCY_INTENSITY,
                String.format(Locale.ROOT, "Frequency intensity (%s) exceeds limit for %s (%s)",
                    percent(intensity), levelName, percent(limit.maxFrequencyIntensity())),
                intensity, fix, CODE_INTENSITY_LIMIT));
            modifications.add(fix);
        }

        double gamma = config.gammaExposureMinutes() == null ? 0 : config.gammaExposureMinutes();
        if (exceeds(gamma, limit.maxGammaExposureMinutes())) {
            String fix = "Reduce gamma exposure to " + limit.maxGammaExposureMinutes() + " minutes";
            issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, SessionConfiguration.GAMMA_EXPOSURE_MINUTES,
                String.format(Locale.ROOT, "Gamma exposure (%smin) exceeds limit for %s (%dmin)",
                    minutes(gamma), levelName, limit.maxGammaExposureMinutes()),
                gamma, fix, CODE_GAMMA_LIMIT));
            modifications.add(fix);
        }

        // Every listed state counts as one transition into it.
        int transitions = config.journeyLength();
        if (exceeds(transitions, limit.maxStateTransitions())) {
            String fix = "Reduce transitions to " + limit.maxStateTransitions();
            issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, SessionConfiguration.CONSCIOUSNESS_JOURNEY,
                String.format(Locale.ROOT, "State transitions (%d) exceed limit for %s (%d)",
                    transitions, levelName, limit.maxStateTransitions()),
                transitions, fix, CODE_TRANSITION_LIMIT));
            modifications.add(fix);
        }

        boolean absolute = false;
        for (String condition : healthConditions) {
            switch (Contraindications.classify(condition)) {
                case ABSOLUTE -> {
                    absolute = true;
                    issues.add(new ValidationIssue(ValidationSeverity.CRITICAL, HEALTH_CONDITIONS_PATH,
                        "Absolute contraindication: " + condition, condition,
                        "Do not run entrainment sessions without medical clearance",
                        CODE_ABSOLUTE_CONTRAINDICATION));
                }
                case RELATIVE -> issues.add(new ValidationIssue(ValidationSeverity.WARNING, HEALTH_CONDITIONS_PATH,
                    "Relative contraindication: " + condition + " - proceed with caution", condition,
                    "Consult a healthcare provider before the session", CODE_RELATIVE_CONTRAINDICATION));
                default -> { /* precautions and unknown conditions raise nothing */ }
            }
        }

        return new ComplianceReport(issues, safetyLevel(issues, absolute), modifications, recommendations(limit));
    }

    public static List<String> recommendations(NeuralLoadLimit limit) {
        return List.of(
            "Use " + limit.recommendedBreakIntervalMinutes() + "-minute break intervals",
            "Extend integration time by " + limit.integrationTimeMultiplier() + "x",
            "Monitor user comfort continuously",
            "Have session termination protocol ready"
        );
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static boolean exceeds(double value, double ceiling) {
        return SafetyThresholdClassifier.classifyAgainstLimit(value, ceiling) == SafetyBand.DANGER;
    }

    private static SafetyLevel safetyLevel(List<ValidationIssue> issues, boolean absolute) {
        if (absolute) return SafetyLevel.EXTREME_RISK;
        boolean critical = issues.stream().anyMatch(i -> i.severity() == ValidationSeverity.CRITICAL);
        if (critical) return SafetyLevel.HIGH_RISK;
        return issues.isEmpty() ? SafetyLevel.MINIMAL_RISK : SafetyLevel.LOW_RISK;
    }

    /** {@code 200.0} prints as {@code 200}; fractional and very large values keep their decimal form. */
    static String minutes(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) return Long.toString((long) value);
        return Double.toString(value);
    }

    static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
