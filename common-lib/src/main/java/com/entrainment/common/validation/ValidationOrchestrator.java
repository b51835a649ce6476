package com.entrainment.common.validation;

import com.entrainment.common.biofield.BiofieldCoherence;
import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.load.NeuralLoadEstimator;
import com.entrainment.common.model.BiofieldConfiguration;
import com.entrainment.common.model.ConsciousnessState;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NeuralLoadLimit;
import com.entrainment.common.model.SafetyBand;
import com.entrainment.common.model.SessionConfiguration;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import com.entrainment.common.profile.NeuralProfile;
import com.entrainment.common.schema.SchemaValidator;
import com.entrainment.common.schema.SessionSchemas;
import com.entrainment.common.threshold.ComplianceReport;
import com.entrainment.common.threshold.NeuralLoadLimits;
import com.entrainment.common.threshold.SafetyComplianceChecker;
import com.entrainment.common.threshold.SafetyThresholdClassifier;
import com.entrainment.common.threshold.SafetyThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Runs every check over a session configuration and folds the findings into one
 * {@link ValidationResult}.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>schema of the raw map</li>
 *   <li>journey states and transitions</li>
 *   <li>biofield coherence metadata</li>
 *   <li>global threshold bands for duration and intensity</li>
 *   <li>experience-level limits and contraindications, when a profile is supplied</li>
 *   <li>neural load, always attached as metadata</li>
 * </ol>
 *
 * <p>Every stage runs regardless of earlier findings, so one pass surfaces all problems.
 * Inputs are never modified. Instances hold only immutable state and may be shared.
 */
public final class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    public static final String META_NEURAL_LOAD        = "neural_load";
    public static final String META_NEURAL_LOAD_BAND   = "neural_load_band";
    public static final String META_OVERALL_COHERENCE  = "overall_coherence";
    public static final String META_COHERENCE_LEVEL    = "coherence_level";
    public static final String META_BRAINWAVE_RANGE    = "brainwave_range";
    public static final String META_EXPERIENCE_LEVEL   = "experience_level";
    public static final String META_BREAK_MINUTES      = "recommended_break_minutes";

    public static final String CODE_THRESHOLD_WARNING  = "THRESHOLD_WARNING_BAND";
    public static final String CODE_THRESHOLD_DANGER   = "THRESHOLD_DANGER_BAND";
    public static final String CODE_HIGH_LOAD          = "NEURAL_LOAD_HIGH";
    public static final String CODE_LOAD_ABOVE_LEVEL   = "NEURAL_LOAD_ABOVE_LEVEL";

    static final double ABSENT_BIOFIELD_COMPONENT = 0.5;

    private final ConsciousnessStateGraph graph;
    private final JourneyValidator journeyValidator;
    private final boolean strict;

    public ValidationOrchestrator(ConsciousnessStateGraph graph, boolean strict) {
        this.graph = graph;
        this.journeyValidator = new JourneyValidator(graph);
        this.strict = strict;
    }

    /** Lenient orchestrator over the built-in state graph. */
    public static ValidationOrchestrator standard() {
        return new ValidationOrchestrator(ConsciousnessStateGraph.defaultGraph(), false);
    }

    public boolean isStrict() {
        return strict;
    }

    public ValidationResult validate(SessionConfiguration config, NeuralProfile profile) {
        return validate(config.toMap(), profile, strict);
    }

    public ValidationResult validate(Map<String, ?> rawConfig, NeuralProfile profile) {
        return validate(rawConfig, profile, strict);
    }

    /**
     * @param rawConfig  a {@code null} configuration is validated as an empty one
     * @param profile    may be {@code null}; profile-aware checks are skipped then
     * @param strictMode report journey warnings as errors
     */
    public ValidationResult validate(Map<String, ?> rawConfig, NeuralProfile profile, boolean strictMode) {
        Map<String, ?> raw = rawConfig == null ? Map.of() : rawConfig;
        ValidationResult.Builder result = ValidationResult.builder();
        result.addAll(SchemaValidator.validate(raw, SessionSchemas.SESSION_CONFIGURATION));

        SessionConfiguration config = SessionConfiguration.fromMap(raw);
        ExperienceLevel level = profile == null ? null : profile.experienceLevel();

        // An absent or empty journey is already reported by the schema pass.
        if (!config.consciousnessJourney().isEmpty()) {
            ExperienceLevel transitionLevel = level == null ? ExperienceLevel.BEGINNER : level;
            result.addAll(journeyValidator
                .validateJourney(config.consciousnessJourney(), transitionLevel, strictMode).issues());
        }

        if (config.biofieldConfiguration() != null) {
            attachCoherence(config.biofieldConfiguration(), result);
        }

        classifyGlobal(SessionConfiguration.DURATION_MINUTES, SafetyThresholds.SESSION_DURATION,
            config.durationMinutes(), result);
        classifyGlobal(SessionConfiguration.FREQUENCY_INTENSITY, SafetyThresholds.FREQUENCY_INTENSITY,
            config.frequencyIntensity(), result);

        if (profile != null) {
            ComplianceReport compliance = SafetyComplianceChecker.check(config, level, profile.healthConditions());
            result.addAll(compliance.issues());
            if (level != null) {
                NeuralLoadLimit limit = NeuralLoadLimits.forLevel(level);
                result.metadata(META_EXPERIENCE_LEVEL, level.wireName());
                result.metadata(META_BREAK_MINUTES, limit.recommendedBreakIntervalMinutes());
            }
            String band = deepestBand(config);
            if (band != null) {
                result.metadata(META_BRAINWAVE_RANGE, band);
            }
        }

        double load = NeuralLoadEstimator.estimate(config);
        result.metadata(META_NEURAL_LOAD, load);
        result.metadata(META_NEURAL_LOAD_BAND, SafetyThresholdClassifier
            .classify(load, SafetyThresholds.get(SafetyThresholds.NEURAL_LOAD_INDEX)).wireName());
        if (load > NeuralLoadEstimator.HIGH_LOAD) {
            result.add(ValidationSeverity.WARNING, META_NEURAL_LOAD,
                "High neural load detected: " + percent(load), load,
                "Consider reducing session complexity or intensity", CODE_HIGH_LOAD);
        }
        if (level != null) {
            double maxLoad = NeuralLoadLimits.forLevel(level).maxNeuralLoad();
            if (load > maxLoad) {
                result.add(ValidationSeverity.WARNING, META_NEURAL_LOAD,
                    "Neural load " + percent(load) + " exceeds " + level.wireName() + " maximum " + percent(maxLoad),
                    load, "Shorten the session or lower its intensity", CODE_LOAD_ABOVE_LEVEL);
            }
        }

        ValidationResult built = result.build();
        log.debug("Validated session '{}' valid={} safe={} issues={} load={}",
            config.name(), built.isValid(), built.isSafe(), built.issues().size(), load);
        return built;
    }

    // ── stages ───────────────────────────────────────────────────────────────

    private static void attachCoherence(BiofieldConfiguration biofield, ValidationResult.Builder result) {
        double overall = BiofieldCoherence.calculate(
            orAbsent(biofield.schumannAlignment()),
            orAbsent(biofield.solfeggioIntegration()),
            orAbsent(biofield.goldenRatioHarmonics()));
        result.metadata(META_OVERALL_COHERENCE, overall);
        result.metadata(META_COHERENCE_LEVEL, BiofieldCoherence.levelFor(overall).wireName());
    }

    private static void classifyGlobal(String field, String thresholdKey, Number value,
                                       ValidationResult.Builder result) {
        if (value == null) return;
        double v = value.doubleValue();
        SafetyBand band = SafetyThresholdClassifier.classify(v, SafetyThresholds.get(thresholdKey));
        if (band == SafetyBand.SAFE) return;
        String name = SafetyThresholds.get(thresholdKey).parameterName();
        boolean danger = band == SafetyBand.DANGER;
        result.add(ValidationSeverity.WARNING, field,
            name + " is in the " + band.wireName() + " band: " + value, value,
            danger ? "Bring " + field + " back into the safe range" : "Monitor closely during the session",
            danger ? CODE_THRESHOLD_DANGER : CODE_THRESHOLD_WARNING);
    }

    private String deepestBand(SessionConfiguration config) {
        ConsciousnessState deepest = null;
        for (String id : config.consciousnessJourney()) {
            ConsciousnessState state = graph.stateInfo(id);
            if (state != null && (deepest == null || state.depth() > deepest.depth())) {
                deepest = state;
            }
        }
        return deepest == null ? null : deepest.dominantBand();
    }

    private static double orAbsent(Double component) {
        return component == null ? ABSENT_BIOFIELD_COMPONENT : component;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
