package com.entrainment.common.validation;

import com.entrainment.common.load.NeuralLoadEstimator;
import com.entrainment.common.load.ReadinessAssessor;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.SessionConfiguration;
import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import com.entrainment.common.schema.SchemaValidator;
import com.entrainment.common.schema.SessionSchemas;

import java.util.Locale;
import java.util.Map;

/**
 * Validates a shareable session preset: its own fields, the embedded base configuration,
 * and whether the configuration suits the experience level the preset targets.
 *
 * <p>Issues found in the base configuration carry the {@code base_configuration.} prefix.
 */
public final class PresetValidator {

    public static final String BASE_CONFIGURATION = "base_configuration";
    public static final String CODE_TOO_COMPLEX   = "PRESET_TOO_COMPLEX";

    private final ValidationOrchestrator orchestrator;

    public PresetValidator(ValidationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public ValidationResult validate(Map<String, ?> preset) {
        ValidationResult.Builder result = ValidationResult.builder();
        result.addAll(SchemaValidator.validate(preset, SessionSchemas.PRESET));

        if (!(preset.get(BASE_CONFIGURATION) instanceof Map<?, ?> rawBase)) {
            return result.build();
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> base = (Map<String, ?>) rawBase;

        ValidationResult baseResult = orchestrator.validate(base, null);
        for (ValidationIssue issue : baseResult.issues()) {
            result.add(issue.withFieldPath(BASE_CONFIGURATION + "." + issue.fieldPath()));
        }
        result.mergeMetadata(baseResult.metadata());

        ExperienceLevel level = preset.get("experience_level") instanceof String s ? ExperienceLevel.fromName(s) : null;
        if (level != null) {
            double complexity = NeuralLoadEstimator.estimate(SessionConfiguration.fromMap(base));
            if (complexity > ReadinessAssessor.maxComplexity(level)) {
                result.add(ValidationSeverity.WARNING, "experience_compatibility",
                    String.format(Locale.ROOT, "Preset complexity (%.1f%%) may be too high for %s users",
                        complexity * 100, level.wireName()),
                    complexity, "Consider reducing complexity or changing experience level requirement",
                    CODE_TOO_COMPLEX);
            }
        }
        return result.build();
    }
}
