package com.entrainment.common.validation;

import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.schema.SchemaValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PresetValidatorTest {

    private final PresetValidator validator = new PresetValidator(ValidationOrchestrator.standard());

    private static Map<String, Object> preset(int duration, double intensity) {
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("name", "Evening Calm");
        base.put("duration_minutes", duration);
        base.put("frequency_intensity", intensity);
        base.put("consciousness_journey", List.of("neutral", "deep_relaxation", "neutral"));

        Map<String, Object> preset = new LinkedHashMap<>();
        preset.put("preset_id", "evening_calm");
        preset.put("name", "Evening Calm");
        preset.put("description", "A gentle alpha wind-down before sleep");
        preset.put("category", "meditation");
        preset.put("experience_level", "beginner");
        preset.put("base_configuration", base);
        preset.put("tags", List.of("sleep", "alpha"));
        preset.put("created_date", "2026-03-01T20:00:00Z");
        preset.put("version", "1.0.0");
        return preset;
    }

    private static List<String> codes(ValidationResult result) {
        return result.issues().stream().map(ValidationIssue::code).toList();
    }

    @Test
    @DisplayName("gentle preset → base issues prefixed, metadata merged, no complexity warning")
    void gentlePreset() {
        ValidationResult result = validator.validate(preset(30, 0.5));

        assertTrue(result.isValid());
        assertEquals(1, result.issues().size());
        assertEquals("base_configuration.consciousness_journey[1→2]", result.issues().get(0).fieldPath());
        assertTrue(result.metadata().containsKey(ValidationOrchestrator.META_NEURAL_LOAD));
    }

    @Test
    @DisplayName("complex base for beginners → complexity warning")
    void tooComplex() {
        ValidationResult result = validator.validate(preset(60, 0.7));
        assertTrue(codes(result).contains(PresetValidator.CODE_TOO_COMPLEX));
    }

    @Test
    @DisplayName("missing base configuration → required error, nothing else")
    void missingBase() {
        Map<String, Object> preset = preset(30, 0.5);
        preset.remove("base_configuration");

        assertEquals(List.of(SchemaValidator.CODE_REQUIRED), codes(validator.validate(preset)));
    }

    @Test
    @DisplayName("malformed id, category and version → schema errors")
    void presetSchema() {
        Map<String, Object> preset = preset(30, 0.5);
        preset.put("preset_id", "Evening Calm!");
        preset.put("category", "sleep");
        preset.put("version", "v1");

        List<String> codes = codes(validator.validate(preset));

        assertEquals(2, codes.stream().filter(SchemaValidator.CODE_PATTERN::equals).count());
        assertTrue(codes.contains(SchemaValidator.CODE_ENUM));
    }
}
