package com.entrainment.common.schema;

import com.entrainment.common.exception.SchemaDefinitionException;
import com.entrainment.common.model.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static Map<String, Object> validSession() {
        Map<String, Object> config = new HashMap<>();
        config.put("name", "Evening Calm");
        config.put("duration_minutes", 30);
        config.put("frequency_intensity", 0.5);
        config.put("consciousness_journey", List.of("neutral", "deep_relaxation", "neutral"));
        return config;
    }

    private static List<String> codes(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::code).toList();
    }

    @Nested
    @DisplayName("session configuration schema")
    class SessionSchema {

        @Test
        @DisplayName("complete, well-typed, in-range config → no issues")
        void validConfig() {
            assertTrue(SchemaValidator.validate(validSession(), SessionSchemas.SESSION_CONFIGURATION).isEmpty());
        }

        @Test
        @DisplayName("missing required field → exactly one error at that field")
        void missingRequired() {
            Map<String, Object> config = validSession();
            config.remove("duration_minutes");
            List<ValidationIssue> issues = SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION);
            assertEquals(1, issues.size());
            assertEquals("duration_minutes", issues.get(0).fieldPath());
            assertEquals(SchemaValidator.CODE_REQUIRED, issues.get(0).code());
        }

        @Test
        @DisplayName("wrong type → one type error, range checks skipped")
        void wrongType() {
            Map<String, Object> config = validSession();
            config.put("duration_minutes", "thirty");
            List<ValidationIssue> issues = SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION);
            assertEquals(List.of(SchemaValidator.CODE_TYPE), codes(issues));
        }

        @Test
        @DisplayName("boolean is not accepted as an integer")
        void booleanIsNotNumber() {
            Map<String, Object> config = validSession();
            config.put("duration_minutes", true);
            assertEquals(List.of(SchemaValidator.CODE_TYPE),
                codes(SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION)));
        }

        @Test
        @DisplayName("integral value accepted for a float field")
        void integerAsFloat() {
            Map<String, Object> config = validSession();
            config.put("frequency_intensity", 1);
            assertTrue(SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION).isEmpty());
        }

        @Test
        @DisplayName("out-of-range values → min/max errors")
        void ranges() {
            Map<String, Object> config = validSession();
            config.put("duration_minutes", 3);
            config.put("frequency_intensity", 1.5);
            List<String> codes = codes(SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION));
            assertTrue(codes.contains(SchemaValidator.CODE_MIN_VALUE));
            assertTrue(codes.contains(SchemaValidator.CODE_MAX_VALUE));
        }

        @Test
        @DisplayName("name too long and bad characters → both length and pattern errors")
        void independentStringChecks() {
            Map<String, Object> config = validSession();
            config.put("name", "!".repeat(101));
            List<String> codes = codes(SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION));
            assertEquals(List.of(SchemaValidator.CODE_MAX_LENGTH, SchemaValidator.CODE_PATTERN), codes);
        }

        @Test
        @DisplayName("journey with 9 states and a non-string item → max-items and item-type errors")
        void arrayChecks() {
            Map<String, Object> config = validSession();
            config.put("consciousness_journey",
                List.of("neutral", "neutral", "neutral", "neutral", "neutral", "neutral", "neutral", "neutral", 7));
            List<ValidationIssue> issues = SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION);
            assertEquals(List.of(SchemaValidator.CODE_MAX_ITEMS, SchemaValidator.CODE_ITEM_TYPE), codes(issues));
            assertEquals("consciousness_journey[8]", issues.get(1).fieldPath());
        }

        @Test
        @DisplayName("nested biofield out of range → dotted path")
        void nestedPath() {
            Map<String, Object> config = validSession();
            config.put("biofield_configuration", Map.of("schumann_alignment", 1.2));
            List<ValidationIssue> issues = SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION);
            assertEquals(1, issues.size());
            assertEquals("biofield_configuration.schumann_alignment", issues.get(0).fieldPath());
        }

        @Test
        @DisplayName("explicit null counts as absent")
        void nullIsAbsent() {
            Map<String, Object> config = validSession();
            config.put("name", null);
            assertEquals(List.of(SchemaValidator.CODE_REQUIRED),
                codes(SchemaValidator.validate(config, SessionSchemas.SESSION_CONFIGURATION)));
        }
    }

    @Nested
    @DisplayName("preset schema")
    class PresetSchema {

        @Test
        @DisplayName("unknown category → enum error with allowed values as suggestion")
        void enumViolation() {
            Map<String, Object> preset = new HashMap<>();
            preset.put("preset_id", "calm_evening");
            preset.put("name", "Calm Evening");
            preset.put("description", "A gentle evening wind-down");
            preset.put("category", "sports");
            preset.put("experience_level", "beginner");
            preset.put("base_configuration", Map.of());
            preset.put("created_date", "2024-05-01T10:00:00");
            preset.put("version", "1.0.0");
            List<ValidationIssue> issues = SchemaValidator.validate(preset, SessionSchemas.PRESET);
            assertEquals(1, issues.size());
            assertEquals(SchemaValidator.CODE_ENUM, issues.get(0).code());
            assertTrue(issues.get(0).suggestion().contains("meditation"));
        }
    }

    @Nested
    @DisplayName("schema definitions")
    class Definitions {

        @Test
        @DisplayName("range on a string field → SchemaDefinitionException")
        void inapplicableConstraint() {
            assertThrows(SchemaDefinitionException.class, () -> FieldRule.string("name").range(0, 1));
        }

        @Test
        @DisplayName("min above max → SchemaDefinitionException")
        void invertedRange() {
            assertThrows(SchemaDefinitionException.class, () -> FieldRule.integer("n").range(5, 1));
        }

        @Test
        @DisplayName("invalid regex → SchemaDefinitionException")
        void badPattern() {
            assertThrows(SchemaDefinitionException.class, () -> FieldRule.string("s").pattern("[unclosed"));
        }
    }
}
