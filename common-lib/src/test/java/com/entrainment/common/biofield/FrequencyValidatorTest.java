package com.entrainment.common.biofield;

import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyValidatorTest {

    private static List<String> codes(ValidationResult result) {
        return result.issues().stream().map(ValidationIssue::code).toList();
    }

    @Nested
    @DisplayName("safety limits")
    class Limits {

        @Test
        @DisplayName("zero or negative → error, nothing else checked")
        void notPositive() {
            ValidationResult result = FrequencyValidator.validate(0.0, FrequencyType.BRAINWAVE);
            assertEquals(List.of("FREQUENCY_NOT_POSITIVE"), codes(result));
            assertFalse(result.isValid());
        }

        @Test
        @DisplayName("above 1000 Hz → warning")
        void veryHigh() {
            assertTrue(codes(FrequencyValidator.validate(1500, FrequencyType.SOLFEGGIO)).contains("FREQUENCY_VERY_HIGH"));
        }
    }

    @Nested
    @DisplayName("brainwave")
    class Brainwave {

        @Test
        @DisplayName("10 Hz → alpha, no issues")
        void alpha() {
            ValidationResult result = FrequencyValidator.validate(10.0, FrequencyType.BRAINWAVE);
            assertEquals("alpha", result.metadata().get(FrequencyValidator.META_BRAINWAVE_RANGE));
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("120 Hz → ultra gamma, expert-only warning")
        void ultraGamma() {
            ValidationResult result = FrequencyValidator.validate(120.0, FrequencyType.BRAINWAVE);
            assertEquals("ultra_gamma", result.metadata().get(FrequencyValidator.META_BRAINWAVE_RANGE));
            assertEquals(List.of("BRAINWAVE_EXPERT_ONLY"), codes(result));
        }

        @Test
        @DisplayName("300 Hz → no band, warning")
        void unmatched() {
            assertEquals(List.of("BRAINWAVE_UNMATCHED"), codes(FrequencyValidator.validate(300, FrequencyType.BRAINWAVE)));
        }
    }

    @Nested
    @DisplayName("reference tables")
    class References {

        @Test
        @DisplayName("530 Hz within 1 % of 528 Hz")
        void solfeggio() {
            assertEquals("528_hz", FrequencyValidator.validate(530, FrequencyType.SOLFEGGIO)
                .metadata().get(FrequencyValidator.META_SOLFEGGIO_FREQUENCY));
        }

        @Test
        @DisplayName("600 Hz matches no Solfeggio tone → info only, still valid")
        void solfeggioMiss() {
            ValidationResult result = FrequencyValidator.validate(600, FrequencyType.SOLFEGGIO);
            assertEquals(List.of("SOLFEGGIO_UNMATCHED"), codes(result));
            assertTrue(result.isValid());
            assertEquals(1.0, result.overallScore());
        }

        @Test
        @DisplayName("7.9 Hz → Schumann fundamental")
        void schumann() {
            assertEquals("fundamental", FrequencyValidator.validate(7.9, FrequencyType.SCHUMANN)
                .metadata().get(FrequencyValidator.META_SCHUMANN_MODE));
        }

        @Test
        @DisplayName("1.62 Hz → φ¹; 2.0 Hz → no harmonic")
        void goldenRatio() {
            assertEquals("phi_1", FrequencyValidator.validate(1.62, FrequencyType.GOLDEN_RATIO)
                .metadata().get(FrequencyValidator.META_GOLDEN_RATIO_HARMONIC));
            assertEquals(List.of("GOLDEN_RATIO_UNMATCHED"),
                codes(FrequencyValidator.validate(2.0, FrequencyType.GOLDEN_RATIO)));
        }
    }
}
