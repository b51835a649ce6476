package com.entrainment.common.validation;

import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JourneyValidatorTest {

    private final JourneyValidator validator = new JourneyValidator(ConsciousnessStateGraph.defaultGraph());

    private static List<String> codes(ValidationResult result) {
        return result.issues().stream().map(ValidationIssue::code).toList();
    }

    @Nested
    @DisplayName("validateTransition()")
    class Transition {

        @Test
        @DisplayName("easy recommended edge → no issues")
        void clean() {
            assertTrue(validator.validateTransition("neutral", "deep_relaxation", ExperienceLevel.BEGINNER)
                .issues().isEmpty());
        }

        @Test
        @DisplayName("advanced edge for intermediate → difficulty and not-recommended warnings")
        void advancedEdge() {
            ValidationResult result = validator.validateTransition(
                "meditative_awareness", "gamma_awakening", ExperienceLevel.INTERMEDIATE);

            assertEquals(List.of(JourneyValidator.CODE_DIFFICULT_TRANSITION, JourneyValidator.CODE_NOT_RECOMMENDED),
                codes(result));
            assertEquals("Recommended targets: creative_flow", result.issues().get(1).suggestion());
            assertTrue(validator.validateTransition(
                "meditative_awareness", "gamma_awakening", ExperienceLevel.ADVANCED).issues().isEmpty());
        }

        @Test
        @DisplayName("no edge, depth 1 → 5 → depth jump and not-recommended warnings")
        void depthJump() {
            ValidationResult result = validator.validateTransition("neutral", "gamma_awakening", ExperienceLevel.BEGINNER);
            assertEquals(List.of(JourneyValidator.CODE_DEPTH_JUMP, JourneyValidator.CODE_NOT_RECOMMENDED), codes(result));
            assertEquals(4, result.issues().get(0).value());
        }

        @Test
        @DisplayName("no safe targets → suggestion says so")
        void noTargets() {
            ValidationResult result = validator.validateTransition("deep_relaxation", "neutral", ExperienceLevel.BEGINNER);
            assertEquals("No recommended targets from deep_relaxation", result.issues().get(0).suggestion());
        }

        @Test
        @DisplayName("unknown target → error only")
        void unknownTarget() {
            ValidationResult result = validator.validateTransition("neutral", "astral_projection", ExperienceLevel.EXPERT);
            assertEquals(1, result.issues().size());
            assertEquals("to_state", result.issues().get(0).fieldPath());
            assertEquals(ValidationSeverity.ERROR, result.issues().get(0).severity());
        }
    }

    @Nested
    @DisplayName("validateJourney()")
    class Journey {

        @Test
        @DisplayName("empty journey → error")
        void empty() {
            assertEquals(List.of(JourneyValidator.CODE_EMPTY_JOURNEY),
                codes(validator.validateJourney(List.of(), ExperienceLevel.BEGINNER, false)));
        }

        @Test
        @DisplayName("transition issues → indexed step path")
        void stepPaths() {
            ValidationResult result = validator.validateJourney(
                List.of("neutral", "deep_relaxation", "neutral"), ExperienceLevel.BEGINNER, false);

            assertEquals(1, result.issues().size());
            assertEquals("consciousness_journey[1→2]", result.issues().get(0).fieldPath());
            assertEquals(ValidationSeverity.WARNING, result.issues().get(0).severity());
        }

        @Test
        @DisplayName("unknown state → error at its index, its transitions skipped")
        void unknownState() {
            ValidationResult result = validator.validateJourney(
                List.of("neutral", "astral_projection", "neutral"), ExperienceLevel.BEGINNER, false);

            assertEquals(1, result.issues().size());
            assertEquals("consciousness_journey[1]", result.issues().get(0).fieldPath());
        }

        @Test
        @DisplayName("strict mode → warnings reported as errors")
        void strict() {
            ValidationResult result = validator.validateJourney(
                List.of("neutral", "gamma_awakening"), ExperienceLevel.BEGINNER, true);

            assertEquals(2, result.count(ValidationSeverity.ERROR));
            assertEquals(0, result.count(ValidationSeverity.WARNING));
            assertFalse(result.isValid());
        }
    }
}
