package com.entrainment.validation.service;

import com.entrainment.common.exception.EngineException;
import com.entrainment.common.exception.ProfileFormatException;
import com.entrainment.common.exception.UnsafeInputException;
import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.profile.NeuralProfile;
import com.entrainment.common.profile.ProfileCodec;
import com.entrainment.common.profile.ProfileDefaults;
import com.entrainment.common.profile.SessionIntention;
import com.entrainment.common.profile.SessionOutcome;
import com.entrainment.common.profile.WeightedCompatibilityScorer;
import com.entrainment.common.schema.SchemaValidator;
import com.entrainment.common.validation.PresetValidator;
import com.entrainment.common.validation.ValidationOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationDispatchServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProfileCodec codec = ProfileCodec.defaultCodec();
    private ValidationDispatchService service;

    @BeforeEach
    void setUp() {
        ConsciousnessStateGraph graph = ConsciousnessStateGraph.defaultGraph();
        ValidationOrchestrator orchestrator = new ValidationOrchestrator(graph, false);
        service = new ValidationDispatchService(orchestrator, new PresetValidator(orchestrator), graph,
            new WeightedCompatibilityScorer(), codec, 5, false);
    }

    private JsonNode profileJson(ExperienceLevel level, String... conditions) throws Exception {
        NeuralProfile profile = ProfileDefaults.createDefault("Ada", level);
        profile = profile.withSafetyProfile(profile.safetyProfile().withHealthConditions(List.of(conditions)));
        return mapper.readTree(codec.exportJson(profile, true));
    }

    private static Map<String, Object> config(int duration, double intensity, List<String> journey) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "Evening Calm");
        map.put("duration_minutes", duration);
        map.put("frequency_intensity", intensity);
        map.put("consciousness_journey", journey);
        return map;
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("beginner profile over its limits → unsafe verdict")
        void sessionWithProfile() throws Exception {
            StepVerifier.create(service.validateSession(
                    config(45, 0.9, List.of("neutral", "gamma_awakening")), profileJson(ExperienceLevel.BEGINNER), null))
                .assertNext(result -> {
                    assertFalse(result.isSafe());
                    assertEquals("beginner", result.metadata().get(ValidationOrchestrator.META_EXPERIENCE_LEVEL));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("strict flag on the request overrides the configured mode")
        void strictOverride() {
            StepVerifier.create(service.validateSession(
                    config(30, 0.5, List.of("neutral", "deep_relaxation", "neutral")), null, true))
                .assertNext(result -> assertFalse(result.isValid()))
                .verifyComplete();
        }

        @Test
        @DisplayName("old profile version → ProfileFormatException signal")
        void oldProfileVersion() throws Exception {
            JsonNode old = mapper.readTree("{\"schema_version\": 1}");
            StepVerifier.create(service.validateSession(config(30, 0.5, List.of("neutral")), old, null))
                .expectError(ProfileFormatException.class)
                .verify();
        }

        @Test
        @DisplayName("batch → one detail per configuration")
        void batch() {
            Map<String, Map<String, Object>> batch = new LinkedHashMap<>();
            batch.put("calm", config(30, 0.5, List.of("neutral", "focused_attention")));
            batch.put("empty", Map.of());

            StepVerifier.create(service.validateBatch(batch))
                .assertNext(report -> {
                    assertFalse(report.overallValid());
                    assertEquals(List.of("calm", "empty"), List.copyOf(report.detailedResults().keySet()));
                    assertTrue(report.detailedResults().get("calm").isValid());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("null batch entry → reported with required-field errors")
        void nullBatchEntry() {
            Map<String, Map<String, Object>> batch = new LinkedHashMap<>();
            batch.put("calm", config(30, 0.5, List.of("neutral", "focused_attention")));
            batch.put("missing", null);

            StepVerifier.create(service.validateBatch(batch))
                .assertNext(report -> {
                    assertFalse(report.overallValid());
                    assertEquals(4, report.detailedResults().get("missing").issues().stream()
                        .filter(issue -> SchemaValidator.CODE_REQUIRED.equals(issue.code()))
                        .count());
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("journey planning")
    class Journey {

        @Test
        @DisplayName("default hop budget → beginner route to focused attention")
        void plan() {
            StepVerifier.create(service.planJourney("neutral", "focused_attention", "beginner", null))
                .assertNext(plan -> {
                    assertEquals(List.of("neutral", "focused_attention"), plan.path());
                    assertTrue(plan.reachedTarget());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unknown level → EngineException signal")
        void unknownLevel() {
            StepVerifier.create(service.planJourney("neutral", "focused_attention", "guru", 3))
                .expectError(EngineException.class)
                .verify();
        }

        @Test
        @DisplayName("missing start state → EngineException signal")
        void missingStart() {
            StepVerifier.create(service.planJourney(null, "focused_attention", "beginner", 3))
                .expectError(EngineException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("profiles")
    class Profiles {

        @Test
        @DisplayName("default profile → JSON without sensitive fields")
        void createDefault() {
            StepVerifier.create(service.createDefaultProfile("Ada Lovelace", "intermediate"))
                .assertNext(json -> {
                    NeuralProfile profile = codec.importJson(json);
                    assertEquals("Ada Lovelace", profile.name());
                    assertEquals(ExperienceLevel.INTERMEDIATE, profile.experienceLevel());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unsafe name → UnsafeInputException signal")
        void unsafeName() {
            StepVerifier.create(service.createDefaultProfile("<script>alert(1)</script>", "beginner"))
                .expectError(UnsafeInputException.class)
                .verify();
        }

        @Test
        @DisplayName("health condition → lower compatibility than identical profiles")
        void compatibility() throws Exception {
            JsonNode healthy = profileJson(ExperienceLevel.INTERMEDIATE);
            JsonNode epileptic = profileJson(ExperienceLevel.INTERMEDIATE, "epilepsy");

            double identical = service.compatibility(healthy, healthy).block().overall();
            double mixed = service.compatibility(healthy, epileptic).block().overall();

            assertTrue(mixed < identical);
        }

        @Test
        @DisplayName("missing profile → EngineException signal")
        void missingProfile() {
            StepVerifier.create(service.validateProfile(null))
                .expectError(EngineException.class)
                .verify();
        }

        @Test
        @DisplayName("optimize → plan for the named intention")
        void optimize() throws Exception {
            StepVerifier.create(service.optimizeForIntention(profileJson(ExperienceLevel.BEGINNER), "healing"))
                .assertNext(plan -> assertEquals(SessionIntention.HEALING, plan.intention()))
                .verifyComplete();
        }

        @Test
        @DisplayName("apply session → history advanced by one")
        void applySession() throws Exception {
            SessionOutcome outcome = new SessionOutcome(20, List.of("neutral"), Map.of(), Map.of(), null, 0.9, 0.8, "");
            StepVerifier.create(service.applySession(profileJson(ExperienceLevel.BEGINNER), outcome))
                .assertNext(json -> assertEquals(1, codec.importJson(json).sessionHistory().totalSessions()))
                .verifyComplete();
        }

        @Test
        @DisplayName("missing outcome → EngineException signal")
        void missingOutcome() throws Exception {
            StepVerifier.create(service.applySession(profileJson(ExperienceLevel.BEGINNER), null))
                .expectError(EngineException.class)
                .verify();
        }
    }
}
