package com.entrainment.validation.service;

import com.entrainment.common.exception.EngineException;
import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.graph.JourneyPlan;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.profile.CompatibilityScore;
import com.entrainment.common.profile.CompatibilityScorer;
import com.entrainment.common.profile.IntentionOptimizer;
import com.entrainment.common.profile.NeuralProfile;
import com.entrainment.common.profile.OptimizedSessionPlan;
import com.entrainment.common.profile.ProfileCodec;
import com.entrainment.common.profile.ProfileDefaults;
import com.entrainment.common.profile.ProfileSessionUpdater;
import com.entrainment.common.profile.ProfileValidator;
import com.entrainment.common.profile.SessionIntention;
import com.entrainment.common.profile.SessionOutcome;
import com.entrainment.common.validation.InputSanitizer;
import com.entrainment.common.validation.PresetValidator;
import com.entrainment.common.validation.ValidationOrchestrator;
import com.entrainment.common.validation.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs engine calls off the event loop.
 *
 * <p>The engine is synchronous and CPU-bound; each call is wrapped in
 * {@code Mono.fromCallable} on {@code boundedElastic}. Engine exceptions propagate as
 * error signals and are mapped to HTTP status codes by {@code ApiExceptionHandler}.
 */
@Service
public class ValidationDispatchService {

    private static final Logger log = LoggerFactory.getLogger(ValidationDispatchService.class);

    private final ValidationOrchestrator orchestrator;
    private final PresetValidator presetValidator;
    private final ConsciousnessStateGraph graph;
    private final CompatibilityScorer compatibilityScorer;
    private final ProfileCodec profileCodec;
    private final int defaultMaxHops;
    private final boolean includeSensitiveProfileData;

    public ValidationDispatchService(ValidationOrchestrator orchestrator,
                                     PresetValidator presetValidator,
                                     ConsciousnessStateGraph graph,
                                     CompatibilityScorer compatibilityScorer,
                                     ProfileCodec profileCodec,
                                     @Value("${validation.default-max-hops:5}") int defaultMaxHops,
                                     @Value("${validation.include-sensitive-profile-data:false}")
                                     boolean includeSensitiveProfileData) {
        this.orchestrator = orchestrator;
        this.presetValidator = presetValidator;
        this.graph = graph;
        this.compatibilityScorer = compatibilityScorer;
        this.profileCodec = profileCodec;
        this.defaultMaxHops = defaultMaxHops;
        this.includeSensitiveProfileData = includeSensitiveProfileData;
    }

    // ── validation ───────────────────────────────────────────────────────────

    public Mono<ValidationResult> validateSession(Map<String, Object> configuration, JsonNode profileJson,
                                                  Boolean strict) {
        return offload(() -> {
            Map<String, Object> config = configuration == null ? Map.of() : configuration;
            NeuralProfile profile = decodeOptional(profileJson);
            boolean strictMode = strict == null ? orchestrator.isStrict() : strict;
            ValidationResult result = orchestrator.validate(config, profile, strictMode);
            log.info("Session '{}' validated. valid={} safe={} score={} issues={}",
                config.get("name"), result.isValid(), result.isSafe(), result.overallScore(), result.issues().size());
            return result;
        });
    }

    public Mono<ValidationResult> validatePreset(Map<String, Object> preset) {
        return offload(() -> {
            ValidationResult result = presetValidator.validate(preset == null ? Map.of() : preset);
            log.info("Preset '{}' validated. valid={} safe={} issues={}",
                preset == null ? null : preset.get("preset_id"), result.isValid(), result.isSafe(),
                result.issues().size());
            return result;
        });
    }

    public Mono<ValidationReport> validateBatch(Map<String, Map<String, Object>> configurations) {
        return offload(() -> {
            Map<String, ValidationResult> results = new LinkedHashMap<>();
            if (configurations != null) {
                configurations.forEach((name, config) -> results.put(name, orchestrator.validate(config, null)));
            }
            ValidationReport report = ValidationReport.aggregate(results);
            log.info("Batch of {} configurations validated. valid={} safe={} averageScore={}",
                results.size(), report.overallValid(), report.overallSafe(), report.averageScore());
            return report;
        });
    }

    // ── journey ──────────────────────────────────────────────────────────────

    public Mono<JourneyPlan> planJourney(String start, String end, String experienceLevel, Integer maxHops) {
        return offload(() -> {
            ExperienceLevel level = requireLevel(experienceLevel);
            JourneyPlan plan = graph.planJourney(start, end, level, maxHops == null ? defaultMaxHops : maxHops);
            log.info("Journey {} -> {} planned for {}. hops={} reached={}",
                start, end, level.wireName(), plan.hops(), plan.reachedTarget());
            return plan;
        });
    }

    // ── profiles ─────────────────────────────────────────────────────────────

    public Mono<CompatibilityScore> compatibility(JsonNode first, JsonNode second) {
        return offload(() -> compatibilityScorer.score(decodeRequired(first), decodeRequired(second)));
    }

    public Mono<ValidationResult> validateProfile(JsonNode profileJson) {
        return offload(() -> ProfileValidator.validate(decodeRequired(profileJson)));
    }

    /** @return the new profile as JSON, without sensitive fields unless configured otherwise */
    public Mono<String> createDefaultProfile(String name, String experienceLevel) {
        return offload(() -> {
            String safeName = InputSanitizer.sanitize(name, "name");
            NeuralProfile profile = ProfileDefaults.createDefault(safeName, requireLevel(experienceLevel));
            log.info("Default profile created. profileId={} level={}",
                profile.profileId(), profile.experienceLevel().wireName());
            return profileCodec.exportJson(profile, includeSensitiveProfileData);
        });
    }

    public Mono<OptimizedSessionPlan> optimizeForIntention(JsonNode profileJson, String intention) {
        return offload(() -> IntentionOptimizer.optimize(decodeRequired(profileJson),
            SessionIntention.fromName(intention)));
    }

    public Mono<String> applySession(JsonNode profileJson, SessionOutcome outcome) {
        return offload(() -> {
            if (outcome == null) {
                throw new EngineException("ValidationDispatchService", "Session outcome is required");
            }
            NeuralProfile updated = ProfileSessionUpdater.applySession(decodeRequired(profileJson), outcome);
            log.info("Profile {} updated. totalSessions={} type={}", updated.profileId(),
                updated.sessionHistory().totalSessions(), updated.profileType());
            return profileCodec.exportJson(updated, includeSensitiveProfileData);
        });
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static <T> Mono<T> offload(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private NeuralProfile decodeOptional(JsonNode json) {
        return json == null || json.isNull() || json.isMissingNode() ? null : profileCodec.fromTree(json);
    }

    private NeuralProfile decodeRequired(JsonNode json) {
        NeuralProfile profile = decodeOptional(json);
        if (profile == null) {
            throw new EngineException("ValidationDispatchService", "Profile is required");
        }
        return profile;
    }

    private static ExperienceLevel requireLevel(String name) {
        ExperienceLevel level = ExperienceLevel.fromName(name);
        if (level == null) {
            throw new EngineException("ValidationDispatchService", "Unknown experience level: " + name);
        }
        return level;
    }
}
