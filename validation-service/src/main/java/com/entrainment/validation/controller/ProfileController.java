package com.entrainment.validation.controller;

import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.profile.CompatibilityScore;
import com.entrainment.common.profile.OptimizedSessionPlan;
import com.entrainment.common.trace.TraceContextUtil;
import com.entrainment.validation.dto.CompatibilityRequest;
import com.entrainment.validation.dto.DefaultProfileRequest;
import com.entrainment.validation.dto.IntentionRequest;
import com.entrainment.validation.dto.SessionOutcomeRequest;
import com.entrainment.validation.logger.ValidationFlowLogger;
import com.entrainment.validation.service.ValidationDispatchService;
import com.entrainment.validation.trace.TraceIdWebFilter;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Profile operations. Profiles travel as serialized JSON documents; they are decoded and
 * version-checked by the profile codec on every request.
 */
@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final ValidationDispatchService dispatchService;
    private final ValidationFlowLogger flowLogger;

    public ProfileController(ValidationDispatchService dispatchService, ValidationFlowLogger flowLogger) {
        this.dispatchService = dispatchService;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/compatibility")
    public Mono<ResponseEntity<CompatibilityScore>> compatibility(
            @RequestBody CompatibilityRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "profiles/compatibility", traceId);
        return TraceContextUtil.withTraceId(
            dispatchService.compatibility(request.first(), request.second())
                .doOnEach(flowLogger.stage(ValidationFlowLogger.ENGINE_COMPLETED))
                .map(ResponseEntity::ok),
            traceId);
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidationResult>> validate(
            @RequestBody JsonNode profile,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "profiles/validate", traceId);
        return TraceContextUtil.withTraceId(
            dispatchService.validateProfile(profile)
                .doOnEach(flowLogger.verdict())
                .map(ResponseEntity::ok),
            traceId);
    }

    @PostMapping("/default")
    public Mono<ResponseEntity<String>> createDefault(
            @RequestBody DefaultProfileRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "profiles/default", traceId);
        return TraceContextUtil.withTraceId(
            dispatchService.createDefaultProfile(request.name(), request.experienceLevel())
                .map(json -> ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json)),
            traceId);
    }

    @PostMapping("/optimize")
    public Mono<ResponseEntity<OptimizedSessionPlan>> optimize(
            @RequestBody IntentionRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "profiles/optimize", traceId);
        return TraceContextUtil.withTraceId(
            dispatchService.optimizeForIntention(request.profile(), request.intention())
                .map(ResponseEntity::ok),
            traceId);
    }

    @PostMapping("/session")
    public Mono<ResponseEntity<String>> applySession(
            @RequestBody SessionOutcomeRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "profiles/session", traceId);
        return TraceContextUtil.withTraceId(
            dispatchService.applySession(request.profile(), request.outcome())
                .map(json -> ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json)),
            traceId);
    }
}
