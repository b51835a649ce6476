package com.entrainment.validation.controller;

import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.trace.TraceContextUtil;
import com.entrainment.common.validation.ValidationReport;
import com.entrainment.validation.dto.SessionValidationRequest;
import com.entrainment.validation.logger.ValidationFlowLogger;
import com.entrainment.validation.service.ValidationDispatchService;
import com.entrainment.validation.trace.TraceIdWebFilter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/validate")
public class ValidationController {

    private final ValidationDispatchService dispatchService;
    private final ValidationFlowLogger flowLogger;

    public ValidationController(ValidationDispatchService dispatchService, ValidationFlowLogger flowLogger) {
        this.dispatchService = dispatchService;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/session")
    public Mono<ResponseEntity<ValidationResult>> validateSession(
            @RequestBody SessionValidationRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "validate/session", traceId);
        Mono<ResponseEntity<ValidationResult>> pipeline = dispatchService
            .validateSession(request.configuration(), request.profile(), request.strict())
            .doOnEach(flowLogger.verdict())
            .map(ResponseEntity::ok);
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    @PostMapping("/preset")
    public Mono<ResponseEntity<ValidationResult>> validatePreset(
            @RequestBody Map<String, Object> preset,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "validate/preset", traceId);
        Mono<ResponseEntity<ValidationResult>> pipeline = dispatchService.validatePreset(preset)
            .doOnEach(flowLogger.verdict())
            .map(ResponseEntity::ok);
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<ValidationReport>> validateBatch(
            @RequestBody Map<String, Map<String, Object>> configurations,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "validate/batch", traceId);
        Mono<ResponseEntity<ValidationReport>> pipeline = dispatchService.validateBatch(configurations)
            .doOnEach(flowLogger.stage(ValidationFlowLogger.ENGINE_COMPLETED))
            .map(ResponseEntity::ok);
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
