package com.entrainment.validation.controller;

import com.entrainment.common.graph.JourneyPlan;
import com.entrainment.common.trace.TraceContextUtil;
import com.entrainment.validation.dto.JourneyPlanRequest;
import com.entrainment.validation.logger.ValidationFlowLogger;
import com.entrainment.validation.service.ValidationDispatchService;
import com.entrainment.validation.trace.TraceIdWebFilter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/journey")
public class JourneyController {

    private final ValidationDispatchService dispatchService;
    private final ValidationFlowLogger flowLogger;

    public JourneyController(ValidationDispatchService dispatchService, ValidationFlowLogger flowLogger) {
        this.dispatchService = dispatchService;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/plan")
    public Mono<ResponseEntity<JourneyPlan>> plan(
            @RequestBody JourneyPlanRequest request,
            ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        flowLogger.logWithTraceId(ValidationFlowLogger.REQUEST_RECEIVED, "journey/plan", traceId);
        Mono<ResponseEntity<JourneyPlan>> pipeline = dispatchService
            .planJourney(request.start(), request.end(), request.experienceLevel(), request.maxHops())
            .doOnEach(flowLogger.stage(ValidationFlowLogger.ENGINE_COMPLETED))
            .map(ResponseEntity::ok);
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
