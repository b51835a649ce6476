package com.entrainment.validation.controller;

import com.entrainment.common.exception.EngineException;
import com.entrainment.common.trace.TraceContextUtil;
import com.entrainment.validation.dto.ErrorResponse;
import com.entrainment.validation.trace.TraceIdWebFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

/**
 * Engine exceptions signal bad input (unknown level, unsupported profile version,
 * unsafe strings) and map to 400. Anything else is a server fault.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(EngineException e, ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("Rejected request. component={} message={}", e.getComponent(), e.getMessage()));
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getComponent(), e.getMessage(), traceId));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e, ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("Request failed. status={} reason={}", e.getStatusCode(), e.getReason()));
        return ResponseEntity.status(e.getStatusCode())
            .body(new ErrorResponse("validation-service", e.getReason(), traceId));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, ServerWebExchange exchange) {
        String traceId = TraceIdWebFilter.traceId(exchange);
        TraceContextUtil.withMdc(traceId, () -> log.error("Unhandled failure", e));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("validation-service", "Internal error", traceId));
    }
}
