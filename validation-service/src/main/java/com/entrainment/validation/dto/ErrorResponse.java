package com.entrainment.validation.dto;

public record ErrorResponse(String component, String message, String traceId) {}
