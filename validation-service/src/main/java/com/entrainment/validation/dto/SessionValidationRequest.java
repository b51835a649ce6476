package com.entrainment.validation.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * @param profile optional serialized neural profile
 * @param strict  overrides the configured strict mode when present
 */
public record SessionValidationRequest(
    Map<String, Object> configuration,
    JsonNode profile,
    Boolean strict
) {}
