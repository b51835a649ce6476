package com.entrainment.validation.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** Unknown or missing intentions are treated as meditation. */
public record IntentionRequest(JsonNode profile, String intention) {}
