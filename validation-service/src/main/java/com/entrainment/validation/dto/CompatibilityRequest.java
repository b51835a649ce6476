package com.entrainment.validation.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record CompatibilityRequest(JsonNode first, JsonNode second) {}
