package com.entrainment.validation.dto;

import com.entrainment.common.profile.SessionOutcome;
import com.fasterxml.jackson.databind.JsonNode;

public record SessionOutcomeRequest(JsonNode profile, SessionOutcome outcome) {}
