package com.entrainment.validation.dto;

/** {@code maxHops} falls back to {@code validation.default-max-hops} when absent. */
public record JourneyPlanRequest(
    String start,
    String end,
    String experienceLevel,
    Integer maxHops
) {}
