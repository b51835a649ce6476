package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-experience-level ceilings on session parameters.
 */
public record NeuralLoadLimit(
    @JsonProperty("experienceLevel")                ExperienceLevel experienceLevel,
    @JsonProperty("maxSessionDurationMinutes")      int maxSessionDurationMinutes,
    @JsonProperty("maxFrequencyIntensity")          double maxFrequencyIntensity,
    @JsonProperty("maxGammaExposureMinutes")        int maxGammaExposureMinutes,
    @JsonProperty("maxStateTransitions")            int maxStateTransitions,
    @JsonProperty("maxNeuralLoad")                  double maxNeuralLoad,
    @JsonProperty("recommendedBreakIntervalMinutes") int recommendedBreakIntervalMinutes,
    @JsonProperty("integrationTimeMultiplier")      double integrationTimeMultiplier
) {}
