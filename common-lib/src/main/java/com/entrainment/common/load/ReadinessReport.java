package com.entrainment.common.load;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReadinessReport(
    @JsonProperty("isReady")                  boolean isReady,
    @JsonProperty("readinessScore")           double readinessScore,
    @JsonProperty("sessionComplexity")        double sessionComplexity,
    @JsonProperty("concerns")                 List<String> concerns,
    @JsonProperty("preparationsNeeded")       List<String> preparationsNeeded,
    @JsonProperty("recommendedModifications") List<String> recommendedModifications
) {
    public ReadinessReport {
        concerns                 = List.copyOf(concerns);
        preparationsNeeded       = List.copyOf(preparationsNeeded);
        recommendedModifications = List.copyOf(recommendedModifications);
    }
}
