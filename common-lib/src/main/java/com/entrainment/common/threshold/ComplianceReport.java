package com.entrainment.common.threshold;

import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationSeverity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a profile-aware safety compliance check.
 *
 * @param issues                limit violations ({@code critical}) and relative contraindications ({@code warning})
 * @param requiredModifications one concrete change per violated limit
 * @param recommendations       general guidance for the experience level; empty when the level is unknown
 */
public record ComplianceReport(
    @JsonProperty("issues")                List<ValidationIssue> issues,
    @JsonProperty("safetyLevel")           SafetyLevel safetyLevel,
    @JsonProperty("requiredModifications") List<String> requiredModifications,
    @JsonProperty("recommendations")       List<String> recommendations
) {
    public ComplianceReport {
        issues                = List.copyOf(issues);
        requiredModifications = List.copyOf(requiredModifications);
        recommendations       = List.copyOf(recommendations);
    }

    @JsonProperty("isSafe")
    public boolean isSafe() {
        return issues.stream().noneMatch(i -> i.severity() == ValidationSeverity.CRITICAL);
    }
}
