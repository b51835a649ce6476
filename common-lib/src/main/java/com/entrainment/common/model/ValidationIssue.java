package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single finding produced during validation.
 *
 * @param severity   how the finding affects validity and safety
 * @param fieldPath  dotted path of the offending field ({@code biofield_configuration.schumann_alignment})
 * @param message    human-readable description
 * @param value      offending value; may be {@code null}
 * @param suggestion remediation hint; empty when none
 * @param code       stable machine-readable identifier; empty when none
 */
public record ValidationIssue(
    @JsonProperty("severity")   ValidationSeverity severity,
    @JsonProperty("fieldPath")  String fieldPath,
    @JsonProperty("message")    String message,
    @JsonProperty("value")      Object value,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("code")       String code
) {
    public ValidationIssue {
        suggestion = suggestion == null ? "" : suggestion;
        code       = code == null ? "" : code;
    }

    public static ValidationIssue of(ValidationSeverity severity, String fieldPath, String message) {
        return new ValidationIssue(severity, fieldPath, message, null, "", "");
    }

    public ValidationIssue withFieldPath(String newPath) {
        return new ValidationIssue(severity, newPath, message, value, suggestion, code);
    }

    public ValidationIssue withSeverity(ValidationSeverity newSeverity) {
        return new ValidationIssue(newSeverity, fieldPath, message, value, suggestion, code);
    }

    public boolean hasSuggestion() {
        return !suggestion.isEmpty();
    }
}
