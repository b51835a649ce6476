package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable aggregate of validation issues plus descriptive metadata.
 *
 * <p>All verdicts are derived from the issue list, so they can never drift apart:
 * <pre>
 *   isValid      = errors == 0 AND critical == 0
 *   isSafe       = critical == 0
 *   overallScore = critical &gt; 0 ? 0 : max(0, 1 − 0.2·errors − 0.1·warnings)
 * </pre>
 *
 * <p>Build instances with {@link #builder()}.
 */
public record ValidationResult(
    @JsonProperty("issues")   List<ValidationIssue> issues,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    static final double ERROR_PENALTY   = 0.2;
    static final double WARNING_PENALTY = 0.1;

    public ValidationResult {
        issues   = List.copyOf(issues);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ValidationResult empty() {
        return new ValidationResult(List.of(), Map.of());
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return count(ValidationSeverity.ERROR) == 0 && count(ValidationSeverity.CRITICAL) == 0;
    }

    @JsonProperty("isSafe")
    public boolean isSafe() {
        return count(ValidationSeverity.CRITICAL) == 0;
    }

    @JsonProperty("overallScore")
    public double overallScore() {
        if (hasCriticalIssues()) return 0.0;
        double score = 1.0
            - count(ValidationSeverity.ERROR)   * ERROR_PENALTY
            - count(ValidationSeverity.WARNING) * WARNING_PENALTY;
        return Math.max(0.0, score);
    }

    public boolean hasCriticalIssues() {
        return count(ValidationSeverity.CRITICAL) > 0;
    }

    public long count(ValidationSeverity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }

    public List<ValidationIssue> issuesBySeverity(ValidationSeverity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    @JsonProperty("errors")
    public List<String> errors() {
        return messages(ValidationSeverity.ERROR);
    }

    @JsonProperty("warnings")
    public List<String> warnings() {
        return messages(ValidationSeverity.WARNING);
    }

    @JsonProperty("criticalIssues")
    public List<String> criticalIssues() {
        return messages(ValidationSeverity.CRITICAL);
    }

    @JsonProperty("suggestions")
    public List<String> suggestions() {
        return issues.stream()
            .filter(ValidationIssue::hasSuggestion)
            .map(ValidationIssue::suggestion)
            .toList();
    }

    private List<String> messages(ValidationSeverity severity) {
        return issues.stream()
            .filter(i -> i.severity() == severity)
            .map(ValidationIssue::message)
            .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable collector used while a validation pass runs. Not thread-safe; each pass
     * owns its own builder.
     */
    public static final class Builder {

        private final List<ValidationIssue> issues   = new ArrayList<>();
        private final Map<String, Object>   metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(ValidationIssue issue) {
            issues.add(issue);
            return this;
        }

        public Builder add(ValidationSeverity severity, String fieldPath, String message) {
            return add(new ValidationIssue(severity, fieldPath, message, null, "", ""));
        }

        public Builder add(ValidationSeverity severity, String fieldPath, String message,
                           Object value, String suggestion, String code) {
            return add(new ValidationIssue(severity, fieldPath, message, value, suggestion, code));
        }

        public Builder addAll(List<ValidationIssue> more) {
            issues.addAll(more);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder mergeMetadata(Map<String, Object> more) {
            metadata.putAll(more);
            return this;
        }

        public boolean hasSeverity(ValidationSeverity severity) {
            return issues.stream().anyMatch(i -> i.severity() == severity);
        }

        public ValidationResult build() {
            return new ValidationResult(issues, metadata);
        }
    }
}
