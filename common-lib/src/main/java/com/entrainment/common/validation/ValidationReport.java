package com.entrainment.common.validation;

import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Summary across several named validation results, e.g. one per preset in an import.
 *
 * @param issuesBySeverity counts keyed by severity wire name, every severity present
 * @param averageScore     mean {@code overallScore}; {@code 0} for an empty report
 * @param recommendations  distinct suggestions in first-seen order
 */
public record ValidationReport(
    @JsonProperty("overallValid")     boolean overallValid,
    @JsonProperty("overallSafe")      boolean overallSafe,
    @JsonProperty("totalIssues")      int totalIssues,
    @JsonProperty("issuesBySeverity") Map<String, Long> issuesBySeverity,
    @JsonProperty("averageScore")     double averageScore,
    @JsonProperty("recommendations")  List<String> recommendations,
    @JsonProperty("detailedResults")  Map<String, Detail> detailedResults
) {
    public record Detail(
        @JsonProperty("isValid")     boolean isValid,
        @JsonProperty("isSafe")      boolean isSafe,
        @JsonProperty("score")       double score,
        @JsonProperty("issuesCount") int issuesCount,
        @JsonProperty("metadata")    Map<String, Object> metadata
    ) {}

    public static ValidationReport aggregate(Map<String, ValidationResult> results) {
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (ValidationSeverity severity : List.of(ValidationSeverity.CRITICAL, ValidationSeverity.ERROR,
                ValidationSeverity.WARNING, ValidationSeverity.INFO)) {
            bySeverity.put(severity.wireName(), 0L);
        }
        LinkedHashSet<String> recommendations = new LinkedHashSet<>();
        Map<String, Detail> details = new LinkedHashMap<>();
        boolean valid = true;
        boolean safe = true;
        int total = 0;
        double scoreSum = 0.0;

        for (Map.Entry<String, ValidationResult> entry : results.entrySet()) {
            ValidationResult result = entry.getValue();
            valid &= result.isValid();
            safe  &= result.isSafe();
            total += result.issues().size();
            scoreSum += result.overallScore();
            result.issues().forEach(i -> bySeverity.merge(i.severity().wireName(), 1L, Long::sum));
            recommendations.addAll(result.suggestions());
            details.put(entry.getKey(), new Detail(result.isValid(), result.isSafe(), result.overallScore(),
                result.issues().size(), result.metadata()));
        }

        double average = results.isEmpty() ? 0.0 : scoreSum / results.size();
        return new ValidationReport(valid, safe, total, Collections.unmodifiableMap(bySeverity), average,
            List.copyOf(recommendations), Collections.unmodifiableMap(details));
    }
}
