package com.entrainment.common.model;

import com.entrainment.common.exception.EngineException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Three ordered classification bands for one session parameter.
 *
 * <p>For {@link RiskDirection#HIGHER_IS_RISKIER} the bands ascend
 * ({@code safe.upper <= warning.lower}, {@code warning.upper <= danger.lower});
 * for {@link RiskDirection#LOWER_IS_RISKIER} they descend. Adjacent bands may share
 * their boundary value; a shared boundary belongs to the safer band.
 */
public record SafetyThreshold(
    @JsonProperty("key")                 String key,
    @JsonProperty("parameterName")       String parameterName,
    @JsonProperty("safeRange")           NumericRange safeRange,
    @JsonProperty("warningRange")        NumericRange warningRange,
    @JsonProperty("dangerRange")         NumericRange dangerRange,
    @JsonProperty("units")               String units,
    @JsonProperty("description")         String description,
    @JsonProperty("monitoringFrequency") MonitoringFrequency monitoringFrequency,
    @JsonProperty("direction")           RiskDirection direction
) {
    public SafetyThreshold {
        boolean ordered = direction == RiskDirection.HIGHER_IS_RISKIER
            ? safeRange.upper() <= warningRange.lower() && warningRange.upper() <= dangerRange.lower()
            : safeRange.lower() >= warningRange.upper() && warningRange.lower() >= dangerRange.upper();
        if (!ordered) {
            throw new EngineException("SafetyThreshold",
                "bands of '" + key + "' are not ordered for " + direction);
        }
    }

    /** Lowest value covered by any band. */
    public double domainMin() {
        return Math.min(safeRange.lower(), Math.min(warningRange.lower(), dangerRange.lower()));
    }

    /** Highest value covered by any band. */
    public double domainMax() {
        return Math.max(safeRange.upper(), Math.max(warningRange.upper(), dangerRange.upper()));
    }

    public NumericRange rangeFor(SafetyBand band) {
        return switch (band) {
            case SAFE    -> safeRange;
            case WARNING -> warningRange;
            case DANGER  -> dangerRange;
        };
    }
}
