package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity taxonomy for validation issues.
 *
 * <ul>
 *   <li>{@link #INFO}:     non-actionable observation</li>
 *   <li>{@link #WARNING}:  recommended change; does not block</li>
 *   <li>{@link #ERROR}:    structural defect; blocks {@code isValid}</li>
 *   <li>{@link #CRITICAL}: safety violation; blocks {@code isValid} and {@code isSafe}</li>
 * </ul>
 */
public enum ValidationSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
