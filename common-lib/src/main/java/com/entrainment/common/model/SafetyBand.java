package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete classification of a scalar against a {@link SafetyThreshold}.
 * Declared from safest to least permissive.
 */
public enum SafetyBand {
    SAFE,
    WARNING,
    DANGER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
