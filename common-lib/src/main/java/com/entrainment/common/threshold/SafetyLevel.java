package com.entrainment.common.threshold;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Overall risk verdict of a compliance check. */
public enum SafetyLevel {
    MINIMAL_RISK,
    LOW_RISK,
    MODERATE_RISK,
    HIGH_RISK,
    EXTREME_RISK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
