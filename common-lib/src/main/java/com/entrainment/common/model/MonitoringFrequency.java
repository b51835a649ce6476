package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MonitoringFrequency {
    CONTINUOUS,
    FREQUENT,
    PERIODIC,
    MINIMAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
