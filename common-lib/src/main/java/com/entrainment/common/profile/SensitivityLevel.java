package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How strongly a user reacts to entrainment. */
public enum SensitivityLevel {
    VERY_LOW,
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SensitivityLevel fromName(String name) {
        if (name == null) return null;
        for (SensitivityLevel level : values()) {
            if (level.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return level;
        }
        return null;
    }
}
