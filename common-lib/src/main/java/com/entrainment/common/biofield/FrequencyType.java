package com.entrainment.common.biofield;

import java.util.Locale;

public enum FrequencyType {
    BRAINWAVE,
    SOLFEGGIO,
    SCHUMANN,
    GOLDEN_RATIO;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** @return the type, or {@code null} when unknown */
    public static FrequencyType fromName(String name) {
        if (name == null) return null;
        for (FrequencyType type : values()) {
            if (type.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return type;
        }
        return null;
    }
}
