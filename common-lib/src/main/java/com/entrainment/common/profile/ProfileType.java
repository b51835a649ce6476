package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProfileType {
    BEGINNER,
    PERSONALIZED,
    THERAPEUTIC,
    ADVANCED,
    RESEARCH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProfileType fromName(String name) {
        if (name == null) return null;
        for (ProfileType type : values()) {
            if (type.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return type;
        }
        return null;
    }
}
