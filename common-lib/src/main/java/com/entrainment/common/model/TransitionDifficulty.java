package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Difficulty tier of a {@link StateTransition}. */
public enum TransitionDifficulty {
    EASY,
    MODERATE,
    CHALLENGING,
    ADVANCED;

    /** Easy and moderate transitions are open to every experience level. */
    public boolean isGentle() {
        return this == EASY || this == MODERATE;
    }

    public boolean permittedFor(ExperienceLevel level) {
        return isGentle() || (level != null && level.mayTakeAnyTransition());
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
