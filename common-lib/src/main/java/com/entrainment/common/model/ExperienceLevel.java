package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * User experience tier. Declaration order is the permissiveness order:
 * every level may do at least what the levels before it may do.
 */
public enum ExperienceLevel {

    /** New to consciousness work. */
    BEGINNER,

    /** Some meditation or consciousness experience. */
    INTERMEDIATE,

    /** Extensive consciousness exploration. */
    ADVANCED,

    /** Professional practitioner. */
    EXPERT;

    /** Number of defined levels; used to normalize level distances. */
    public static final int LEVEL_COUNT = values().length;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Position in the permissiveness order, {@code 0} for {@link #BEGINNER}. */
    public int index() {
        return ordinal();
    }

    public boolean atLeast(ExperienceLevel other) {
        return ordinal() >= other.ordinal();
    }

    /** Advanced and expert users may take transitions of any difficulty. */
    public boolean mayTakeAnyTransition() {
        return atLeast(ADVANCED);
    }

    /**
     * Resolves a wire name ({@code "beginner"} …) to a level.
     *
     * @return the level, or {@code null} when the name is unknown or {@code null}
     */
    @JsonCreator
    public static ExperienceLevel fromName(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ExperienceLevel level : values()) {
            if (level.name().equals(normalized)) return level;
        }
        return null;
    }
}
