package com.entrainment.common.load;

import com.entrainment.common.model.ExperienceLevel;

/**
 * The user's current condition ahead of a session.
 *
 * @param hoursSinceLastSession {@code null} when the user has no previous session
 * @param currentStressLevel    self-reported stress in [0,1]; {@code null} when unknown
 */
public record ReadinessContext(
    ExperienceLevel experienceLevel,
    Double          hoursSinceLastSession,
    Double          currentStressLevel
) {
    public static ReadinessContext rested(ExperienceLevel level) {
        return new ReadinessContext(level, null, null);
    }
}
