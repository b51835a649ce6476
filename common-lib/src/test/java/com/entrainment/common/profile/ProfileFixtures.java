package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class ProfileFixtures {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T20:00:00Z"), ZoneOffset.UTC);

    private ProfileFixtures() {}

    static NeuralProfile profile(String name, ExperienceLevel level) {
        return ProfileDefaults.createDefault(name, level, CLOCK);
    }

    static NeuralProfile withConditions(NeuralProfile profile, String... conditions) {
        return profile.withSafetyProfile(profile.safetyProfile().withHealthConditions(List.of(conditions)));
    }
}
