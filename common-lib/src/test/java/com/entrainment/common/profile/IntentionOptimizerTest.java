package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.SessionConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentionOptimizerTest {

    private final NeuralProfile profile = ProfileFixtures.profile("Ada", ExperienceLevel.INTERMEDIATE);

    @Test
    @DisplayName("meditation → known states wrapped in neutral, alpha intensity scaled")
    void meditation() {
        OptimizedSessionPlan plan = IntentionOptimizer.optimize(profile, SessionIntention.MEDITATION);

        assertEquals(List.of("neutral", "meditative_awareness", "deep_relaxation", "neutral"),
            plan.consciousnessJourney());
        assertEquals(0.21, plan.intensityLevel(), 1e-9);
        assertEquals(22, plan.durationMinutes());
        assertEquals("schumann_resonance", plan.primaryFocus());
        assertEquals(0.7, plan.coherenceTarget(), 1e-9);
        assertEquals("stable", plan.stabilityPreference());
        assertEquals(60, plan.limits().maxSessionDurationMinutes());
    }

    @Test
    @DisplayName("transcendence with no known states or band → fallback journey, base intensity 0.5")
    void fallback() {
        OptimizedSessionPlan plan = IntentionOptimizer.optimize(profile, SessionIntention.TRANSCENDENCE);

        assertEquals(List.of("neutral", "deep_relaxation", "neutral"), plan.consciousnessJourney());
        assertEquals(0.3, plan.intensityLevel(), 1e-9);
        assertEquals(16, plan.durationMinutes());
    }

    @Test
    @DisplayName("unknown level → no limits attached")
    void unknownLevel() {
        assertNull(IntentionOptimizer.optimize(ProfileFixtures.profile("X", null), SessionIntention.HEALING).limits());
    }

    @Test
    @DisplayName("unknown intention name → meditation")
    void intentionFallback() {
        assertEquals(SessionIntention.MEDITATION, SessionIntention.fromName("levitation"));
        assertEquals(SessionIntention.LEARNING, SessionIntention.fromName(" Learning "));
    }

    @Test
    @DisplayName("plan → configuration carrying its journey")
    void toConfiguration() {
        SessionConfiguration config = IntentionOptimizer.optimize(profile, SessionIntention.MEDITATION)
            .toConfiguration("Evening sit");
        assertEquals("Evening sit", config.name());
        assertEquals(22.0, config.durationMinutes());
        assertEquals(4, config.consciousnessJourney().size());
    }
}
