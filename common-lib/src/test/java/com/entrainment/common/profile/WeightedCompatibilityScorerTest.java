package com.entrainment.common.profile;

import com.entrainment.common.model.ExperienceLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WeightedCompatibilityScorerTest {

    private final CompatibilityScorer scorer = new WeightedCompatibilityScorer();

    private static NeuralProfile profile(String name, ExperienceLevel level) {
        return ProfileFixtures.profile(name, level);
    }

    @Nested
    @DisplayName("identical settings")
    class Identical {

        @Test
        @DisplayName("two default profiles → every sub-score 1.0")
        void perfectMatch() {
            CompatibilityScore score = scorer.score(
                profile("A", ExperienceLevel.INTERMEDIATE), profile("B", ExperienceLevel.INTERMEDIATE));

            assertEquals(1.0, score.brainwavePreferences(), 1e-9);
            assertEquals(1.0, score.consciousnessStates(), 1e-9);
            assertEquals(1.0, score.biofieldResonance(), 1e-9);
            assertEquals(1.0, score.sessionPreferences(), 1e-9);
            assertEquals(1.0, score.safetyCompatibility(), 1e-9);
            assertEquals(1.0, score.overall(), 1e-9);
        }
    }

    @Nested
    @DisplayName("safety compatibility")
    class Safety {

        @Test
        @DisplayName("one profile with a health condition → safety × 0.8, lower overall")
        void healthConditionPenalty() {
            NeuralProfile healthy = profile("A", ExperienceLevel.INTERMEDIATE);
            NeuralProfile epileptic = ProfileFixtures.withConditions(profile("B", ExperienceLevel.INTERMEDIATE), "epilepsy");

            CompatibilityScore baseline = scorer.score(healthy, profile("C", ExperienceLevel.INTERMEDIATE));
            CompatibilityScore score = scorer.score(healthy, epileptic);

            assertEquals(0.8, score.safetyCompatibility(), 1e-9);
            assertEquals(0.97, score.overall(), 1e-9);
            assertTrue(score.overall() < baseline.overall());
        }

        @Test
        @DisplayName("beginner vs expert → safety 1 − 3/4")
        void levelGap() {
            CompatibilityScore score = scorer.score(
                profile("A", ExperienceLevel.BEGINNER), profile("B", ExperienceLevel.EXPERT));
            assertEquals(0.25, score.safetyCompatibility(), 1e-9);
        }

        @Test
        @DisplayName("unknown level counts as beginner")
        void unknownLevel() {
            CompatibilityScore score = scorer.score(
                profile("A", null), profile("B", ExperienceLevel.BEGINNER));
            assertEquals(1.0, score.safetyCompatibility(), 1e-9);
        }
    }

    @Nested
    @DisplayName("preference sub-scores")
    class Preferences {

        @Test
        @DisplayName("no shared bands → brainwave 0")
        void noSharedBands() {
            NeuralProfile a = profile("A", ExperienceLevel.BEGINNER);
            NeuralProfile b = a.withBrainwavePreferences(Map.of());
            assertEquals(0.0, scorer.score(a, b).brainwavePreferences());
        }

        @Test
        @DisplayName("30 min duration gap and different time of day → session 0.5")
        void sessionGap() {
            NeuralProfile a = profile("A", ExperienceLevel.BEGINNER);
            NeuralProfile b = a.withPreferredSessionDuration(50).withOptimalTimeOfDay("morning");
            assertEquals(0.5, scorer.score(a, b).sessionPreferences(), 1e-9);
        }

        @Test
        @DisplayName("score is symmetric")
        void symmetric() {
            NeuralProfile a = profile("A", ExperienceLevel.BEGINNER);
            NeuralProfile b = ProfileFixtures.withConditions(profile("B", ExperienceLevel.ADVANCED), "stress_sensitivity")
                .withPreferredSessionDuration(45);
            assertEquals(scorer.score(a, b), scorer.score(b, a));
        }
    }
}
