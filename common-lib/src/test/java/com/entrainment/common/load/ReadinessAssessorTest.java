package com.entrainment.common.load;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.SessionConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessAssessorTest {

    // load = 0.3·(20/60) + 0.3·0.3 + 0 + 0.15·(2/5) = 0.25
    private static final SessionConfiguration LIGHT =
        SessionConfiguration.of("Light", 20, 0.3, List.of("neutral", "deep_relaxation"));

    // load = 0.3 + 0.3·0.9 + 0 + 0.15·(4/5) = 0.69
    private static final SessionConfiguration HEAVY =
        SessionConfiguration.of("Heavy", 90, 0.9, List.of("neutral", "meditative_awareness", "gamma_awakening", "neutral"));

    @Test
    @DisplayName("rested beginner, light session → ready with score 1.0")
    void ready() {
        ReadinessReport report = ReadinessAssessor.assess(ReadinessContext.rested(ExperienceLevel.BEGINNER), LIGHT);
        assertTrue(report.isReady());
        assertEquals(1.0, report.readinessScore(), 1e-9);
        assertEquals(0.25, report.sessionComplexity(), 1e-9);
        assertTrue(report.concerns().isEmpty());
    }

    @Test
    @DisplayName("beginner, heavy session → complexity penalty 0.7, ready")
    void complexityPenalty() {
        ReadinessReport report = ReadinessAssessor.assess(ReadinessContext.rested(ExperienceLevel.BEGINNER), HEAVY);
        assertEquals(0.7, report.readinessScore(), 1e-9);
        assertTrue(report.isReady());
        assertEquals(1, report.recommendedModifications().size());
    }

    @Test
    @DisplayName("complexity + recent session + stress → 0.7·0.9·0.8 = 0.504, not ready")
    void allPenalties() {
        ReadinessContext context = new ReadinessContext(ExperienceLevel.BEGINNER, 6.0, 0.9);
        ReadinessReport report = ReadinessAssessor.assess(context, HEAVY);
        assertEquals(0.504, report.readinessScore(), 1e-9);
        assertFalse(report.isReady());
        assertEquals(3, report.concerns().size());
        assertEquals(2, report.preparationsNeeded().size());
    }

    @Test
    @DisplayName("expert ceiling 1.0 absorbs the heavy session")
    void expertCeiling() {
        ReadinessReport report = ReadinessAssessor.assess(ReadinessContext.rested(ExperienceLevel.EXPERT), HEAVY);
        assertEquals(1.0, report.readinessScore(), 1e-9);
    }

    @Test
    @DisplayName("complexity ceilings 0.4 / 0.6 / 0.8 / 1.0 by level")
    void ceilings() {
        assertEquals(0.4, ReadinessAssessor.maxComplexity(ExperienceLevel.BEGINNER));
        assertEquals(0.6, ReadinessAssessor.maxComplexity(ExperienceLevel.INTERMEDIATE));
        assertEquals(0.8, ReadinessAssessor.maxComplexity(ExperienceLevel.ADVANCED));
        assertEquals(1.0, ReadinessAssessor.maxComplexity(ExperienceLevel.EXPERT));
    }
}
