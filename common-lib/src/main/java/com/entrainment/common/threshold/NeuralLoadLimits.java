package com.entrainment.common.threshold;

import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NeuralLoadLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Immutable per-level neural load limits.
 *
 * <pre>
 *   level          duration  intensity  gamma  transitions  load  break  integration×
 *   beginner          30       0.50       5        2        0.40    10      2.0
 *   intermediate      60       0.70      15        4        0.60    15      1.5
 *   advanced          90       0.85      25        6        0.80    20      1.2
 *   expert           120       0.95      40        8        0.90    30      1.0
 * </pre>
 *
 * <p>Design invariant: every ceiling is non-decreasing as the level rises. It is not
 * enforced at runtime; {@link #monotonicityViolations()} reports breaches and any breach
 * is logged once when the table loads.
 */
public final class NeuralLoadLimits {

    private static final Logger log = LoggerFactory.getLogger(NeuralLoadLimits.class);

    private static final Map<ExperienceLevel, NeuralLoadLimit> TABLE;

    /** Fields covered by the monotonicity invariant. The integration multiplier shrinks as the level rises. */
    private static final Map<String, ToDoubleFunction<NeuralLoadLimit>> MONOTONE_FIELDS = Map.of(
        "maxSessionDurationMinutes",       NeuralLoadLimit::maxSessionDurationMinutes,
        "maxFrequencyIntensity",           NeuralLoadLimit::maxFrequencyIntensity,
        "maxGammaExposureMinutes",         NeuralLoadLimit::maxGammaExposureMinutes,
        "maxStateTransitions",             NeuralLoadLimit::maxStateTransitions,
        "maxNeuralLoad",                   NeuralLoadLimit::maxNeuralLoad,
        "recommendedBreakIntervalMinutes", NeuralLoadLimit::recommendedBreakIntervalMinutes
    );

    static {
        Map<ExperienceLevel, NeuralLoadLimit> table = new EnumMap<>(ExperienceLevel.class);
        table.put(ExperienceLevel.BEGINNER,
            new NeuralLoadLimit(ExperienceLevel.BEGINNER, 30, 0.5, 5, 2, 0.4, 10, 2.0));
        table.put(ExperienceLevel.INTERMEDIATE,
            new NeuralLoadLimit(ExperienceLevel.INTERMEDIATE, 60, 0.7, 15, 4, 0.6, 15, 1.5));
        table.put(ExperienceLevel.ADVANCED,
            new NeuralLoadLimit(ExperienceLevel.ADVANCED, 90, 0.85, 25, 6, 0.8, 20, 1.2));
        table.put(ExperienceLevel.EXPERT,
            new NeuralLoadLimit(ExperienceLevel.EXPERT, 120, 0.95, 40, 8, 0.9, 30, 1.0));
        TABLE = Collections.unmodifiableMap(table);

        List<String> violations = monotonicityViolations(TABLE);
        if (!violations.isEmpty()) {
            log.warn("[NeuralLoadLimits] monotonicity invariant violated: {}", violations);
        }
    }

    private NeuralLoadLimits() {}

    public static NeuralLoadLimit forLevel(ExperienceLevel level) {
        return TABLE.get(level);
    }

    public static Map<ExperienceLevel, NeuralLoadLimit> all() {
        return TABLE;
    }

    public static List<String> monotonicityViolations() {
        return monotonicityViolations(TABLE);
    }

    /**
     * Compares every pair of levels (lower, higher) field by field.
     *
     * @return one description per breach; empty when the table is monotone
     */
    static List<String> monotonicityViolations(Map<ExperienceLevel, NeuralLoadLimit> table) {
        List<String> violations = new ArrayList<>();
        ExperienceLevel[] levels = ExperienceLevel.values();
        for (int lo = 0; lo < levels.length; lo++) {
            for (int hi = lo + 1; hi < levels.length; hi++) {
                NeuralLoadLimit lower  = table.get(levels[lo]);
                NeuralLoadLimit higher = table.get(levels[hi]);
                if (lower == null || higher == null) continue;
                for (Map.Entry<String, ToDoubleFunction<NeuralLoadLimit>> field : MONOTONE_FIELDS.entrySet()) {
                    double a = field.getValue().applyAsDouble(lower);
                    double b = field.getValue().applyAsDouble(higher);
                    if (b < a) {
                        violations.add(String.format("%s: %s=%s > %s=%s", field.getKey(),
                            levels[lo].wireName(), a, levels[hi].wireName(), b));
                    }
                }
            }
        }
        return violations;
    }
}
