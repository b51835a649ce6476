package com.entrainment.common.biofield;

import com.entrainment.common.exception.EngineException;

/**
 * Combines component coherences into one overall value in [0.0 – 1.0].
 *
 * <pre>
 *   overall = clamp01( Σ wᵢ·cᵢ / Σ wᵢ )      default weights 1/3 each
 * </pre>
 *
 * <p>Pure static utility.
 */
public final class BiofieldCoherence {

    private static final double[] EQUAL_WEIGHTS = { 1.0 / 3, 1.0 / 3, 1.0 / 3 };

    private BiofieldCoherence() {}

    public static double calculate(double schumann, double solfeggio, double goldenRatio) {
        return calculate(schumann, solfeggio, goldenRatio, EQUAL_WEIGHTS);
    }

    /**
     * @param weights three non-negative weights with a positive sum; normalized before use
     */
    public static double calculate(double schumann, double solfeggio, double goldenRatio, double[] weights) {
        if (weights == null || weights.length != 3) {
            throw new EngineException("BiofieldCoherence", "exactly three weights are required");
        }
        double total = weights[0] + weights[1] + weights[2];
        if (!(total > 0)) {
            throw new EngineException("BiofieldCoherence", "weights must have a positive sum");
        }
        double overall = (schumann * weights[0] + solfeggio * weights[1] + goldenRatio * weights[2]) / total;
        return Math.max(0.0, Math.min(1.0, overall));
    }

    /** First level whose range contains the value; {@link CoherenceLevel#CHAOTIC} when none does. */
    public static CoherenceLevel levelFor(double coherence) {
        for (CoherenceLevel level : CoherenceLevel.values()) {
            if (level.range().contains(coherence)) return level;
        }
        return CoherenceLevel.CHAOTIC;
    }
}
