package com.entrainment.common.load;

import com.entrainment.common.model.SessionConfiguration;

/**
 * Estimates the neural load a session places on the user, in [0.0 – 1.0].
 *
 * <h3>Formula</h3>
 * <pre>
 *   durationFactor   = clamp01(duration / 60)
 *   intensityFactor  = clamp01(intensity)
 *   exposureFactor   = clamp01(highExposure / 30)
 *   transitionFactor = clamp01(transitions / 5)
 *
 *   load = clamp01(0.30·duration + 0.30·intensity + 0.25·exposure + 0.15·transitions)
 * </pre>
 *
 * <p>Monotonically non-decreasing in every input. Pure static utility, no state.
 */
public final class NeuralLoadEstimator {

    public static final double DURATION_WEIGHT   = 0.30;
    public static final double INTENSITY_WEIGHT  = 0.30;
    public static final double EXPOSURE_WEIGHT   = 0.25;
    public static final double TRANSITION_WEIGHT = 0.15;

    static final double DURATION_SATURATION_MINUTES = 60.0;
    static final double EXPOSURE_SATURATION_MINUTES = 30.0;
    static final double TRANSITION_SATURATION       = 5.0;

    /** Loads above this are flagged regardless of experience level. */
    public static final double HIGH_LOAD = 0.8;

    private NeuralLoadEstimator() {}

    public static double estimate(LoadInput input) {
        double load = DURATION_WEIGHT   * clamp01(input.durationMinutes() / DURATION_SATURATION_MINUTES)
                    + INTENSITY_WEIGHT  * clamp01(input.intensity())
                    + EXPOSURE_WEIGHT   * clamp01(input.highExposureMinutes() / EXPOSURE_SATURATION_MINUTES)
                    + TRANSITION_WEIGHT * clamp01(input.transitions() / TRANSITION_SATURATION);
        return clamp01(load);
    }

    public static double estimate(SessionConfiguration config) {
        return estimate(LoadInput.from(config));
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
