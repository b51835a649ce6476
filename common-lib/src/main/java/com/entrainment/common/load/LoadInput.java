package com.entrainment.common.load;

import com.entrainment.common.model.SessionConfiguration;

/**
 * Input projection of the session parameters the load estimate depends on.
 *
 * @param highExposureMinutes minutes spent in high-frequency (gamma) ranges
 * @param transitions         number of journey states
 */
public record LoadInput(
    double durationMinutes,
    double intensity,
    double highExposureMinutes,
    int    transitions
) {
    /** Missing fields count as zero. */
    public static LoadInput from(SessionConfiguration config) {
        return new LoadInput(
            config.durationMinutes() == null ? 0 : config.durationMinutes(),
            config.frequencyIntensity() == null ? 0.0 : config.frequencyIntensity(),
            config.gammaExposureMinutes() == null ? 0 : config.gammaExposureMinutes(),
            config.journeyLength());
    }
}
