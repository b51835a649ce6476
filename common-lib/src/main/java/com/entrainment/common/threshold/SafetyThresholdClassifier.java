package com.entrainment.common.threshold;

import com.entrainment.common.model.NumericRange;
import com.entrainment.common.model.RiskDirection;
import com.entrainment.common.model.SafetyBand;
import com.entrainment.common.model.SafetyThreshold;

/**
 * Maps a scalar onto the {@link SafetyBand} of a {@link SafetyThreshold}.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Bands are tried safe → warning → danger; the first that admits the value wins,
 *       so a boundary shared by two bands belongs to the safer one.</li>
 *   <li>{@code HIGHER_IS_RISKIER}: a band admits {@code value <= band.upper}. Values below
 *       the safe band's lower bound are therefore {@code SAFE}.</li>
 *   <li>{@code LOWER_IS_RISKIER}: a band admits {@code value >= band.lower}.</li>
 *   <li>Anything no band admits, and {@code NaN}, is {@code DANGER}.</li>
 * </ul>
 *
 * <p>Total over all doubles. No logging. No side-effects.
 */
public final class SafetyThresholdClassifier {

    private static final SafetyBand[] ORDER = { SafetyBand.SAFE, SafetyBand.WARNING, SafetyBand.DANGER };

    private SafetyThresholdClassifier() {}

    public static SafetyBand classify(double value, SafetyThreshold threshold) {
        if (Double.isNaN(value)) return SafetyBand.DANGER;
        for (SafetyBand band : ORDER) {
            if (admits(threshold.rangeFor(band), value, threshold.direction())) {
                return band;
            }
        }
        return SafetyBand.DANGER;
    }

    /**
     * Experience-level ceilings have no warning band.
     *
     * @return {@code SAFE} when {@code value <= limit}, otherwise {@code DANGER}
     */
    public static SafetyBand classifyAgainstLimit(double value, double limit) {
        return value <= limit ? SafetyBand.SAFE : SafetyBand.DANGER;
    }

    private static boolean admits(NumericRange range, double value, RiskDirection direction) {
        return direction == RiskDirection.HIGHER_IS_RISKIER
            ? value <= range.upper()
            : value >= range.lower();
    }
}
