package com.entrainment.common.biofield;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference frequencies, in Hz, keyed by name in ascending order.
 */
public final class FrequencyReference {

    public static final double PHI = 1.618033988749895;

    /** Match tolerance relative to the reference frequency. */
    public static final double SOLFEGGIO_RELATIVE_TOLERANCE = 0.01;
    public static final double SCHUMANN_TOLERANCE_HZ         = 0.5;
    public static final double GOLDEN_RATIO_TOLERANCE_HZ     = 0.1;

    public static final Map<String, Double> SOLFEGGIO;
    public static final Map<String, Double> SCHUMANN_MODES;
    public static final Map<String, Double> GOLDEN_RATIO_HARMONICS;

    static {
        Map<String, Double> solfeggio = new LinkedHashMap<>();
        for (int hz : new int[] { 174, 285, 396, 417, 528, 639, 741, 852, 963 }) {
            solfeggio.put(hz + "_hz", (double) hz);
        }
        SOLFEGGIO = Collections.unmodifiableMap(solfeggio);

        Map<String, Double> schumann = new LinkedHashMap<>();
        schumann.put("fundamental",  7.83);
        schumann.put("second_mode",  14.3);
        schumann.put("third_mode",   20.8);
        schumann.put("fourth_mode",  27.3);
        schumann.put("fifth_mode",   33.8);
        schumann.put("sixth_mode",   39.0);
        schumann.put("seventh_mode", 45.0);
        SCHUMANN_MODES = Collections.unmodifiableMap(schumann);

        Map<String, Double> golden = new LinkedHashMap<>();
        for (int power = -3; power <= 4; power++) {
            String key = power < 0 ? "phi_negative_" + (-power) : "phi_" + power;
            golden.put(key, Math.pow(PHI, power));
        }
        GOLDEN_RATIO_HARMONICS = Collections.unmodifiableMap(golden);
    }

    private FrequencyReference() {}
}
