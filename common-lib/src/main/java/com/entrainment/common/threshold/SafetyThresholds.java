package com.entrainment.common.threshold;

import com.entrainment.common.model.MonitoringFrequency;
import com.entrainment.common.model.NumericRange;
import com.entrainment.common.model.RiskDirection;
import com.entrainment.common.model.SafetyThreshold;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable reference table of global safety thresholds, built once at class load.
 *
 * <pre>
 *   parameter                  safe          warning       danger        units
 *   session_duration           5–60          60–90         90–999        minutes
 *   frequency_intensity        0.1–0.7       0.7–0.85      0.85–1.0      ratio
 *   biofield_coherence_rate    0.05–0.3      0.3–0.5       0.5–1.0       per minute
 *   gamma_exposure_duration    1–15          15–25         25–999        minutes
 *   state_transition_rate      1–3           3–5           5–999         per session
 *   neural_load_index          0.1–0.6       0.6–0.8       0.8–1.0       load
 *   comfort_level_score        0.7–1.0       0.4–0.7       0.0–0.4       comfort (lower is riskier)
 * </pre>
 */
public final class SafetyThresholds {

    public static final String SESSION_DURATION        = "session_duration";
    public static final String FREQUENCY_INTENSITY     = "frequency_intensity";
    public static final String BIOFIELD_COHERENCE_RATE = "biofield_coherence_rate";
    public static final String GAMMA_EXPOSURE_DURATION = "gamma_exposure_duration";
    public static final String STATE_TRANSITION_RATE   = "state_transition_rate";
    public static final String NEURAL_LOAD_INDEX       = "neural_load_index";
    public static final String COMFORT_LEVEL_SCORE     = "comfort_level_score";

    private static final Map<String, SafetyThreshold> TABLE;

    static {
        Map<String, SafetyThreshold> table = new LinkedHashMap<>();
        put(table, ascending(SESSION_DURATION, "Session Duration", 5, 60, 90, 999, "minutes",
            "Total session duration including preparation and integration", MonitoringFrequency.CONTINUOUS));
        put(table, ascending(FREQUENCY_INTENSITY, "Frequency Intensity", 0.1, 0.7, 0.85, 1.0, "normalized_ratio",
            "Neural entrainment frequency intensity level", MonitoringFrequency.CONTINUOUS));
        put(table, ascending(BIOFIELD_COHERENCE_RATE, "Biofield Coherence Rate", 0.05, 0.3, 0.5, 1.0,
            "coherence_per_minute", "Rate of biofield coherence change", MonitoringFrequency.FREQUENT));
        put(table, ascending(GAMMA_EXPOSURE_DURATION, "Gamma Exposure Duration", 1, 15, 25, 999, "minutes",
            "Total exposure to gamma frequency ranges", MonitoringFrequency.CONTINUOUS));
        put(table, ascending(STATE_TRANSITION_RATE, "State Transition Rate", 1, 3, 5, 999,
            "transitions_per_session", "Number of consciousness state transitions", MonitoringFrequency.PERIODIC));
        put(table, ascending(NEURAL_LOAD_INDEX, "Neural Load Index", 0.1, 0.6, 0.8, 1.0, "normalized_load",
            "Calculated neural processing load", MonitoringFrequency.CONTINUOUS));
        put(table, new SafetyThreshold(COMFORT_LEVEL_SCORE, "User Comfort Level",
            NumericRange.of(0.7, 1.0), NumericRange.of(0.4, 0.7), NumericRange.of(0.0, 0.4),
            "normalized_comfort", "User-reported comfort level", MonitoringFrequency.FREQUENT,
            RiskDirection.LOWER_IS_RISKIER));
        TABLE = Map.copyOf(table);
    }

    private SafetyThresholds() {}

    /**
     * @return the threshold, or {@code null} for an unknown key
     */
    public static SafetyThreshold get(String key) {
        return TABLE.get(key);
    }

    public static Map<String, SafetyThreshold> all() {
        return TABLE;
    }

    private static SafetyThreshold ascending(String key, String name, double safeLow, double warnLow,
                                             double dangerLow, double dangerHigh, String units,
                                             String description, MonitoringFrequency monitoring) {
        return new SafetyThreshold(key, name,
            NumericRange.of(safeLow, warnLow),
            NumericRange.of(warnLow, dangerLow),
            NumericRange.of(dangerLow, dangerHigh),
            units, description, monitoring, RiskDirection.HIGHER_IS_RISKIER);
    }

    private static void put(Map<String, SafetyThreshold> table, SafetyThreshold threshold) {
        table.put(threshold.key(), threshold);
    }
}
