package com.entrainment.common.biofield;

import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Validates measured biofield coherence readings keyed by component.
 *
 * <p>Each missing component is a warning. A non-numeric reading is an error; a reading
 * outside [0,1] is an error. Readings below 0.2 warn, readings above 0.95 are noted as
 * info. With at least two readings the overall coherence and its level are attached as
 * metadata, with absent components counted as 0.5.
 */
public final class CoherenceValidator {

    public static final String SCHUMANN_RESONANCE     = "schumann_resonance";
    public static final String SOLFEGGIO_HARMONICS    = "solfeggio_harmonics";
    public static final String GOLDEN_RATIO_ALIGNMENT = "golden_ratio_alignment";

    public static final String META_OVERALL_COHERENCE = "overall_coherence";
    public static final String META_COHERENCE_LEVEL   = "coherence_level";

    static final double LOW_COHERENCE         = 0.2;
    static final double EXCEPTIONAL_COHERENCE = 0.95;
    static final double ABSENT_COMPONENT      = 0.5;

    private static final List<String> COMPONENTS =
        List.of(SCHUMANN_RESONANCE, SOLFEGGIO_HARMONICS, GOLDEN_RATIO_ALIGNMENT);

    private CoherenceValidator() {}

    public static ValidationResult validate(Map<String, ?> readings) {
        ValidationResult.Builder result = ValidationResult.builder();

        for (String component : COMPONENTS) {
            if (!readings.containsKey(component)) {
                result.add(ValidationSeverity.WARNING, "biofield_components",
                    "Missing biofield component: " + component, null,
                    "Add " + component + " for complete biofield analysis", "COHERENCE_COMPONENT_MISSING");
            }
        }

        for (Map.Entry<String, ?> reading : readings.entrySet()) {
            String path = "coherence." + reading.getKey();
            Object raw = reading.getValue();
            if (!(raw instanceof Number number)) {
                result.add(ValidationSeverity.ERROR, path,
                    "Invalid coherence value type: " + (raw == null ? "null" : raw.getClass().getSimpleName()),
                    raw, "", "COHERENCE_TYPE");
                continue;
            }
            double value = number.doubleValue();
            if (!(value >= 0.0 && value <= 1.0)) {
                result.add(ValidationSeverity.ERROR, path, "Coherence value out of range [0,1]: " + value,
                    value, "", "COHERENCE_RANGE");
            }
            if (value < LOW_COHERENCE) {
                result.add(ValidationSeverity.WARNING, path,
                    "Low coherence detected in " + reading.getKey() + ": " + percent(value), value,
                    "Consider focusing on stabilizing this biofield component", "COHERENCE_LOW");
            } else if (value > EXCEPTIONAL_COHERENCE) {
                result.add(ValidationSeverity.INFO, path,
                    "Exceptionally high coherence in " + reading.getKey() + ": " + percent(value), value,
                    "Excellent biofield stability", "COHERENCE_EXCEPTIONAL");
            }
        }

        if (readings.size() >= 2) {
            double overall = BiofieldCoherence.calculate(
                component(readings, SCHUMANN_RESONANCE),
                component(readings, SOLFEGGIO_HARMONICS),
                component(readings, GOLDEN_RATIO_ALIGNMENT));
            result.metadata(META_OVERALL_COHERENCE, overall);
            result.metadata(META_COHERENCE_LEVEL, BiofieldCoherence.levelFor(overall).wireName());
        }
        return result.build();
    }

    private static double component(Map<String, ?> readings, String key) {
        return readings.get(key) instanceof Number n ? n.doubleValue() : ABSENT_COMPONENT;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
