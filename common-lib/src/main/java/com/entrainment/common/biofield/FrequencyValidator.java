package com.entrainment.common.biofield;

import com.entrainment.common.graph.BrainwaveBands;
import com.entrainment.common.model.BrainwaveRange;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;

import java.util.Map;

/**
 * Checks a single frequency against safety limits and the reference table for its type.
 *
 * <h3>Checks</h3>
 * <ul>
 *   <li>{@code hz <= 0} → error; nothing else is checked</li>
 *   <li>{@code hz > 1000} → warning</li>
 *   <li>brainwave: first containing band is tagged as {@code brainwave_range}; an
 *       expert-only band adds a warning; no band adds a warning</li>
 *   <li>solfeggio: nearest tone within 1 % → {@code solfeggio_frequency}, else info</li>
 *   <li>schumann: first mode within 0.5 Hz → {@code schumann_mode}, else info</li>
 *   <li>golden ratio: first harmonic within 0.1 Hz → {@code golden_ratio_harmonic}, else info</li>
 * </ul>
 */
public final class FrequencyValidator {

    public static final double MAX_SAFE_FREQUENCY_HZ = 1000.0;

    public static final String META_BRAINWAVE_RANGE       = "brainwave_range";
    public static final String META_SOLFEGGIO_FREQUENCY   = "solfeggio_frequency";
    public static final String META_SCHUMANN_MODE         = "schumann_mode";
    public static final String META_GOLDEN_RATIO_HARMONIC = "golden_ratio_harmonic";

    private FrequencyValidator() {}

    public static ValidationResult validate(double hz, FrequencyType type) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (!(hz > 0)) {
            result.add(ValidationSeverity.ERROR, "frequency_value", "Frequency must be positive: " + hz,
                hz, "", "FREQUENCY_NOT_POSITIVE");
            return result.build();
        }
        if (hz > MAX_SAFE_FREQUENCY_HZ) {
            result.add(ValidationSeverity.WARNING, "frequency_value", "Very high frequency detected: " + hz + " Hz",
                hz, "Consider using lower frequencies for safety", "FREQUENCY_VERY_HIGH");
        }

        if (type == null) return result.build();
        switch (type) {
            case BRAINWAVE    -> brainwave(hz, result);
            case SOLFEGGIO    -> solfeggio(hz, result);
            case SCHUMANN     -> firstWithin(hz, FrequencyReference.SCHUMANN_MODES,
                FrequencyReference.SCHUMANN_TOLERANCE_HZ, META_SCHUMANN_MODE, "schumann_match", "SCHUMANN_UNMATCHED",
                "Schumann resonance modes",
                "Consider using Schumann resonance frequencies for optimal Earth connection", result);
            case GOLDEN_RATIO -> firstWithin(hz, FrequencyReference.GOLDEN_RATIO_HARMONICS,
                FrequencyReference.GOLDEN_RATIO_TOLERANCE_HZ, META_GOLDEN_RATIO_HARMONIC, "golden_ratio_match",
                "GOLDEN_RATIO_UNMATCHED",
                "golden ratio harmonics",
                "Consider using golden ratio harmonics for optimal natural resonance", result);
        }
        return result.build();
    }

    private static void brainwave(double hz, ValidationResult.Builder result) {
        BrainwaveRange band = BrainwaveBands.firstContaining(hz);
        if (band == null) {
            result.add(ValidationSeverity.WARNING, "brainwave_range",
                "Frequency " + hz + " Hz does not match known brainwave ranges", hz,
                "Consider using frequencies within established brainwave ranges", "BRAINWAVE_UNMATCHED");
            return;
        }
        result.metadata(META_BRAINWAVE_RANGE, band.key());
        for (String caution : band.cautions()) {
            if (caution.contains("only") && caution.contains("expert")) {
                result.add(ValidationSeverity.WARNING, "brainwave_safety",
                    "Frequency " + hz + " Hz is in " + band.key() + " range: " + caution, hz, "",
                    "BRAINWAVE_EXPERT_ONLY");
            }
        }
    }

    private static void solfeggio(double hz, ValidationResult.Builder result) {
        String match = null;
        double best = Double.POSITIVE_INFINITY;
        for (Map.Entry<String, Double> tone : FrequencyReference.SOLFEGGIO.entrySet()) {
            double difference = Math.abs(hz - tone.getValue());
            double tolerance  = tone.getValue() * FrequencyReference.SOLFEGGIO_RELATIVE_TOLERANCE;
            if (difference <= tolerance && difference < best) {
                match = tone.getKey();
                best = difference;
            }
        }
        if (match != null) {
            result.metadata(META_SOLFEGGIO_FREQUENCY, match);
        } else {
            result.add(ValidationSeverity.INFO, "solfeggio_match",
                "Frequency " + hz + " Hz does not closely match known Solfeggio frequencies", hz,
                "Consider using established Solfeggio frequencies for optimal healing properties",
                "SOLFEGGIO_UNMATCHED");
        }
    }

    private static void firstWithin(double hz, Map<String, Double> table, double tolerance, String metaKey,
                                    String path, String code, String family, String suggestion,
                                    ValidationResult.Builder result) {
        for (Map.Entry<String, Double> entry : table.entrySet()) {
            if (Math.abs(hz - entry.getValue()) <= tolerance) {
                result.metadata(metaKey, entry.getKey());
                return;
            }
        }
        result.add(ValidationSeverity.INFO, path,
            "Frequency " + hz + " Hz does not match known " + family, hz, suggestion, code);
    }
}
