package com.entrainment.common.profile;

import com.entrainment.common.model.NumericRange;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * @param solfeggioResponsiveness responsiveness per solfeggio tone key ({@code "528_hz"})
 * @param fieldStability          {@code stable | variable | sensitive}
 */
public record BiofieldProfile(
    @JsonProperty("schumann_resonance_sensitivity") double schumannResonanceSensitivity,
    @JsonProperty("solfeggio_responsiveness")       Map<String, Double> solfeggioResponsiveness,
    @JsonProperty("golden_ratio_harmony_level")     double goldenRatioHarmonyLevel,
    @JsonProperty("coherence_baseline")             double coherenceBaseline,
    @JsonProperty("field_stability")                String fieldStability,
    @JsonProperty("optimal_coherence_range")        NumericRange optimalCoherenceRange
) {
    public BiofieldProfile {
        solfeggioResponsiveness = solfeggioResponsiveness == null ? Map.of() : Map.copyOf(solfeggioResponsiveness);
    }

    public BiofieldProfile withCoherenceBaseline(double baseline) {
        return new BiofieldProfile(schumannResonanceSensitivity, solfeggioResponsiveness, goldenRatioHarmonyLevel,
            baseline, fieldStability, optimalCoherenceRange);
    }
}
