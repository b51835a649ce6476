package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional biofield sub-configuration; each component is a normalized 0–1 weight.
 */
public record BiofieldConfiguration(
    @JsonProperty("schumann_alignment")     Double schumannAlignment,
    @JsonProperty("solfeggio_integration")  Double solfeggioIntegration,
    @JsonProperty("golden_ratio_harmonics") Double goldenRatioHarmonics
) {
    public static final String SCHUMANN_ALIGNMENT     = "schumann_alignment";
    public static final String SOLFEGGIO_INTEGRATION  = "solfeggio_integration";
    public static final String GOLDEN_RATIO_HARMONICS = "golden_ratio_harmonics";

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (schumannAlignment != null)    map.put(SCHUMANN_ALIGNMENT, schumannAlignment);
        if (solfeggioIntegration != null) map.put(SOLFEGGIO_INTEGRATION, solfeggioIntegration);
        if (goldenRatioHarmonics != null) map.put(GOLDEN_RATIO_HARMONICS, goldenRatioHarmonics);
        return map;
    }
}
