package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable output of a {@link CompatibilityScorer} run. Every field lies in [0.0, 1.0].
 */
public record CompatibilityScore(
    @JsonProperty("overall")              double overall,
    @JsonProperty("brainwavePreferences") double brainwavePreferences,
    @JsonProperty("consciousnessStates")  double consciousnessStates,
    @JsonProperty("biofieldResonance")    double biofieldResonance,
    @JsonProperty("sessionPreferences")   double sessionPreferences,
    @JsonProperty("safetyCompatibility")  double safetyCompatibility
) {}
