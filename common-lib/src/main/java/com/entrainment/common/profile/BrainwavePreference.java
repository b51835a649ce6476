package com.entrainment.common.profile;

import com.entrainment.common.model.NumericRange;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param frequencyBand      brainwave band key ({@code "alpha"})
 * @param preferredIntensity intensity the user responds to best, in [0,1]
 * @param responseQuality    {@code excellent | good | moderate | poor}
 */
public record BrainwavePreference(
    @JsonProperty("frequency_band")      String frequencyBand,
    @JsonProperty("preferred_intensity") double preferredIntensity,
    @JsonProperty("tolerance_range")     NumericRange toleranceRange,
    @JsonProperty("response_quality")    String responseQuality,
    @JsonProperty("notes")               String notes
) {
    public BrainwavePreference {
        notes = notes == null ? "" : notes;
    }

    public BrainwavePreference withPreferredIntensity(double intensity) {
        return new BrainwavePreference(frequencyBand, intensity, toleranceRange, responseQuality, notes);
    }
}
