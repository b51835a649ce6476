package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Named brainwave frequency band. Bands may overlap (e.g. beta contains low beta).
 */
public record BrainwaveRange(
    @JsonProperty("key")                    String key,
    @JsonProperty("name")                   String name,
    @JsonProperty("minFrequency")           double minFrequency,
    @JsonProperty("maxFrequency")           double maxFrequency,
    @JsonProperty("peakFrequency")          double peakFrequency,
    @JsonProperty("consciousnessQualities") List<String> consciousnessQualities,
    @JsonProperty("cautions")               List<String> cautions
) {
    public BrainwaveRange {
        consciousnessQualities = List.copyOf(consciousnessQualities);
        cautions               = List.copyOf(cautions);
    }

    public boolean contains(double hz) {
        return hz >= minFrequency && hz <= maxFrequency;
    }

    /** Bands flagged for expert use only. */
    public boolean isExpertOnly() {
        return cautions.stream().anyMatch(c -> c.contains("only") && c.contains("expert"));
    }
}
