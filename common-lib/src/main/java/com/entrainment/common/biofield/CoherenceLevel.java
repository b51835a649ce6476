package com.entrainment.common.biofield;

import com.entrainment.common.model.NumericRange;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Named bands of overall biofield coherence, lowest first. Adjacent bands share a
 * boundary; the lower band claims it.
 */
public enum CoherenceLevel {
    CHAOTIC(0.0, 0.2),
    INCOHERENT(0.2, 0.4),
    EMERGING(0.4, 0.6),
    COHERENT(0.6, 0.8),
    HIGHLY_COHERENT(0.8, 0.95),
    UNIFIED(0.95, 1.0);

    private final NumericRange range;

    CoherenceLevel(double lower, double upper) {
        this.range = NumericRange.of(lower, upper);
    }

    public NumericRange range() {
        return range;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
