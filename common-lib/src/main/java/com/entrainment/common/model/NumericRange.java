package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Closed interval {@code [lower, upper]}. */
public record NumericRange(
    @JsonProperty("lower") double lower,
    @JsonProperty("upper") double upper
) {
    public NumericRange {
        if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
            throw new IllegalArgumentException("Invalid range [" + lower + ", " + upper + "]");
        }
    }

    public static NumericRange of(double lower, double upper) {
        return new NumericRange(lower, upper);
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    public double span() {
        return upper - lower;
    }
}
