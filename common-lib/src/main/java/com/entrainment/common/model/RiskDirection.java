package com.entrainment.common.model;

/**
 * Which end of a parameter's scale is dangerous.
 *
 * <ul>
 *   <li>{@link #HIGHER_IS_RISKIER}: bands for duration, intensity and exposure ascend safe → danger</li>
 *   <li>{@link #LOWER_IS_RISKIER}: comfort bands descend safe → danger</li>
 * </ul>
 */
public enum RiskDirection {
    HIGHER_IS_RISKIER,
    LOWER_IS_RISKIER
}
