package com.entrainment.common.profile;

/**
 * Strategy contract for scoring how well two neural profiles match, for example when
 * pairing users in a group session or recommending a preset built for another profile.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging and no mutation of either profile</li>
 *   <li><b>Symmetric</b>: {@code score(a, b)} equals {@code score(b, a)}</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedCompatibilityScorer}. Register another as a
 * Spring {@code @Bean} in {@code ValidationConfig} to swap it in.
 */
public interface CompatibilityScorer {

    /**
     * @return sub-scores and overall score, each in [0.0, 1.0]; never {@code null}
     */
    CompatibilityScore score(NeuralProfile first, NeuralProfile second);
}
