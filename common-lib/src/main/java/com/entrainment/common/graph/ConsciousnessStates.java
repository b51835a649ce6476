package com.entrainment.common.graph;

import com.entrainment.common.model.ConsciousnessState;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NumericRange;

import java.util.List;

/**
 * Reference consciousness states, in the fixed order used for tie-breaking.
 *
 * <pre>
 *   depth 1  surface        neutral, focused_attention
 *   depth 2  relaxed        deep_relaxation, meditative_awareness
 *   depth 3  deep           theta_exploration, creative_flow, learning_state
 *   depth 4  profound       healing_trance
 *   depth 5  transcendent   gamma_awakening, transcendent_unity
 * </pre>
 */
public final class ConsciousnessStates {

    public static final String NEUTRAL              = "neutral";
    public static final String DEEP_RELAXATION      = "deep_relaxation";
    public static final String FOCUSED_ATTENTION    = "focused_attention";
    public static final String MEDITATIVE_AWARENESS = "meditative_awareness";
    public static final String THETA_EXPLORATION    = "theta_exploration";
    public static final String HEALING_TRANCE       = "healing_trance";
    public static final String GAMMA_AWAKENING      = "gamma_awakening";
    public static final String TRANSCENDENT_UNITY   = "transcendent_unity";
    public static final String CREATIVE_FLOW        = "creative_flow";
    public static final String LEARNING_STATE       = "learning_state";

    private static final List<ConsciousnessState> STATES = List.of(
        state(NEUTRAL, "Neutral Baseline", "alpha", 8.0, 13.0, 1,
            List.of("balanced", "natural", "receptive"), 5, 30, false, false,
            ExperienceLevel.BEGINNER, List.of("generally_safe")),
        state(DEEP_RELAXATION, "Deep Relaxation", "alpha", 8.0, 12.0, 2,
            List.of("deeply_relaxed", "peaceful", "restorative"), 15, 60, false, true,
            ExperienceLevel.BEGINNER, List.of("may_cause_drowsiness")),
        state(FOCUSED_ATTENTION, "Focused Attention", "low_beta", 13.0, 16.0, 1,
            List.of("focused", "alert", "concentrated"), 10, 45, false, false,
            ExperienceLevel.BEGINNER, List.of("avoid_overstimulation")),
        state(MEDITATIVE_AWARENESS, "Meditative Awareness", "alpha", 9.0, 12.0, 2,
            List.of("mindful", "aware", "peaceful", "clear"), 15, 90, true, true,
            ExperienceLevel.INTERMEDIATE, List.of("generally_safe", "allow_integration_time")),
        state(THETA_EXPLORATION, "Theta Exploration", "theta", 4.0, 8.0, 3,
            List.of("creative", "intuitive", "deep", "exploratory"), 20, 60, true, true,
            ExperienceLevel.INTERMEDIATE, List.of("emotional_release_possible", "comfortable_environment_needed")),
        state(HEALING_TRANCE, "Healing Trance", "delta", 1.0, 4.0, 4,
            List.of("healing", "restorative", "regenerative", "peaceful"), 30, 120, true, true,
            ExperienceLevel.INTERMEDIATE,
            List.of("drowsiness_likely", "avoid_driving_after", "healing_reactions_possible")),
        state(GAMMA_AWAKENING, "Gamma Awakening", "gamma", 30.0, 60.0, 5,
            List.of("heightened", "integrated", "aware", "transcendent"), 10, 30, true, true,
            ExperienceLevel.ADVANCED, List.of("advanced_users_only", "monitor_neural_load", "limit_exposure_time")),
        state(TRANSCENDENT_UNITY, "Transcendent Unity", "ultra_gamma", 60.0, 100.0, 5,
            List.of("transcendent", "unified", "mystical", "expanded"), 5, 20, true, true,
            ExperienceLevel.EXPERT, List.of("experts_only", "careful_monitoring", "extensive_integration_needed")),
        state(CREATIVE_FLOW, "Creative Flow", "theta", 5.0, 8.0, 3,
            List.of("creative", "flowing", "inspired", "expressive"), 20, 90, true, true,
            ExperienceLevel.INTERMEDIATE, List.of("emotional_expression_possible", "creative_blocks_may_surface")),
        state(LEARNING_STATE, "Enhanced Learning", "alpha", 8.0, 12.0, 3,
            List.of("receptive", "focused", "retentive", "clear"), 15, 60, false, true,
            ExperienceLevel.BEGINNER, List.of("generally_safe", "avoid_information_overload"))
    );

    private ConsciousnessStates() {}

    public static List<ConsciousnessState> all() {
        return STATES;
    }

    private static ConsciousnessState state(String id, String name, String band, double minHz, double maxHz,
                                            int depth, List<String> qualities, int minMinutes, int maxMinutes,
                                            boolean preparation, boolean integration, ExperienceLevel level,
                                            List<String> safety) {
        return new ConsciousnessState(id, name, band, NumericRange.of(minHz, maxHz), depth, qualities,
            NumericRange.of(minMinutes, maxMinutes), preparation, integration, level, safety);
    }
}
