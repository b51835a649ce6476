package com.entrainment.common.graph;

import com.entrainment.common.model.NumericRange;
import com.entrainment.common.model.StateTransition;
import com.entrainment.common.model.TransitionDifficulty;

import java.util.List;

import static com.entrainment.common.graph.ConsciousnessStates.*;

/** Reference transition edges, in the fixed order used for tie-breaking. */
public final class StateTransitions {

    private static final List<StateTransition> EDGES = List.of(
        edge(NEUTRAL, DEEP_RELAXATION, 5, 15, TransitionDifficulty.EASY,
            "gradual_alpha_entrainment", false, "generally_safe"),
        edge(NEUTRAL, FOCUSED_ATTENTION, 3, 10, TransitionDifficulty.EASY,
            "gentle_beta_increase", false, "avoid_overstimulation"),
        edge(NEUTRAL, MEDITATIVE_AWARENESS, 10, 20, TransitionDifficulty.EASY,
            "alpha_stabilization", true, "ensure_quiet_environment"),
        edge(DEEP_RELAXATION, THETA_EXPLORATION, 10, 25, TransitionDifficulty.MODERATE,
            "alpha_to_theta_bridge", true, "emotional_content_may_arise"),
        edge(DEEP_RELAXATION, HEALING_TRANCE, 15, 30, TransitionDifficulty.MODERATE,
            "alpha_to_delta_descent", true, "drowsiness_expected", "safe_environment_essential"),
        edge(MEDITATIVE_AWARENESS, GAMMA_AWAKENING, 15, 25, TransitionDifficulty.ADVANCED,
            "consciousness_elevation", true, "advanced_users_only", "monitor_neural_load"),
        edge(GAMMA_AWAKENING, TRANSCENDENT_UNITY, 10, 20, TransitionDifficulty.ADVANCED,
            "gamma_amplification", true, "experts_only", "extensive_monitoring_required"),
        edge(MEDITATIVE_AWARENESS, CREATIVE_FLOW, 8, 15, TransitionDifficulty.MODERATE,
            "alpha_theta_creative_bridge", true, "creative_materials_helpful"),
        edge(FOCUSED_ATTENTION, LEARNING_STATE, 5, 12, TransitionDifficulty.EASY,
            "beta_alpha_learning_optimization", false, "have_learning_materials_ready")
    );

    private StateTransitions() {}

    public static List<StateTransition> all() {
        return EDGES;
    }

    private static StateTransition edge(String from, String to, int minMinutes, int maxMinutes,
                                        TransitionDifficulty difficulty, String method,
                                        boolean preparation, String... notes) {
        return new StateTransition(from, to, NumericRange.of(minMinutes, maxMinutes), difficulty, method,
            preparation, List.of(notes));
    }
}
