package com.entrainment.common.graph;

import com.entrainment.common.model.BrainwaveRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference brainwave bands in ascending frequency order. Some bands overlap
 * (beta spans low and high beta); lookups by frequency return the first match.
 */
public final class BrainwaveBands {

    private static final Map<String, BrainwaveRange> TABLE;

    static {
        Map<String, BrainwaveRange> table = new LinkedHashMap<>();
        put(table, new BrainwaveRange("infra_low", "Infra-Low", 0.0, 0.5, 0.1,
            List.of("cellular_regeneration", "deep_healing", "autonomic_balance"),
            List.of("only_for_healing_sessions", "avoid_during_active_states")));
        put(table, new BrainwaveRange("deep_delta", "Deep Delta", 0.1, 2.0, 1.0,
            List.of("profound_rest", "cellular_regeneration", "immune_enhancement"),
            List.of("may_cause_drowsiness", "avoid_when_driving")));
        put(table, new BrainwaveRange("delta", "Delta", 1.0, 4.0, 2.5,
            List.of("deep_rest", "healing", "subconscious_processing"),
            List.of("drowsiness_possible", "avoid_before_driving")));
        put(table, new BrainwaveRange("theta", "Theta", 4.0, 8.0, 6.0,
            List.of("deep_meditation", "creativity", "intuitive_insights", "memory_access"),
            List.of("may_trigger_emotional_release", "monitor_comfort_levels")));
        put(table, new BrainwaveRange("alpha", "Alpha", 8.0, 13.0, 10.0,
            List.of("relaxed_awareness", "peaceful_mind", "receptive_learning"),
            List.of("generally_safe", "ideal_for_beginners")));
        put(table, new BrainwaveRange("low_beta", "Low Beta", 13.0, 16.0, 14.0,
            List.of("calm_focus", "relaxed_attention", "peaceful_productivity"),
            List.of("generally_safe", "good_for_work_sessions")));
        put(table, new BrainwaveRange("beta", "Beta", 13.0, 30.0, 18.0,
            List.of("focused_attention", "analytical_thinking", "active_problem_solving"),
            List.of("avoid_overstimulation", "monitor_for_anxiety")));
        put(table, new BrainwaveRange("high_beta", "High Beta", 23.0, 30.0, 26.0,
            List.of("intense_focus", "high_arousal", "stress_response"),
            List.of("risk_of_anxiety", "limit_exposure_time", "monitor_stress_levels")));
        put(table, new BrainwaveRange("gamma", "Gamma", 30.0, 100.0, 40.0,
            List.of("heightened_awareness", "consciousness_integration", "transcendent_insights"),
            List.of("advanced_users_only", "monitor_neural_load", "limit_exposure")));
        put(table, new BrainwaveRange("ultra_gamma", "Ultra Gamma", 80.0, 200.0, 100.0,
            List.of("transcendent_consciousness", "unity_experiences", "extreme_awareness"),
            List.of("experts_only", "careful_monitoring_required", "limit_duration")));
        TABLE = Collections.unmodifiableMap(table);
    }

    private BrainwaveBands() {}

    /** @return the band, or {@code null} when unknown */
    public static BrainwaveRange get(String key) {
        return key == null ? null : TABLE.get(key);
    }

    public static boolean isKnown(String key) {
        return key != null && TABLE.containsKey(key);
    }

    public static List<BrainwaveRange> all() {
        return List.copyOf(TABLE.values());
    }

    public static List<String> keys() {
        return new ArrayList<>(TABLE.keySet());
    }

    /** @return the first band in table order containing {@code hz}, or {@code null} */
    public static BrainwaveRange firstContaining(double hz) {
        for (BrainwaveRange range : TABLE.values()) {
            if (range.contains(hz)) return range;
        }
        return null;
    }

    private static void put(Map<String, BrainwaveRange> table, BrainwaveRange range) {
        table.put(range.key(), range);
    }
}
