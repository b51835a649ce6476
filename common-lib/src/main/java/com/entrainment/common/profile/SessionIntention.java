package com.entrainment.common.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * What the user wants from a session, with the tuning applied for it.
 */
public enum SessionIntention {

    HEALING(List.of("healing_trance", "deep_relaxation"), "delta", "solfeggio_528", 0.8, 1.2),
    CREATIVITY(List.of("creative_flow", "theta_exploration"), "theta", "golden_ratio_2", 0.9, 1.0),
    MEDITATION(List.of("meditative_awareness", "deep_relaxation"), "alpha", "schumann_resonance", 0.7, 1.1),
    TRANSCENDENCE(List.of("gamma_awakening", "transcendent_unity"), "gamma", "solfeggio_963", 0.6, 0.8),
    LEARNING(List.of("learning_state", "focused_attention"), "low_beta", "golden_ratio_1", 0.8, 0.9);

    private final List<String> preferredStates;
    private final String frequencyFocus;
    private final String biofieldEmphasis;
    private final double intensityModifier;
    private final double durationModifier;

    SessionIntention(List<String> preferredStates, String frequencyFocus, String biofieldEmphasis,
                     double intensityModifier, double durationModifier) {
        this.preferredStates   = preferredStates;
        this.frequencyFocus    = frequencyFocus;
        this.biofieldEmphasis  = biofieldEmphasis;
        this.intensityModifier = intensityModifier;
        this.durationModifier  = durationModifier;
    }

    public List<String> preferredStates()  { return preferredStates; }
    public String frequencyFocus()         { return frequencyFocus; }
    public String biofieldEmphasis()       { return biofieldEmphasis; }
    public double intensityModifier()      { return intensityModifier; }
    public double durationModifier()       { return durationModifier; }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing intentions fall back to {@link #MEDITATION}. */
    @JsonCreator
    public static SessionIntention fromName(String name) {
        if (name != null) {
            for (SessionIntention intention : values()) {
                if (intention.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return intention;
            }
        }
        return MEDITATION;
    }
}
