package com.entrainment.common.threshold;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Health conditions that restrict entrainment sessions.
 *
 * <ul>
 *   <li><b>absolute</b>: the session must not run</li>
 *   <li><b>relative</b>: the session may run with caution</li>
 *   <li><b>precaution</b>: informational, no issue is raised</li>
 * </ul>
 */
public final class Contraindications {

    public enum Kind { ABSOLUTE, RELATIVE, PRECAUTION, NONE }

    public static final Set<String> ABSOLUTE = Set.of(
        "active_seizure_disorder",
        "recent_brain_surgery",
        "active_psychosis",
        "severe_mental_health_crisis",
        "pregnancy_first_trimester",
        "pacemaker_or_implanted_devices"
    );

    public static final Set<String> RELATIVE = Set.of(
        "history_of_seizures",
        "photosensitive_epilepsy",
        "severe_anxiety_disorder",
        "bipolar_disorder_active_episode",
        "recent_head_trauma",
        "pregnancy_any_trimester",
        "heart_rhythm_disorders",
        "medication_interactions_possible"
    );

    public static final Set<String> PRECAUTIONS = Set.of(
        "meditation_inexperience",
        "stress_sensitivity",
        "emotional_processing_sensitivity",
        "sleep_disorders",
        "chronic_health_conditions",
        "medication_use",
        "advanced_age",
        "hearing_impairments"
    );

    private Contraindications() {}

    /** Conditions are matched case-insensitively after trimming. */
    public static Kind classify(String condition) {
        if (condition == null) return Kind.NONE;
        String key = condition.trim().toLowerCase(Locale.ROOT);
        if (ABSOLUTE.contains(key))    return Kind.ABSOLUTE;
        if (RELATIVE.contains(key))    return Kind.RELATIVE;
        if (PRECAUTIONS.contains(key)) return Kind.PRECAUTION;
        return Kind.NONE;
    }

    public static List<String> ofKind(List<String> conditions, Kind kind) {
        return conditions.stream().filter(c -> classify(c) == kind).toList();
    }
}
