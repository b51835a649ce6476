package com.entrainment.common.validation;

import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.StateTransition;
import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationResult;
import com.entrainment.common.model.ValidationSeverity;

import java.util.List;

/**
 * Audits a consciousness journey against the state graph.
 *
 * <h3>Per transition</h3>
 * <ul>
 *   <li>unknown endpoint → {@code error}; the remaining checks are skipped</li>
 *   <li>explicit edge whose difficulty the level may not take → {@code warning}</li>
 *   <li>no edge and a depth change above {@value #MAX_UNASSISTED_DEPTH_CHANGE} → {@code warning}</li>
 *   <li>target outside {@code safeTargets(from, level)} → {@code warning}</li>
 * </ul>
 *
 * <p>In strict mode every journey warning is reported as an {@code error}.
 */
public final class JourneyValidator {

    public static final String CODE_EMPTY_JOURNEY        = "JOURNEY_EMPTY";
    public static final String CODE_UNKNOWN_STATE        = "JOURNEY_UNKNOWN_STATE";
    public static final String CODE_DIFFICULT_TRANSITION = "TRANSITION_DIFFICULTY";
    public static final String CODE_DEPTH_JUMP           = "TRANSITION_DEPTH_JUMP";
    public static final String CODE_NOT_RECOMMENDED      = "TRANSITION_NOT_RECOMMENDED";

    static final int MAX_UNASSISTED_DEPTH_CHANGE = 2;
    static final int MAX_LISTED_TARGETS = 3;

    private final ConsciousnessStateGraph graph;

    public JourneyValidator(ConsciousnessStateGraph graph) {
        this.graph = graph;
    }

    /** Standalone check of a single {@code from → to} step. */
    public ValidationResult validateTransition(String from, String to, ExperienceLevel level) {
        ValidationResult.Builder result = ValidationResult.builder();
        ExperienceLevel effective = level == null ? ExperienceLevel.BEGINNER : level;

        if (!graph.isKnownState(from)) {
            result.add(ValidationSeverity.ERROR, "from_state", "Unknown source state: " + from,
                from, "", CODE_UNKNOWN_STATE);
        }
        if (!graph.isKnownState(to)) {
            result.add(ValidationSeverity.ERROR, "to_state", "Unknown target state: " + to,
                to, "", CODE_UNKNOWN_STATE);
        }
        if (result.hasSeverity(ValidationSeverity.ERROR)) {
            return result.build();
        }

        StateTransition edge = graph.lookupTransition(from, to);
        if (edge != null) {
            if (!edge.difficulty().permittedFor(effective)) {
                result.add(ValidationSeverity.WARNING, "transition_difficulty",
                    "Challenging transition for " + effective.wireName() + ": " + from + " -> " + to,
                    edge.difficulty().wireName(), "Consider intermediate states or gain more experience",
                    CODE_DIFFICULT_TRANSITION);
            }
        } else {
            int fromDepth = graph.depthOf(from);
            int toDepth = graph.depthOf(to);
            if (Math.abs(toDepth - fromDepth) > MAX_UNASSISTED_DEPTH_CHANGE) {
                result.add(ValidationSeverity.WARNING, "depth_difference",
                    "Large consciousness depth change: " + from + " (depth " + fromDepth + ") -> "
                        + to + " (depth " + toDepth + ")",
                    toDepth - fromDepth, "Consider using intermediate states for smoother transition",
                    CODE_DEPTH_JUMP);
            }
        }

        List<String> safe = graph.safeTargets(from, effective);
        if (!safe.contains(to)) {
            String suggestion = safe.isEmpty()
                ? "No recommended targets from " + from
                : "Recommended targets: " + String.join(", ", safe.subList(0, Math.min(MAX_LISTED_TARGETS, safe.size())));
            result.add(ValidationSeverity.WARNING, "safety",
                "Transition not in recommended safe transitions for " + effective.wireName(),
                to, suggestion, CODE_NOT_RECOMMENDED);
        }
        return result.build();
    }

    /**
     * Checks every state and every consecutive step of a journey. Issue paths point into
     * {@code consciousness_journey}.
     */
    public ValidationResult validateJourney(List<String> journey, ExperienceLevel level, boolean strict) {
        ValidationResult.Builder result = ValidationResult.builder();
        if (journey == null || journey.isEmpty()) {
            return result.add(ValidationSeverity.ERROR, "consciousness_journey",
                "Consciousness journey cannot be empty", null,
                "Start and end the journey in neutral", CODE_EMPTY_JOURNEY).build();
        }

        for (int i = 0; i < journey.size(); i++) {
            String state = journey.get(i);
            if (!graph.isKnownState(state)) {
                result.add(ValidationSeverity.ERROR, "consciousness_journey[" + i + "]",
                    "Unknown consciousness state: " + state, state,
                    "Use one of: " + String.join(", ", graph.stateIds()), CODE_UNKNOWN_STATE);
            }
        }

        for (int i = 0; i + 1 < journey.size(); i++) {
            String from = journey.get(i);
            String to = journey.get(i + 1);
            // Unknown endpoints were already reported above.
            if (!graph.isKnownState(from) || !graph.isKnownState(to)) continue;
            String path = "consciousness_journey[" + i + "→" + (i + 1) + "]";
            for (ValidationIssue issue : validateTransition(from, to, level).issues()) {
                ValidationIssue located = issue.withFieldPath(path);
                if (strict && located.severity() == ValidationSeverity.WARNING) {
                    located = located.withSeverity(ValidationSeverity.ERROR);
                }
                result.add(located);
            }
        }
        return result.build();
    }
}
