package com.entrainment.common.graph;

import com.entrainment.common.exception.EngineException;
import com.entrainment.common.model.ConsciousnessState;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.StateTransition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed graph of consciousness states and the transitions between them.
 *
 * <p>Immutable once built; every query is a pure function of the tables it was built
 * from. Iteration order of states and edges is the table order and is relied on for
 * deterministic tie-breaking.
 *
 * <h3>Safe targets</h3>
 * {@code to} is a safe target of {@code from} for a level when
 * <ul>
 *   <li>an edge {@code from → to} exists,</li>
 *   <li>its difficulty is easy or moderate, or the level is advanced or expert,</li>
 *   <li>and {@code to} is open to the level. Levels are cumulative: a level may enter
 *       every state of its own tier and all lower tiers.</li>
 * </ul>
 *
 * <h3>Journey planning</h3>
 * A greedy heuristic, not a shortest-path search. The direct edge is taken when its
 * difficulty is permitted. Otherwise each step first checks whether the target is a
 * safe target of the current state; if not, the first safe target whose depth lies
 * strictly between the current depth and the target depth (target depth included)
 * is appended. The walk stops at the hop budget or when no candidate qualifies.
 */
public final class ConsciousnessStateGraph {

    /** Depth reported for states missing from the graph. */
    public static final int DEFAULT_DEPTH = 1;

    /** Integration minutes for a state missing from the graph. */
    public static final int DEFAULT_INTEGRATION_MINUTES = 5;

    private static final int[] BASE_INTEGRATION_MINUTES_BY_DEPTH = { 2, 5, 10, 20, 30 };

    private static final ConsciousnessStateGraph DEFAULT =
        new ConsciousnessStateGraph(ConsciousnessStates.all(), StateTransitions.all());

    private final Map<String, ConsciousnessState> states;
    private final List<StateTransition> transitions;

    public ConsciousnessStateGraph(List<ConsciousnessState> states, List<StateTransition> transitions) {
        Map<String, ConsciousnessState> byId = new LinkedHashMap<>();
        for (ConsciousnessState state : states) {
            if (byId.put(state.id(), state) != null) {
                throw new EngineException("ConsciousnessStateGraph", "duplicate state: " + state.id());
            }
        }
        this.states = Collections.unmodifiableMap(byId);
        this.transitions = List.copyOf(transitions);
    }

    /** Graph over the reference states and transitions. */
    public static ConsciousnessStateGraph defaultGraph() {
        return DEFAULT;
    }

    // ── lookups ──────────────────────────────────────────────────────────────

    public boolean isKnownState(String id) {
        return id != null && states.containsKey(id);
    }

    /** @return the state, or {@code null} when unknown */
    public ConsciousnessState stateInfo(String id) {
        return id == null ? null : states.get(id);
    }

    public List<ConsciousnessState> states() {
        return List.copyOf(states.values());
    }

    public List<String> stateIds() {
        return new ArrayList<>(states.keySet());
    }

    /** @return the edge, or {@code null} when {@code from → to} is not in the graph */
    public StateTransition lookupTransition(String from, String to) {
        for (StateTransition transition : transitions) {
            if (transition.connects(from, to)) return transition;
        }
        return null;
    }

    public int depthOf(String id) {
        ConsciousnessState state = stateInfo(id);
        return state == null ? DEFAULT_DEPTH : state.depth();
    }

    /** States whose frequency range contains {@code hz}, in table order. */
    public List<String> statesForFrequency(double hz) {
        return states.values().stream()
            .filter(s -> s.frequencyRange().contains(hz))
            .map(ConsciousnessState::id)
            .toList();
    }

    /** States open to a level, in table order. */
    public List<String> statesAllowedFor(ExperienceLevel level) {
        return states.values().stream()
            .filter(s -> s.allowedFor(level))
            .map(ConsciousnessState::id)
            .toList();
    }

    /**
     * Recommended integration time after leaving a state.
     * <pre>
     *   base by depth 1..5 = 2, 5, 10, 20, 30 minutes
     *   ×2 when the state needs integration
     * </pre>
     */
    public int integrationMinutes(String id) {
        ConsciousnessState state = stateInfo(id);
        if (state == null) return DEFAULT_INTEGRATION_MINUTES;
        int base = BASE_INTEGRATION_MINUTES_BY_DEPTH[state.depth() - 1];
        return state.integrationNeeded() ? base * 2 : base;
    }

    // ── reasoning ────────────────────────────────────────────────────────────

    public List<String> safeTargets(String from, ExperienceLevel level) {
        List<String> targets = new ArrayList<>();
        for (StateTransition transition : transitions) {
            if (!transition.fromState().equals(from)) continue;
            ConsciousnessState target = states.get(transition.toState());
            if (target == null || !target.allowedFor(level)) continue;
            if (transition.difficulty().permittedFor(level)) {
                targets.add(transition.toState());
            }
        }
        return targets;
    }

    /**
     * Plans a route of at most {@code maxHops} transitions.
     *
     * @throws EngineException when {@code maxHops} is negative or either endpoint is not a known state
     */
    public JourneyPlan planJourney(String start, String end, ExperienceLevel level, int maxHops) {
        if (maxHops < 0) {
            throw new EngineException("ConsciousnessStateGraph", "maxHops must be >= 0, was " + maxHops);
        }
        requireKnownState("start", start);
        requireKnownState("end", end);
        List<String> path = new ArrayList<>();
        path.add(start);
        if (start.equals(end) || maxHops == 0) {
            return new JourneyPlan(path, start.equals(end));
        }

        StateTransition direct = lookupTransition(start, end);
        if (direct != null && direct.difficulty().permittedFor(level)) {
            path.add(end);
            return new JourneyPlan(path, true);
        }

        int targetDepth = depthOf(end);
        String current = start;
        while (path.size() - 1 < maxHops && !current.equals(end)) {
            List<String> candidates = safeTargets(current, level);
            if (candidates.contains(end)) {
                current = end;
            } else {
                String next = firstTowards(candidates, depthOf(current), targetDepth);
                if (next == null) break;
                current = next;
            }
            path.add(current);
        }
        return new JourneyPlan(path, current.equals(end));
    }

    private void requireKnownState(String role, String id) {
        if (!isKnownState(id)) {
            throw new EngineException("ConsciousnessStateGraph", "Unknown " + role + " state: " + id);
        }
    }

    private String firstTowards(List<String> candidates, int currentDepth, int targetDepth) {
        for (String candidate : candidates) {
            int depth = depthOf(candidate);
            boolean deeper    = targetDepth > currentDepth && depth > currentDepth && depth <= targetDepth;
            boolean shallower = targetDepth < currentDepth && depth < currentDepth && depth >= targetDepth;
            if (deeper || shallower) return candidate;
        }
        return null;
    }
}
