package com.entrainment.common.profile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a completed session into a profile and returns the updated copy. The input
 * profile is never modified.
 *
 * <h3>Adjustments</h3>
 * <pre>
 *   state comfort     &gt; 0.8   affinity +0.05 (max 1), state becomes a favorite
 *   state comfort     &lt; 0.4   affinity −0.05 (min 0), state becomes challenging
 *   band effectiveness &gt; 0.8  preferred intensity +0.02 (max 1)
 *   band effectiveness &lt; 0.3  preferred intensity −0.02 (min 0.1)
 *   coherence − baseline &gt; 0.1   baseline +0.02 (max 1)
 *   coherence − baseline &lt; −0.1  baseline −0.02 (min 0)
 *   average comfort   running mean with weight min(1, 1/totalSessions)
 * </pre>
 *
 * <p>Favorite and challenging lists evict their oldest entry beyond five; the outcome
 * log keeps the latest ten. A beginner profile becomes personalized at ten sessions.
 */
public final class ProfileSessionUpdater {

    static final double AFFINITY_STEP           = 0.05;
    static final double INTENSITY_STEP          = 0.02;
    static final double MIN_PREFERRED_INTENSITY = 0.1;
    static final double COHERENCE_STEP          = 0.02;
    static final double COHERENCE_TREND         = 0.1;

    static final double HIGH_COMFORT          = 0.8;
    static final double LOW_COMFORT           = 0.4;
    static final double HIGH_EFFECTIVENESS    = 0.8;
    static final double LOW_EFFECTIVENESS     = 0.3;
    static final double DEFAULT_COMFORT       = 0.8;
    static final double DEFAULT_EFFECTIVENESS = 0.5;

    public static final int PERSONALIZE_AFTER_SESSIONS = 10;

    private ProfileSessionUpdater() {}

    public static NeuralProfile applySession(NeuralProfile profile, SessionOutcome outcome) {
        return applySession(profile, outcome, Clock.systemUTC());
    }

    public static NeuralProfile applySession(NeuralProfile profile, SessionOutcome outcome, Clock clock) {
        Instant now = clock.instant();
        SessionHistory history = profile.sessionHistory() == null
            ? SessionHistory.empty() : profile.sessionHistory();

        int totalSessions = history.totalSessions() + 1;
        double totalHours = history.totalHours() + outcome.durationHours();

        // ── state affinities ───────────────────────────────────────────────
        Map<String, StatePreference> states = new LinkedHashMap<>(profile.statePreferences());
        List<String> favorites   = new ArrayList<>(history.favoriteStates());
        List<String> challenging = new ArrayList<>(history.challengingStates());
        for (String state : outcome.consciousnessStates()) {
            StatePreference preference = states.get(state);
            if (preference == null) continue;
            double comfort = outcome.stateComfortLevels().getOrDefault(state, DEFAULT_COMFORT);
            if (comfort > HIGH_COMFORT) {
                states.put(state, preference.withAffinityLevel(Math.min(1.0, preference.affinityLevel() + AFFINITY_STEP)));
                appendCapped(favorites, state, SessionHistory.MAX_STATE_LIST);
            } else if (comfort < LOW_COMFORT) {
                states.put(state, preference.withAffinityLevel(Math.max(0.0, preference.affinityLevel() - AFFINITY_STEP)));
                appendCapped(challenging, state, SessionHistory.MAX_STATE_LIST);
            }
        }

        // ── brainwave intensities ──────────────────────────────────────────
        Map<String, BrainwavePreference> bands = new LinkedHashMap<>(profile.brainwavePreferences());
        for (Map.Entry<String, Double> used : outcome.frequencyEffectiveness().entrySet()) {
            BrainwavePreference preference = bands.get(used.getKey());
            if (preference == null) continue;
            double effectiveness = used.getValue();
            if (effectiveness > HIGH_EFFECTIVENESS) {
                bands.put(used.getKey(), preference.withPreferredIntensity(
                    Math.min(1.0, preference.preferredIntensity() + INTENSITY_STEP)));
            } else if (effectiveness < LOW_EFFECTIVENESS) {
                bands.put(used.getKey(), preference.withPreferredIntensity(
                    Math.max(MIN_PREFERRED_INTENSITY, preference.preferredIntensity() - INTENSITY_STEP)));
            }
        }

        // ── biofield baseline ──────────────────────────────────────────────
        BiofieldProfile biofield = profile.biofieldProfile();
        if (biofield != null && outcome.averageCoherence() != null) {
            double trend = outcome.averageCoherence() - biofield.coherenceBaseline();
            if (trend > COHERENCE_TREND) {
                biofield = biofield.withCoherenceBaseline(Math.min(1.0, biofield.coherenceBaseline() + COHERENCE_STEP));
            } else if (trend < -COHERENCE_TREND) {
                biofield = biofield.withCoherenceBaseline(Math.max(0.0, biofield.coherenceBaseline() - COHERENCE_STEP));
            }
        }

        // ── comfort average and outcome log ────────────────────────────────
        double sessionComfort = outcome.overallComfort() == null ? DEFAULT_COMFORT : outcome.overallComfort();
        double weight = Math.min(1.0, 1.0 / totalSessions);
        double averageComfort = history.averageComfortLevel() * (1 - weight) + sessionComfort * weight;

        List<SessionRecord> outcomes = new ArrayList<>(history.recentSessionOutcomes());
        outcomes.add(new SessionRecord(now, outcome.durationMinutes(), sessionComfort,
            outcome.effectiveness() == null ? DEFAULT_EFFECTIVENESS : outcome.effectiveness(),
            outcome.consciousnessStates(), outcome.notes()));
        while (outcomes.size() > SessionHistory.MAX_RECENT_OUTCOMES) {
            outcomes.remove(0);
        }

        SessionHistory updatedHistory = new SessionHistory(totalSessions, totalHours, favorites, challenging,
            averageComfort, history.progressMetrics(), outcomes);

        NeuralProfile updated = profile
            .withStatePreferences(states)
            .withBrainwavePreferences(bands)
            .withBiofieldProfile(biofield)
            .withSessionHistory(updatedHistory)
            .withLastUpdated(now);

        if (updated.profileType() == ProfileType.BEGINNER && totalSessions >= PERSONALIZE_AFTER_SESSIONS) {
            updated = updated.withProfileType(ProfileType.PERSONALIZED);
        }
        return updated;
    }

    /** Appends a state once; evicts the oldest entry when the list exceeds {@code cap}. */
    private static void appendCapped(List<String> list, String state, int cap) {
        if (list.contains(state)) return;
        list.add(state);
        while (list.size() > cap) {
            list.remove(0);
        }
    }
}
