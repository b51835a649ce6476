package com.entrainment.common.profile;

import com.entrainment.common.exception.EngineException;
import com.entrainment.common.model.ExperienceLevel;
import com.entrainment.common.model.NumericRange;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conservative starting profile for a new user.
 *
 * <ul>
 *   <li>alpha, theta and low beta at intensity 0.3, tolerance 0.1 – 0.5</li>
 *   <li>neutral, deep relaxation and meditative awareness at affinity 0.7, 15 minutes</li>
 *   <li>20-minute sessions in the evening</li>
 * </ul>
 */
public final class ProfileDefaults {

    static final List<String> STARTER_BANDS  = List.of("alpha", "theta", "low_beta");
    static final List<String> STARTER_STATES = List.of("neutral", "deep_relaxation", "meditative_awareness");

    static final double STARTER_INTENSITY       = 0.3;
    static final double STARTER_AFFINITY        = 0.7;
    static final int    STARTER_SESSION_MINUTES = 20;
    static final double STARTER_AVERAGE_COMFORT = 0.8;

    private ProfileDefaults() {}

    public static NeuralProfile createDefault(String name, ExperienceLevel level) {
        return createDefault(name, level, Clock.systemUTC());
    }

    public static NeuralProfile createDefault(String name, ExperienceLevel level, Clock clock) {
        Instant now = clock.instant();

        Map<String, BrainwavePreference> bands = new LinkedHashMap<>();
        for (String band : STARTER_BANDS) {
            bands.put(band, new BrainwavePreference(band, STARTER_INTENSITY, NumericRange.of(0.1, 0.5),
                "moderate", "Default setting - to be personalized through use"));
        }

        Map<String, StatePreference> states = new LinkedHashMap<>();
        for (String state : STARTER_STATES) {
            states.put(state, new StatePreference(state, STARTER_AFFINITY, 15, 5, 10, "Default setting"));
        }

        BiofieldProfile biofield = new BiofieldProfile(0.5,
            Map.of("396_hz", 0.5, "528_hz", 0.6, "852_hz", 0.4),
            0.5, 0.5, "stable", NumericRange.of(0.4, 0.7));

        Map<String, Object> comfort = new LinkedHashMap<>();
        comfort.put("preferred_volume", 0.6);
        comfort.put("visual_sensitivity", "moderate");
        comfort.put("break_frequency", 15);
        SafetyProfile safety = new SafetyProfile(level, List.of(), List.of(), List.of(), comfort, List.of(), List.of());

        Map<String, Double> progress = new LinkedHashMap<>();
        progress.put("comfort_trend", 0.0);
        progress.put("effectiveness_rating", 0.0);
        progress.put("session_completion_rate", 0.0);
        SessionHistory history = new SessionHistory(0, 0.0, List.of(), List.of(), STARTER_AVERAGE_COMFORT,
            progress, List.of());

        Map<String, Object> environment = new LinkedHashMap<>();
        environment.put("ambient_lighting", "dim");
        environment.put("background_sounds", "minimal");
        environment.put("temperature_preference", "comfortable");

        Map<String, Object> integration = new LinkedHashMap<>();
        integration.put("journaling", true);
        integration.put("meditation", true);
        integration.put("rest_time", true);

        return new NeuralProfile(NeuralProfile.CURRENT_SCHEMA_VERSION, profileId(name, now), name,
            ProfileType.BEGINNER, now, now, "alpha", SensitivityLevel.MODERATE, bands, states, biofield,
            safety, history, STARTER_SESSION_MINUTES, "evening", environment, integration);
    }

    /** First 16 hex characters of SHA-256 over {@code name_timestamp}. */
    static String profileId(String name, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((name + "_" + timestamp).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new EngineException("ProfileDefaults", "SHA-256 is not available", e);
        }
    }
}
