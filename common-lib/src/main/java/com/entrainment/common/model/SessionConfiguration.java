package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of a user-authored session configuration.
 *
 * <p>Every field is optional at this level; presence and ranges are enforced by the
 * schema validator against the raw map. {@link #fromMap(Map)} is lenient: a value of
 * the wrong type becomes {@code null} here and is reported by the schema pass instead.
 * Minute counts are read from any numeric value without narrowing, so the safety checks
 * see what the caller sent even when the schema pass rejects its type.
 */
public record SessionConfiguration(
    @JsonProperty("name")                   String name,
    @JsonProperty("duration_minutes")       Double durationMinutes,
    @JsonProperty("frequency_intensity")    Double frequencyIntensity,
    @JsonProperty("consciousness_journey")  List<String> consciousnessJourney,
    @JsonProperty("biofield_configuration") BiofieldConfiguration biofieldConfiguration,
    @JsonProperty("safety_parameters")      SafetyParameters safetyParameters,
    @JsonProperty("gamma_exposure_minutes") Double gammaExposureMinutes
) {
    public static final String NAME                   = "name";
    public static final String DURATION_MINUTES       = "duration_minutes";
    public static final String FREQUENCY_INTENSITY    = "frequency_intensity";
    public static final String CONSCIOUSNESS_JOURNEY  = "consciousness_journey";
    public static final String BIOFIELD_CONFIGURATION = "biofield_configuration";
    public static final String SAFETY_PARAMETERS      = "safety_parameters";
    public static final String GAMMA_EXPOSURE_MINUTES = "gamma_exposure_minutes";

    public SessionConfiguration {
        consciousnessJourney = consciousnessJourney == null ? List.of() : List.copyOf(consciousnessJourney);
    }

    public static SessionConfiguration of(String name, int durationMinutes, double frequencyIntensity,
                                          List<String> journey) {
        return new SessionConfiguration(name, (double) durationMinutes, frequencyIntensity, journey, null, null, null);
    }

    public int journeyLength() {
        return consciousnessJourney.size();
    }

    /** Number of edges walked by the journey. */
    public int transitionCount() {
        return Math.max(0, consciousnessJourney.size() - 1);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (name != null)                  map.put(NAME, name);
        if (durationMinutes != null)       map.put(DURATION_MINUTES, minutes(durationMinutes));
        if (frequencyIntensity != null)    map.put(FREQUENCY_INTENSITY, frequencyIntensity);
        map.put(CONSCIOUSNESS_JOURNEY, new ArrayList<>(consciousnessJourney));
        if (biofieldConfiguration != null) map.put(BIOFIELD_CONFIGURATION, biofieldConfiguration.toMap());
        if (safetyParameters != null)      map.put(SAFETY_PARAMETERS, safetyParameters.toMap());
        if (gammaExposureMinutes != null)  map.put(GAMMA_EXPOSURE_MINUTES, minutes(gammaExposureMinutes));
        return map;
    }

    public static SessionConfiguration fromMap(Map<String, ?> raw) {
        return new SessionConfiguration(
            raw.get(NAME) instanceof String s ? s : null,
            real(raw.get(DURATION_MINUTES)),
            real(raw.get(FREQUENCY_INTENSITY)),
            journey(raw.get(CONSCIOUSNESS_JOURNEY)),
            raw.get(BIOFIELD_CONFIGURATION) instanceof Map<?, ?> bio ? biofield(bio) : null,
            raw.get(SAFETY_PARAMETERS) instanceof Map<?, ?> params ? safety(params) : null,
            real(raw.get(GAMMA_EXPOSURE_MINUTES))
        );
    }

    // ── lenient coercion helpers ───────────────────────────────────────────

    private static Double real(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    // Whole minute counts go back out as integers so the schema pass accepts them.
    private static Number minutes(double value) {
        if (value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE) return (int) value;
        return value;
    }

    private static List<String> journey(Object value) {
        if (!(value instanceof List<?> list)) return List.of();
        List<String> states = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof String s) states.add(s);
        }
        return states;
    }

    private static BiofieldConfiguration biofield(Map<?, ?> raw) {
        return new BiofieldConfiguration(
            real(raw.get(BiofieldConfiguration.SCHUMANN_ALIGNMENT)),
            real(raw.get(BiofieldConfiguration.SOLFEGGIO_INTEGRATION)),
            real(raw.get(BiofieldConfiguration.GOLDEN_RATIO_HARMONICS)));
    }

    private static SafetyParameters safety(Map<?, ?> raw) {
        return new SafetyParameters(
            raw.get("comfort_monitoring") instanceof Boolean b ? b : null,
            raw.get("automatic_adjustment") instanceof Boolean b ? b : null,
            raw.get("emergency_stop") instanceof Boolean b ? b : null);
    }
}
