package com.entrainment.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public record SafetyParameters(
    @JsonProperty("comfort_monitoring")   Boolean comfortMonitoring,
    @JsonProperty("automatic_adjustment") Boolean automaticAdjustment,
    @JsonProperty("emergency_stop")       Boolean emergencyStop
) {
    public static SafetyParameters defaults() {
        return new SafetyParameters(true, true, true);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (comfortMonitoring != null)   map.put("comfort_monitoring", comfortMonitoring);
        if (automaticAdjustment != null) map.put("automatic_adjustment", automaticAdjustment);
        if (emergencyStop != null)       map.put("emergency_stop", emergencyStop);
        return map;
    }
}
