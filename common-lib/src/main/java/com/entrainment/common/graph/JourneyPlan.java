package com.entrainment.common.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of journey planning. A path that does not end at the requested target means
 * no safe route was found within the hop budget; it is not an error.
 */
public record JourneyPlan(
    @JsonProperty("path")          List<String> path,
    @JsonProperty("reachedTarget") boolean reachedTarget
) {
    public JourneyPlan {
        path = List.copyOf(path);
    }

    public int hops() {
        return Math.max(0, path.size() - 1);
    }
}
