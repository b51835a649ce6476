package com.entrainment.common.profile;

import com.entrainment.common.exception.ProfileFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON import and export of {@link NeuralProfile}.
 *
 * <p>Only {@link NeuralProfile#CURRENT_SCHEMA_VERSION} documents are accepted; the version
 * is checked once here so the rest of the engine works on a single layout. Timestamps are
 * written as ISO-8601 strings.
 */
public final class ProfileCodec {

    private final ObjectMapper mapper;

    public ProfileCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Codec over a mapper configured the same way the service configures its own. */
    public static ProfileCodec defaultCodec() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return new ProfileCodec(mapper);
    }

    /**
     * @param includeSensitive when {@code false}, health conditions, medications and
     *                         emergency contacts are left out of the document
     */
    public String exportJson(NeuralProfile profile, boolean includeSensitive) {
        NeuralProfile exported = includeSensitive || profile.safetyProfile() == null
            ? profile
            : profile.withSafetyProfile(profile.safetyProfile().withoutSensitiveData());
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(exported);
        } catch (JsonProcessingException e) {
            throw new ProfileFormatException("Cannot serialize profile " + profile.profileId(), e);
        }
    }

    public NeuralProfile importJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ProfileFormatException("Profile document is empty");
        }
        try {
            return fromTree(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ProfileFormatException("Malformed profile JSON: " + e.getOriginalMessage(), e);
        }
    }

    public NeuralProfile fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ProfileFormatException("Profile document must be a JSON object");
        }
        int version = node.path("schema_version").asInt(-1);
        if (version != NeuralProfile.CURRENT_SCHEMA_VERSION) {
            throw new ProfileFormatException("Unsupported profile schema_version " + version
                + " (expected " + NeuralProfile.CURRENT_SCHEMA_VERSION + ")");
        }
        try {
            return mapper.treeToValue(node, NeuralProfile.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProfileFormatException("Invalid profile document: " + e.getMessage(), e);
        }
    }
}
