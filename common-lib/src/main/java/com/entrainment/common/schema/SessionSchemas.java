package com.entrainment.common.schema;

/**
 * Built-in schemas for session configurations and presets.
 */
public final class SessionSchemas {

    public static final String SESSION_NAME_PATTERN = "^[a-zA-Z0-9\\s\\-_\\.]+$";

    public static final Schema BIOFIELD_CONFIGURATION = Schema.of(
        FieldRule.decimal("schumann_alignment").range(0.0, 1.0).build(),
        FieldRule.decimal("solfeggio_integration").range(0.0, 1.0).build(),
        FieldRule.decimal("golden_ratio_harmonics").range(0.0, 1.0).build()
    );

    public static final Schema SAFETY_PARAMETERS = Schema.of(
        FieldRule.bool("comfort_monitoring").build(),
        FieldRule.bool("automatic_adjustment").build(),
        FieldRule.bool("emergency_stop").build()
    );

    public static final Schema SESSION_CONFIGURATION = Schema.of(
        FieldRule.string("name").required().length(1, 100).pattern(SESSION_NAME_PATTERN).build(),
        FieldRule.integer("duration_minutes").required().range(5, 120).build(),
        FieldRule.decimal("frequency_intensity").required().range(0.1, 1.0).build(),
        FieldRule.array("consciousness_journey").required().items(1, 8).itemType(FieldType.STRING).build(),
        FieldRule.object("biofield_configuration").nested(BIOFIELD_CONFIGURATION).build(),
        FieldRule.object("safety_parameters").nested(SAFETY_PARAMETERS).build(),
        FieldRule.integer("gamma_exposure_minutes").min(0).build()
    );

    public static final Schema PRESET = Schema.of(
        FieldRule.string("preset_id").required().length(3, 50).pattern("^[a-z0-9_]+$").build(),
        FieldRule.string("name").required().length(1, 100).build(),
        FieldRule.string("description").required().length(10, 500).build(),
        FieldRule.string("category").required()
            .allowedValues("healing", "meditation", "creativity", "learning", "transcendence", "custom").build(),
        FieldRule.string("experience_level").required()
            .allowedValues("beginner", "intermediate", "advanced", "expert").build(),
        FieldRule.object("base_configuration").required().build(),
        FieldRule.array("tags").maxItems(10).itemType(FieldType.STRING).build(),
        FieldRule.datetime("created_date").required().build(),
        FieldRule.string("version").required().pattern("^\\d+\\.\\d+\\.\\d+$").build()
    );

    private SessionSchemas() {}
}
