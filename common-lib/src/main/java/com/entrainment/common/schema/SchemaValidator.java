package com.entrainment.common.schema;

import com.entrainment.common.model.ValidationIssue;
import com.entrainment.common.model.ValidationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pure declarative validator: {@code (data, schema) → issues}.
 *
 * <h3>Per-field evaluation order</h3>
 * <ol>
 *   <li>required but absent → one {@code error}; nothing else checked for the field</li>
 *   <li>absent and optional → skipped</li>
 *   <li>wrong type → one {@code error}; range/pattern checks skipped</li>
 *   <li>range, length, pattern, enum, item-count, item-type → independent, several may fire</li>
 *   <li>object with nested schema → recursed with a dotted path</li>
 * </ol>
 *
 * <p>An explicit {@code null} value counts as absent. Keys not declared in the schema
 * are ignored. Stateless and thread-safe.
 */
public final class SchemaValidator {

    public static final String CODE_REQUIRED   = "SCHEMA_REQUIRED";
    public static final String CODE_TYPE       = "SCHEMA_TYPE";
    public static final String CODE_MIN_VALUE  = "SCHEMA_MIN_VALUE";
    public static final String CODE_MAX_VALUE  = "SCHEMA_MAX_VALUE";
    public static final String CODE_MIN_LENGTH = "SCHEMA_MIN_LENGTH";
    public static final String CODE_MAX_LENGTH = "SCHEMA_MAX_LENGTH";
    public static final String CODE_PATTERN    = "SCHEMA_PATTERN";
    public static final String CODE_ENUM       = "SCHEMA_ENUM";
    public static final String CODE_MIN_ITEMS  = "SCHEMA_MIN_ITEMS";
    public static final String CODE_MAX_ITEMS  = "SCHEMA_MAX_ITEMS";
    public static final String CODE_ITEM_TYPE  = "SCHEMA_ITEM_TYPE";

    private SchemaValidator() {}

    public static List<ValidationIssue> validate(Map<String, ?> data, Schema schema) {
        return validate(data, schema, "");
    }

    /**
     * @param context path prefix for every reported field; empty for top level
     */
    public static List<ValidationIssue> validate(Map<String, ?> data, Schema schema, String context) {
        List<ValidationIssue> issues = new ArrayList<>();
        validateInto(data, schema, context, issues);
        return issues;
    }

    private static void validateInto(Map<?, ?> data, Schema schema, String context,
                                     List<ValidationIssue> issues) {
        for (FieldRule rule : schema.fields()) {
            String path  = context.isEmpty() ? rule.name() : context + "." + rule.name();
            Object value = data.get(rule.name());

            if (value == null) {
                if (rule.required()) {
                    issues.add(new ValidationIssue(ValidationSeverity.ERROR, path,
                        "Required field missing: " + rule.name(), null,
                        "Add " + rule.name() + " to the configuration", CODE_REQUIRED));
                }
                continue;
            }

            if (!rule.type().matches(value)) {
                issues.add(new ValidationIssue(ValidationSeverity.ERROR, path,
                    "Invalid type for " + rule.name() + ": expected " + rule.type().wireName()
                        + ", got " + FieldType.describe(value),
                    value, "", CODE_TYPE));
                continue;
            }

            switch (rule.type()) {
                case INTEGER, FLOAT -> checkNumber(((Number) value).doubleValue(), value, rule, path, issues);
                case STRING         -> checkString((String) value, rule, path, issues);
                case ARRAY          -> checkArray((List<?>) value, rule, path, issues);
                case OBJECT         -> {
                    if (rule.nested() != null) validateInto((Map<?, ?>) value, rule.nested(), path, issues);
                }
                default -> { /* boolean and datetime carry no further constraints */ }
            }
        }
    }

    private static void checkNumber(double number, Object raw, FieldRule rule, String path,
                                    List<ValidationIssue> issues) {
        if (rule.minValue() != null && number < rule.minValue()) {
            issues.add(error(path, "Value below minimum: " + raw + " < " + format(rule.minValue()),
                raw, CODE_MIN_VALUE));
        }
        if (rule.maxValue() != null && number > rule.maxValue()) {
            issues.add(error(path, "Value above maximum: " + raw + " > " + format(rule.maxValue()),
                raw, CODE_MAX_VALUE));
        }
    }

    private static void checkString(String value, FieldRule rule, String path, List<ValidationIssue> issues) {
        if (rule.minLength() != null && value.length() < rule.minLength()) {
            issues.add(error(path, "String too short: " + value.length() + " < " + rule.minLength(),
                value, CODE_MIN_LENGTH));
        }
        if (rule.maxLength() != null && value.length() > rule.maxLength()) {
            issues.add(error(path, "String too long: " + value.length() + " > " + rule.maxLength(),
                value, CODE_MAX_LENGTH));
        }
        // anchored at the start only, like a prefix match; schemas anchor with ^…$ themselves
        if (rule.pattern() != null && !rule.pattern().matcher(value).lookingAt()) {
            issues.add(error(path, "String does not match pattern: " + rule.pattern().pattern(),
                value, CODE_PATTERN));
        }
        if (rule.allowedValues() != null && !rule.allowedValues().contains(value)) {
            issues.add(new ValidationIssue(ValidationSeverity.ERROR, path,
                "Value not in allowed list: " + value, value,
                "Allowed values: " + String.join(", ", rule.allowedValues()), CODE_ENUM));
        }
    }

    private static void checkArray(List<?> value, FieldRule rule, String path, List<ValidationIssue> issues) {
        if (rule.minItems() != null && value.size() < rule.minItems()) {
            issues.add(error(path, "Array too short: " + value.size() + " < " + rule.minItems(),
                value, CODE_MIN_ITEMS));
        }
        if (rule.maxItems() != null && value.size() > rule.maxItems()) {
            issues.add(error(path, "Array too long: " + value.size() + " > " + rule.maxItems(),
                value, CODE_MAX_ITEMS));
        }
        if (rule.itemType() != null) {
            for (int i = 0; i < value.size(); i++) {
                Object item = value.get(i);
                if (!rule.itemType().matches(item)) {
                    issues.add(error(path + "[" + i + "]",
                        "Invalid item type: expected " + rule.itemType().wireName()
                            + ", got " + FieldType.describe(item),
                        item, CODE_ITEM_TYPE));
                }
            }
        }
    }

    private static ValidationIssue error(String path, String message, Object value, String code) {
        return new ValidationIssue(ValidationSeverity.ERROR, path, message, value, "", code);
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
