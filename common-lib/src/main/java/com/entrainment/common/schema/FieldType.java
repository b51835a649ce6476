package com.entrainment.common.schema;

import java.math.BigInteger;
import java.text.ParsePosition;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a schema field and its runtime membership test.
 *
 * <p>Booleans are never numbers. {@link #INTEGER} accepts only integral boxed types;
 * {@link #FLOAT} accepts any finite number. {@link #DATETIME} accepts temporal objects
 * and ISO-8601 strings, since configurations usually arrive as JSON.
 */
public enum FieldType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    ARRAY,
    OBJECT,
    DATETIME;

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS =
        List.of(DateTimeFormatter.ISO_DATE_TIME, DateTimeFormatter.ISO_DATE);

    public boolean matches(Object value) {
        if (value == null) return false;
        return switch (this) {
            case STRING   -> value instanceof String;
            case INTEGER  -> value instanceof Integer || value instanceof Long
                             || value instanceof Short || value instanceof Byte
                             || value instanceof BigInteger;
            case FLOAT    -> value instanceof Number n && !(value instanceof Boolean)
                             && Double.isFinite(n.doubleValue());
            case BOOLEAN  -> value instanceof Boolean;
            case ARRAY    -> value instanceof List<?>;
            case OBJECT   -> value instanceof Map<?, ?>;
            case DATETIME -> value instanceof Temporal || value instanceof Date
                             || (value instanceof String s && parsesAsDateTime(s));
        };
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Describes a runtime value the way the schema vocabulary names types. */
    static String describe(Object value) {
        if (value == null)               return "null";
        if (value instanceof Boolean)    return "boolean";
        if (value instanceof String)     return "string";
        if (INTEGER.matches(value))      return "integer";
        if (value instanceof Number)     return "float";
        if (value instanceof List<?>)    return "array";
        if (value instanceof Map<?, ?>)  return "object";
        return value.getClass().getSimpleName();
    }

    private static boolean parsesAsDateTime(String text) {
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            ParsePosition position = new ParsePosition(0);
            TemporalAccessor parsed = format.parseUnresolved(text, position);
            if (parsed != null && position.getErrorIndex() < 0 && position.getIndex() == text.length()) {
                return true;
            }
        }
        return false;
    }
}
