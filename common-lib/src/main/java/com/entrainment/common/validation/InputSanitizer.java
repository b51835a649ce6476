package com.entrainment.common.validation;

import com.entrainment.common.exception.UnsafeInputException;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guards raw user strings before they reach the structured pipeline.
 *
 * <p>Unlike the validators this fails fast: malformed or dangerous input raises
 * {@link UnsafeInputException} instead of producing issues.
 *
 * <pre>
 *   strip → empty check → length check → dangerous content → input-type pattern
 * </pre>
 */
public final class InputSanitizer {

    /** Absolute ceiling regardless of the caller's {@code maxLength}. */
    public static final int HARD_MAX_LENGTH = 10_000;

    public static final int DEFAULT_MAX_LENGTH = 1_000;

    private static final Map<String, Pattern> INPUT_PATTERNS = Map.of(
        "name",             Pattern.compile("^[a-zA-Z\\s\\-'.]{1,100}$"),
        "email",            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"),
        "session_name",     Pattern.compile("^[a-zA-Z0-9\\s\\-_.]{1,100}$"),
        "preset_id",        Pattern.compile("^[a-z0-9_]{3,50}$"),
        "version",          Pattern.compile("^\\d+\\.\\d+\\.\\d+$"),
        "duration_string",  Pattern.compile("^\\d{1,3}(m|min|minutes?)$"),
        "intensity_string", Pattern.compile("^\\d{1,3}%$"),
        "date_string",      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$"),
        "time_string",      Pattern.compile("^\\d{2}:\\d{2}(:\\d{2})?$")
    );

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
        Pattern.compile("<script.*?>", Pattern.CASE_INSENSITIVE),
        Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("onload=", Pattern.CASE_INSENSITIVE),
        Pattern.compile("onerror=", Pattern.CASE_INSENSITIVE),
        Pattern.compile("eval\\(", Pattern.CASE_INSENSITIVE),
        Pattern.compile("exec\\(", Pattern.CASE_INSENSITIVE),
        Pattern.compile("import\\s+os", Pattern.CASE_INSENSITIVE),
        Pattern.compile("import\\s+subprocess", Pattern.CASE_INSENSITIVE)
    );

    private InputSanitizer() {}

    public static String sanitize(String raw, String inputType) {
        return sanitize(raw, inputType, DEFAULT_MAX_LENGTH, false);
    }

    /**
     * @param inputType one of the known input types; any other value skips the format check
     * @return the stripped input
     * @throws UnsafeInputException when the input is empty, too long, dangerous or malformed
     */
    public static String sanitize(String raw, String inputType, int maxLength, boolean allowEmpty) {
        String value = raw == null ? "" : raw.strip();

        if (value.isEmpty()) {
            if (allowEmpty) return value;
            throw new UnsafeInputException(inputType, "Input cannot be empty");
        }
        int limit = Math.min(maxLength, HARD_MAX_LENGTH);
        if (value.length() > limit) {
            throw new UnsafeInputException(inputType,
                "Input too long (" + value.length() + " characters, max " + limit + ")");
        }
        for (Pattern dangerous : DANGEROUS_PATTERNS) {
            if (dangerous.matcher(value).find()) {
                throw new UnsafeInputException(inputType, "Potentially dangerous content detected");
            }
        }
        Pattern format = INPUT_PATTERNS.get(inputType);
        if (format != null && !format.matcher(value).matches()) {
            throw new UnsafeInputException(inputType, "Invalid format for " + inputType);
        }
        return value;
    }

    public static boolean isKnownInputType(String inputType) {
        return INPUT_PATTERNS.containsKey(inputType);
    }
}
