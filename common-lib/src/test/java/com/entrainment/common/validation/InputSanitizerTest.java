package com.entrainment.common.validation;

import com.entrainment.common.exception.UnsafeInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    @Nested
    @DisplayName("accepted input")
    class Accepted {

        @Test
        @DisplayName("surrounding whitespace → stripped")
        void stripped() {
            assertEquals("Ada Lovelace", InputSanitizer.sanitize("  Ada Lovelace \n", "name"));
        }

        @Test
        @DisplayName("typed formats → accepted")
        void formats() {
            assertEquals("45min", InputSanitizer.sanitize("45min", "duration_string"));
            assertEquals("70%", InputSanitizer.sanitize("70%", "intensity_string"));
            assertEquals("1.2.0", InputSanitizer.sanitize("1.2.0", "version"));
            assertEquals("21:30", InputSanitizer.sanitize("21:30", "time_string"));
        }

        @Test
        @DisplayName("empty allowed → empty string")
        void emptyAllowed() {
            assertEquals("", InputSanitizer.sanitize("   ", "name", 100, true));
        }

        @Test
        @DisplayName("unknown input type → no format check")
        void unknownType() {
            assertFalse(InputSanitizer.isKnownInputType("free_text"));
            assertEquals("anything #1", InputSanitizer.sanitize("anything #1", "free_text"));
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @Test
        @DisplayName("empty → UnsafeInputException carrying the input type")
        void empty() {
            UnsafeInputException e = assertThrows(UnsafeInputException.class,
                () -> InputSanitizer.sanitize(null, "email"));
            assertEquals("email", e.getInputType());
        }

        @Test
        @DisplayName("longer than max → rejected; hard cap wins over a larger max")
        void tooLong() {
            assertThrows(UnsafeInputException.class, () -> InputSanitizer.sanitize("abcdef", "free_text", 5, false));
            String huge = "a".repeat(InputSanitizer.HARD_MAX_LENGTH + 1);
            assertThrows(UnsafeInputException.class,
                () -> InputSanitizer.sanitize(huge, "free_text", Integer.MAX_VALUE, false));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "<SCRIPT>alert(1)</script>", "javascript:void(0)", "img onerror=x", "eval(payload)",
            "import   subprocess"
        })
        @DisplayName("injection patterns → rejected regardless of case")
        void dangerous(String input) {
            UnsafeInputException e = assertThrows(UnsafeInputException.class,
                () -> InputSanitizer.sanitize(input, "free_text"));
            assertTrue(e.getMessage().contains("dangerous"));
        }

        @Test
        @DisplayName("format mismatch → rejected")
        void format() {
            assertThrows(UnsafeInputException.class, () -> InputSanitizer.sanitize("not-an-email", "email"));
            assertThrows(UnsafeInputException.class, () -> InputSanitizer.sanitize("Ada123", "name"));
            assertThrows(UnsafeInputException.class, () -> InputSanitizer.sanitize("UPPER", "preset_id"));
        }
    }
}
