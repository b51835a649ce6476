package com.entrainment.common.exception;

/**
 * Raised by the input sanitizer when a raw user string is malformed or carries an
 * injection pattern. Sanitization fails fast instead of producing issues.
 */
public class UnsafeInputException extends EngineException {

    private final String inputType;

    public UnsafeInputException(String inputType, String message) {
        super("InputSanitizer", message);
        this.inputType = inputType;
    }

    public String getInputType() {
        return inputType;
    }
}
