package com.entrainment.common.exception;

/**
 * Programmer-error failure raised by an engine component.
 *
 * <p>Validation outcomes are never reported through exceptions; they are collected as
 * issues on a {@code ValidationResult}. This type is reserved for malformed definitions,
 * illegal helper arguments and rejected raw input.
 */
public class EngineException extends RuntimeException {
    private final String component;

    public EngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public EngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
