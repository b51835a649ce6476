package com.entrainment.common.exception;

public class ProfileFormatException extends EngineException {

    public ProfileFormatException(String message) {
        super("ProfileCodec", message);
    }

    public ProfileFormatException(String message, Throwable cause) {
        super("ProfileCodec", message, cause);
    }
}
