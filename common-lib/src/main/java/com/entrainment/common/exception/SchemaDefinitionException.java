package com.entrainment.common.exception;

/**
 * Thrown when a field rule or schema is declared inconsistently, e.g. a length bound
 * on a numeric field or an uncompilable pattern.
 */
public class SchemaDefinitionException extends EngineException {

    public SchemaDefinitionException(String fieldName, String message) {
        super("SchemaValidator", "field '" + fieldName + "': " + message);
    }

    public SchemaDefinitionException(String fieldName, String message, Throwable cause) {
        super("SchemaValidator", "field '" + fieldName + "': " + message, cause);
    }
}
