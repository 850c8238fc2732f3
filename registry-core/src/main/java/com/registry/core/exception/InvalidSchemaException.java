package com.registry.core.exception;

import com.registry.core.schema.SchemaViolation;

import java.util.List;

/**
 * Thrown when a definition's schema or derived record configuration is not usable.
 */
public class InvalidSchemaException extends ValidationFailedException {
    
    public static final String ERROR_CODE = "INVALID_SCHEMA";
    
    public InvalidSchemaException(List<SchemaViolation> violations) {
        super(ERROR_CODE, "Invalid schema definition", violations);
    }

    public static InvalidSchemaException of(String field, String constraint, String message) {
        return new InvalidSchemaException(List.of(new SchemaViolation(field, constraint, message)));
    }
}
