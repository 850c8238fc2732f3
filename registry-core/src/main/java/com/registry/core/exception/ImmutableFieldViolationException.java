package com.registry.core.exception;

/**
 * Thrown when a mutation targets a field that is fixed at creation.
 */
public class ImmutableFieldViolationException extends RegistryException {
    
    public static final String ERROR_CODE = "IMMUTABLE_FIELD_VIOLATION";
    
    public ImmutableFieldViolationException(String subjectType, String field) {
        super(ERROR_CODE, String.format(
            "%s field '%s' cannot be modified after creation",
            subjectType, field
        ));
    }
}
