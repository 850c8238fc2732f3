package com.registry.core.exception;

/**
 * Thrown when an entity definition or entity record is not found.
 */
public class NotFoundException extends RegistryException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String subjectType, String subjectId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            subjectType, subjectId
        ));
    }
}
