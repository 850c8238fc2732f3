package com.registry.core.exception;

/**
 * Thrown when an entity definition is created with a code that is already taken.
 */
public class DuplicateCodeException extends RegistryException {
    
    public static final String ERROR_CODE = "DUPLICATE_CODE";
    
    private final String code;
    
    public DuplicateCodeException(String code) {
        super(ERROR_CODE, String.format(
            "Entity definition with code '%s' already exists",
            code
        ));
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
