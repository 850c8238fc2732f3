package com.registry.core.exception;

/**
 * Base exception for all entity registry errors.
 * Every subclass exposes a stable error code that transport layers can surface verbatim.
 */
public class RegistryException extends RuntimeException {
    
    private final String errorCode;
    
    public RegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public RegistryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
