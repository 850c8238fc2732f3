package com.registry.core.exception;

/**
 * Thrown when an update tries to switch off a flag that may only ever be switched on.
 */
public class MonotonicConfigViolationException extends RegistryException {
    
    public static final String ERROR_CODE = "MONOTONIC_CONFIG_VIOLATION";
    
    public MonotonicConfigViolationException(String definitionCode, String flag) {
        super(ERROR_CODE, String.format(
            "Cannot disable %s on %s once it has been enabled",
            flag, definitionCode
        ));
    }
}
