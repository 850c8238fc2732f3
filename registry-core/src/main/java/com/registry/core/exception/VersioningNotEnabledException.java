package com.registry.core.exception;

/**
 * Thrown when version operations are requested for a non-versioned definition.
 */
public class VersioningNotEnabledException extends RegistryException {
    
    public static final String ERROR_CODE = "VERSIONING_NOT_ENABLED";
    
    public VersioningNotEnabledException(String definitionCode) {
        super(ERROR_CODE, String.format(
            "Versioning is not enabled for entity definition %s",
            definitionCode
        ));
    }
}
