package com.registry.core.exception;

/**
 * Thrown when record activation is toggled on a definition without activation support.
 */
public class ActivationNotEnabledException extends RegistryException {
    
    public static final String ERROR_CODE = "ACTIVATION_NOT_ENABLED";
    
    public ActivationNotEnabledException(String definitionCode) {
        super(ERROR_CODE, String.format(
            "Activation is not enabled for entity definition %s",
            definitionCode
        ));
    }
}
