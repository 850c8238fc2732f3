package com.registry.core.exception;

/**
 * Thrown when records are written against a definition that has been switched off.
 */
public class DefinitionInactiveException extends RegistryException {
    
    public static final String ERROR_CODE = "DEFINITION_INACTIVE";
    
    public DefinitionInactiveException(String definitionCode) {
        super(ERROR_CODE, String.format(
            "Entity definition %s is inactive and cannot accept record changes",
            definitionCode
        ));
    }
}
