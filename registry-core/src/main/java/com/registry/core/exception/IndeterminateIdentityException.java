package com.registry.core.exception;

/**
 * Thrown when no business key can be resolved from a record's data.
 */
public class IndeterminateIdentityException extends RegistryException {
    
    public static final String ERROR_CODE = "INDETERMINATE_IDENTITY";
    
    public IndeterminateIdentityException(String definitionCode, String recordId) {
        super(ERROR_CODE, String.format(
            "Cannot determine business key for %s record %s: no required field is present",
            definitionCode, recordId
        ));
    }
}
