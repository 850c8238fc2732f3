package com.registry.core.exception;

/**
 * Thrown when a second current record is written for a business key that already has one.
 */
public class DuplicateBusinessKeyException extends RegistryException {
    
    public static final String ERROR_CODE = "DUPLICATE_BUSINESS_KEY";
    
    public DuplicateBusinessKeyException(String definitionCode, String businessKey) {
        super(ERROR_CODE, String.format(
            "A current %s record already exists for business key %s",
            definitionCode, businessKey
        ));
    }
}
