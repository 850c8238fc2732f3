package com.registry.api.rest;

import com.registry.core.exception.RegistryException;

/**
 * Thrown when a definition that still has records is deleted.
 */
public class DefinitionInUseException extends RegistryException {

    public static final String ERROR_CODE = "DEFINITION_IN_USE";

    public DefinitionInUseException(String code, long recordCount) {
        super(ERROR_CODE, String.format(
            "Entity definition %s still has %d record(s); delete them first", code, recordCount));
    }
}
