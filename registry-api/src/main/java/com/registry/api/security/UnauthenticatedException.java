package com.registry.api.security;

import com.registry.core.exception.RegistryException;

/**
 * Thrown when a request carries no actor identity.
 */
public class UnauthenticatedException extends RegistryException {

    public static final String ERROR_CODE = "UNAUTHENTICATED";

    public UnauthenticatedException(String message) {
        super(ERROR_CODE, message);
    }
}
