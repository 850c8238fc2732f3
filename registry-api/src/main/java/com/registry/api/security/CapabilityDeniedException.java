package com.registry.api.security;

import com.registry.core.exception.RegistryException;

/**
 * Thrown when the calling actor lacks the capability an operation needs.
 */
public class CapabilityDeniedException extends RegistryException {

    public static final String ERROR_CODE = "CAPABILITY_DENIED";

    public CapabilityDeniedException(String actorId, String capability) {
        super(ERROR_CODE, String.format("Actor %s lacks capability %s", actorId, capability));
    }
}
