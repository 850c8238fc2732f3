package com.registry.api.security;

import com.registry.core.model.Actor;

/**
 * Decides whether an actor may perform an operation.
 */
public interface CapabilityCheck {

    boolean hasCapability(Actor actor, String capability);

    /**
     * @throws CapabilityDeniedException if the actor lacks the capability
     */
    default void require(Actor actor, String capability) {
        if (!hasCapability(actor, capability)) {
            throw new CapabilityDeniedException(actor.id(), capability);
        }
    }
}
