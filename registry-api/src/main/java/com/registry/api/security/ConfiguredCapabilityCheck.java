package com.registry.api.security;

import com.registry.core.model.Actor;
import com.registry.engine.config.RegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Grants from {@code registry.security}: a per-actor list, else the default list.
 */
@Component
public class ConfiguredCapabilityCheck implements CapabilityCheck {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredCapabilityCheck.class);

    private final RegistryProperties.Security security;

    public ConfiguredCapabilityCheck(RegistryProperties properties) {
        this.security = properties.getSecurity();
    }

    @Override
    public boolean hasCapability(Actor actor, String capability) {
        List<String> granted = security.getGrants().getOrDefault(actor.id(), security.getDefaultGrants());
        boolean allowed = granted != null
            && (granted.contains(Capabilities.WILDCARD) || granted.contains(capability));
        if (!allowed) {
            log.warn("Actor {} lacks capability {}", actor.id(), capability);
        }
        return allowed;
    }
}
