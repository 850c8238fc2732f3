package com.registry.core.model;

/**
 * Versioning behavior of a definition. Once enabled it stays enabled.
 */
public record VersioningConfig(boolean enabled) {

    public static VersioningConfig defaults() {
        return new VersioningConfig(false);
    }
}
