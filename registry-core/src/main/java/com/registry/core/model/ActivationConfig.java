package com.registry.core.model;

/**
 * Activation behavior of a definition.
 *
 * @param enabled         whether records carry an {@code isActive} flag
 * @param defaultState    value of {@code isActive} when the caller supplies none
 * @param entityActive    whether the definition itself accepts new or changed records
 * @param useTimeBounding whether records carry {@code effectiveFrom}/{@code effectiveTo}
 */
public record ActivationConfig(
    boolean enabled,
    boolean defaultState,
    boolean entityActive,
    boolean useTimeBounding
) {
    public static ActivationConfig defaults() {
        return new ActivationConfig(true, true, true, false);
    }

    public ActivationConfig withEntityActive(boolean entityActive) {
        return new ActivationConfig(enabled, defaultState, entityActive, useTimeBounding);
    }
}
