package com.registry.core.model;

/**
 * Partial change to a {@link DerivedRecordConfig}. Null members leave the current value alone.
 */
public record DerivedRecordConfigPatch(
    ActivationPatch activation,
    VersioningPatch versioning,
    HierarchyPatch hierarchy
) {
    public static DerivedRecordConfigPatch empty() {
        return new DerivedRecordConfigPatch(null, null, null);
    }

    public record ActivationPatch(
        Boolean enabled,
        Boolean defaultState,
        Boolean entityActive,
        Boolean useTimeBounding
    ) {}

    public record VersioningPatch(Boolean enabled) {}

    public record HierarchyPatch(
        Boolean enabled,
        String parentLinkField,
        LinkType linkType
    ) {}
}
