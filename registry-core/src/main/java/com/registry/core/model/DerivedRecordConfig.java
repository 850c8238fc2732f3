package com.registry.core.model;

/**
 * Per-definition behavior applied to every record of that definition.
 */
public record DerivedRecordConfig(
    ActivationConfig activation,
    VersioningConfig versioning,
    HierarchyConfig hierarchy
) {
    public DerivedRecordConfig {
        if (activation == null) {
            activation = ActivationConfig.defaults();
        }
        if (versioning == null) {
            versioning = VersioningConfig.defaults();
        }
        if (hierarchy == null) {
            hierarchy = HierarchyConfig.defaults();
        }
    }

    public static DerivedRecordConfig defaults() {
        return new DerivedRecordConfig(null, null, null);
    }

    /**
     * Merge a patch field by field. Does not enforce transition rules; the registry does that.
     */
    public DerivedRecordConfig merge(DerivedRecordConfigPatch patch) {
        if (patch == null) {
            return this;
        }

        ActivationConfig nextActivation = activation;
        var a = patch.activation();
        if (a != null) {
            nextActivation = new ActivationConfig(
                a.enabled() != null ? a.enabled() : activation.enabled(),
                a.defaultState() != null ? a.defaultState() : activation.defaultState(),
                a.entityActive() != null ? a.entityActive() : activation.entityActive(),
                a.useTimeBounding() != null ? a.useTimeBounding() : activation.useTimeBounding()
            );
        }

        VersioningConfig nextVersioning = versioning;
        if (patch.versioning() != null && patch.versioning().enabled() != null) {
            nextVersioning = new VersioningConfig(patch.versioning().enabled());
        }

        HierarchyConfig nextHierarchy = hierarchy;
        var h = patch.hierarchy();
        if (h != null) {
            nextHierarchy = new HierarchyConfig(
                h.enabled() != null ? h.enabled() : hierarchy.enabled(),
                h.parentLinkField() != null ? h.parentLinkField().trim() : hierarchy.parentLinkField(),
                h.linkType() != null ? h.linkType() : hierarchy.linkType()
            );
        }

        return new DerivedRecordConfig(nextActivation, nextVersioning, nextHierarchy);
    }

    public DerivedRecordConfig withEntityActive(boolean entityActive) {
        return new DerivedRecordConfig(activation.withEntityActive(entityActive), versioning, hierarchy);
    }
}
