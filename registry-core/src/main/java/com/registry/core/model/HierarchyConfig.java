package com.registry.core.model;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parent/child behavior of a definition. Once enabled it stays enabled.
 *
 * @param parentLinkField attribute name under which the parent link is exposed to clients
 */
public record HierarchyConfig(
    boolean enabled,
    String parentLinkField,
    LinkType linkType
) {
    public static final String DEFAULT_PARENT_LINK_FIELD = "parentId";

    public static final Pattern FIELD_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Record attribute names a parent link field may not shadow.
     */
    public static final Set<String> RESERVED_FIELD_NAMES = Set.of(
        "id", "definitionId", "definitionCode", "data", "isActive",
        "effectiveFrom", "effectiveTo", "version", "isCurrent", "expiredAt",
        "createdBy", "updatedBy", "createdAt", "updatedAt", "sequenceNumber"
    );

    public HierarchyConfig {
        if (parentLinkField == null || parentLinkField.isBlank()) {
            parentLinkField = DEFAULT_PARENT_LINK_FIELD;
        }
        if (linkType == null) {
            linkType = LinkType.ID;
        }
    }

    public static HierarchyConfig defaults() {
        return new HierarchyConfig(false, DEFAULT_PARENT_LINK_FIELD, LinkType.ID);
    }

    public boolean hasUsableFieldName() {
        return FIELD_NAME_PATTERN.matcher(parentLinkField).matches()
            && !RESERVED_FIELD_NAMES.contains(parentLinkField);
    }
}
