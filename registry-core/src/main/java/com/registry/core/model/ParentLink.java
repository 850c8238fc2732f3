package com.registry.core.model;

/**
 * Reference from a record to its parent. The parent is not required to exist.
 */
public record ParentLink(
    LinkType linkType,
    String value
) {
    public ParentLink {
        if (linkType == null) {
            throw new IllegalArgumentException("linkType must not be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("parent link value must not be blank");
        }
    }
}
