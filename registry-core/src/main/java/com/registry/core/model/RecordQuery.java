package com.registry.core.model;

/**
 * Filter for listing the records of one definition.
 *
 * @param currentOnly skip retired revisions; non-versioned records always count as current
 * @param active      filter on isActive; null for all
 * @param search      case-insensitive substring of the serialized data; null for all
 */
public record RecordQuery(
    String definitionCode,
    boolean currentOnly,
    Boolean active,
    String search,
    int page,
    int limit
) {}
