package com.registry.core.model;

/**
 * Filter for listing definitions.
 *
 * @param search case-insensitive substring of name, description or code; null for all
 * @param active filter on activation.entityActive; null for all
 */
public record DefinitionQuery(
    String search,
    Boolean active,
    int page,
    int limit
) {}
