package com.registry.core.model;

import com.registry.core.schema.SchemaDefinition;

/**
 * Partial change to a definition. Null members are left unchanged.
 * A {@code code} here is ignored: codes are immutable.
 */
public record DefinitionPatch(
    String code,
    String name,
    String description,
    SchemaDefinition schemaDefinition,
    DerivedRecordConfigPatch derivedRecordConfig
) {}
