package com.registry.core.model;

import com.registry.core.schema.SchemaDefinition;

/**
 * Input for creating a definition. Config members left null take their defaults.
 */
public record DefinitionDraft(
    String code,
    String name,
    String description,
    SchemaDefinition schemaDefinition,
    DerivedRecordConfigPatch derivedRecordConfig
) {}
