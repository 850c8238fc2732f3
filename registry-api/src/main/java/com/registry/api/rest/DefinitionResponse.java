package com.registry.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.registry.core.model.DerivedRecordConfig;
import com.registry.core.model.EntityDefinition;
import com.registry.core.schema.SchemaDefinition;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DefinitionResponse(
    UUID id,
    String code,
    String name,
    String description,
    SchemaDefinition schemaDefinition,
    DerivedRecordConfig derivedRecordConfig,
    String createdBy,
    Instant createdAt,
    String updatedBy,
    Instant updatedAt,
    long sequenceNumber
) {
    public static DefinitionResponse from(EntityDefinition definition) {
        return new DefinitionResponse(
            definition.id(),
            definition.code(),
            definition.name(),
            definition.description(),
            definition.schemaDefinition(),
            definition.derivedRecordConfig(),
            definition.createdBy(),
            definition.createdAt(),
            definition.updatedBy(),
            definition.updatedAt(),
            definition.sequenceNumber()
        );
    }
}
