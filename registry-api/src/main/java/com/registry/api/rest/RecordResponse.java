package com.registry.api.rest;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A record as returned to callers. The parent link, when there is one, appears
 * under the definition's configured attribute name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordResponse(
    UUID id,
    UUID definitionId,
    String definitionCode,
    ObjectNode data,
    Boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,
    Integer version,
    Boolean isCurrent,
    Instant expiredAt,
    String createdBy,
    String updatedBy,
    Instant createdAt,
    Instant updatedAt,
    long sequenceNumber,
    @JsonIgnore String parentLinkField,
    @JsonIgnore String parentValue
) {
    public static RecordResponse from(EntityRecord record, EntityDefinition definition) {
        return new RecordResponse(
            record.id(),
            record.definitionId(),
            record.definitionCode(),
            record.data(),
            record.isActive(),
            record.effectiveFrom(),
            record.effectiveTo(),
            record.version(),
            record.isCurrent(),
            record.expiredAt(),
            record.createdBy(),
            record.updatedBy(),
            record.createdAt(),
            record.updatedAt(),
            record.sequenceNumber(),
            definition.hierarchy().parentLinkField(),
            record.parentRef() != null ? record.parentRef().value() : null
        );
    }

    @JsonAnyGetter
    public Map<String, Object> parentAttribute() {
        return parentValue == null ? Map.of() : Map.of(parentLinkField, parentValue);
    }
}
