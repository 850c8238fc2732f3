package com.registry.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Partial change to a record. Null members keep their current values.
 * Keys in {@code data} replace top-level data keys; a key mapped to JSON null removes it.
 *
 * @param definitionCode if present, must equal the record's code
 */
public record RecordPatch(
    String definitionCode,
    ObjectNode data,
    Boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,
    String parent
) {
    public static RecordPatch ofData(ObjectNode data) {
        return new RecordPatch(null, data, null, null, null, null);
    }
}
