package com.registry.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Input for creating a record.
 *
 * @param parent parent id or code, depending on the definition's link type
 */
public record RecordDraft(
    ObjectNode data,
    Boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,
    String parent
) {}
