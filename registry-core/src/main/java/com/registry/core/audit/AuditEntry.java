package com.registry.core.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audited state change.
 *
 * @param subjectId id of the definition or record that changed
 * @param details   action-specific attributes, e.g. the new version number
 */
public record AuditEntry(
    AuditAction action,
    String definitionCode,
    UUID subjectId,
    String actorId,
    Instant occurredAt,
    Map<String, String> details
) {
    public AuditEntry {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String definitionCode, UUID subjectId,
                                String actorId, Instant occurredAt) {
        return new AuditEntry(action, definitionCode, subjectId, actorId, occurredAt, Map.of());
    }
}
