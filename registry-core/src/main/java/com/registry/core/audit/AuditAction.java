package com.registry.core.audit;

/**
 * State changes that produce an audit entry.
 */
public enum AuditAction {
    DEFINITION_CREATED,
    DEFINITION_UPDATED,
    DEFINITION_CODE_CHANGE_IGNORED,
    DEFINITION_TOGGLED,
    DEFINITION_DELETED,

    RECORD_CREATED,
    RECORD_UPDATED,
    RECORD_REVISED,
    RECORD_TOGGLED,
    RECORD_DELETED
}
