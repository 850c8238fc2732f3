package com.registry.core.audit;

/**
 * Side channel receiving one entry per state change.
 * Implementations must not throw; a failing audit sink must not fail the operation.
 */
@FunctionalInterface
public interface AuditRecorder {

    void record(AuditEntry entry);

    /**
     * Recorder that drops every entry.
     */
    static AuditRecorder noop() {
        return entry -> { };
    }
}
