package com.registry.engine.audit;

import com.registry.core.audit.AuditEntry;
import com.registry.core.audit.AuditRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries as structured log lines on the {@code registry.audit} logger,
 * so they can be routed to their own appender.
 */
public class Slf4jAuditRecorder implements AuditRecorder {

    private static final Logger audit = LoggerFactory.getLogger("registry.audit");

    @Override
    public void record(AuditEntry entry) {
        audit.info("action={} definitionCode={} subjectId={} actorId={} at={} details={}",
            entry.action(),
            entry.definitionCode(),
            entry.subjectId(),
            entry.actorId(),
            entry.occurredAt(),
            entry.details());
    }
}
