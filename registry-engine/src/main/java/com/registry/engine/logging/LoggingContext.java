package com.registry.engine.logging;

import com.registry.core.model.Actor;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the definition, record and actor they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forRecord(definitionCode, recordId, actor)) {
 *     log.info("Updating record"); // Automatically includes definitionCode, recordId, actorId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.r.e.c.RecordCoordinator - Updating record
 *   definitionCode=CUSTOMER recordId=7f0c... actorId=alice traceId=3fa85f64
 */
public final class LoggingContext implements AutoCloseable {

    public static final String DEFINITION_CODE = "definitionCode";
    public static final String RECORD_ID = "recordId";
    public static final String ACTOR_ID = "actorId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for definition-level operations.
     */
    public static LoggingContext forDefinition(String definitionCode, Actor actor) {
        return forRecord(definitionCode, null, actor);
    }

    /**
     * Create a logging context for record-level operations.
     */
    public static LoggingContext forRecord(String definitionCode, UUID recordId, Actor actor) {
        LoggingContext ctx = new LoggingContext();
        if (definitionCode != null) {
            MDC.put(DEFINITION_CODE, definitionCode);
        }
        if (recordId != null) {
            MDC.put(RECORD_ID, recordId.toString());
        }
        if (actor != null) {
            MDC.put(ACTOR_ID, actor.id());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the record ID once it is known, e.g. right after creation.
     */
    public static void setRecordId(UUID recordId) {
        if (recordId != null) {
            MDC.put(RECORD_ID, recordId.toString());
        }
    }

    /**
     * Add the definition code once it is known.
     */
    public static void setDefinitionCode(String definitionCode) {
        if (definitionCode != null) {
            MDC.put(DEFINITION_CODE, definitionCode);
        }
    }

    /**
     * Use a caller-supplied trace ID for the rest of the request.
     */
    public static void setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(TRACE_ID, traceId);
        }
    }

    /**
     * Get current trace ID from context, creating one if absent.
     */
    public static String ensureTraceId() {
        String traceId = MDC.get(TRACE_ID);
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put(TRACE_ID, traceId);
        }
        return traceId;
    }

    @Override
    public void close() {
        MDC.remove(DEFINITION_CODE);
        MDC.remove(RECORD_ID);
        MDC.remove(ACTOR_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
