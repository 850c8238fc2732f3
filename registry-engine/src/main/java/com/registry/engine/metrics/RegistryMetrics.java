package com.registry.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer metrics for the entity registry.
 *
 * Metrics exposed:
 * - definitions and records created
 * - in-place record updates and version transitions
 * - validation failures and lost optimistic-lock races
 * - version transition latency
 *
 * Until {@link #bindTo} is called, meters go to a private {@link SimpleMeterRegistry}.
 */
public class RegistryMetrics implements MeterBinder {

    // Metric names
    public static final String DEFINITIONS_CREATED = "registry.definitions.created";
    public static final String RECORDS_CREATED = "registry.records.created";
    public static final String RECORDS_UPDATED = "registry.records.updated";
    public static final String RECORDS_REVISIONS = "registry.records.revisions";
    public static final String VALIDATION_FAILURES = "registry.validation.failures";
    public static final String CONCURRENCY_CONFLICTS = "registry.concurrency.conflicts";
    public static final String VERSION_TRANSITION = "registry.records.version.transition";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        // Report zero before the first definition is created
        Counter.builder(DEFINITIONS_CREATED)
            .description("Total entity definitions created")
            .register(registry);
    }

    // ========== Definition Metrics ==========

    public void definitionCreated() {
        Counter.builder(DEFINITIONS_CREATED)
            .description("Total entity definitions created")
            .register(registry)
            .increment();
    }

    // ========== Record Metrics ==========

    public void recordCreated(String definitionCode) {
        Counter.builder(RECORDS_CREATED)
            .tag("definition", definitionCode)
            .description("Total entity records created")
            .register(registry)
            .increment();
    }

    public void recordUpdated(String definitionCode) {
        Counter.builder(RECORDS_UPDATED)
            .tag("definition", definitionCode)
            .description("Total in-place record updates")
            .register(registry)
            .increment();
    }

    public void revisionCreated(String definitionCode) {
        Counter.builder(RECORDS_REVISIONS)
            .tag("definition", definitionCode)
            .description("Total record revisions created by version transitions")
            .register(registry)
            .increment();
    }

    /**
     * Time a version transition, whether it commits or not.
     */
    public <T> T timeVersionTransition(String definitionCode, Supplier<T> transition) {
        return Timer.builder(VERSION_TRANSITION)
            .tag("definition", definitionCode)
            .description("Retire-and-insert latency")
            .register(registry)
            .record(transition);
    }

    // ========== Failure Metrics ==========

    public void validationFailed(String subject) {
        Counter.builder(VALIDATION_FAILURES)
            .tag("subject", subject)
            .description("Payloads or schemas rejected by validation")
            .register(registry)
            .increment();
    }

    public void concurrencyConflict(String subject) {
        Counter.builder(CONCURRENCY_CONFLICTS)
            .tag("subject", subject)
            .description("Conditional writes rejected because the target moved")
            .register(registry)
            .increment();
    }
}
