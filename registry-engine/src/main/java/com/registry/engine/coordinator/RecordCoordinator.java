package com.registry.engine.coordinator;

import com.registry.core.audit.AuditAction;
import com.registry.core.audit.AuditEntry;
import com.registry.core.audit.AuditRecorder;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.model.Actor;
import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.Page;
import com.registry.core.model.RecordDraft;
import com.registry.core.model.RecordPatch;
import com.registry.core.model.RecordQuery;
import com.registry.core.repository.EntityRecordRepository;
import com.registry.engine.lifecycle.RecordLifecycleManager;
import com.registry.engine.logging.LoggingContext;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.service.DefinitionRegistry;
import com.registry.engine.service.RecordService;
import com.registry.engine.versioning.VersioningEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Coordinates record operations: resolves the definition, runs the lifecycle
 * rules, persists, and routes updates of versioned definitions to the
 * versioning engine instead of mutating in place.
 */
public class RecordCoordinator implements RecordService {

    private static final Logger log = LoggerFactory.getLogger(RecordCoordinator.class);

    private static final String SUBJECT = "EntityRecord";

    private final DefinitionRegistry definitionRegistry;
    private final RecordLifecycleManager lifecycleManager;
    private final VersioningEngine versioningEngine;
    private final EntityRecordRepository repository;
    private final AuditRecorder auditRecorder;
    private final RegistryMetrics metrics;
    private final Clock clock;

    public RecordCoordinator(
            DefinitionRegistry definitionRegistry,
            RecordLifecycleManager lifecycleManager,
            VersioningEngine versioningEngine,
            EntityRecordRepository repository,
            AuditRecorder auditRecorder,
            RegistryMetrics metrics,
            Clock clock) {
        this.definitionRegistry = definitionRegistry;
        this.lifecycleManager = lifecycleManager;
        this.versioningEngine = versioningEngine;
        this.repository = repository;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public EntityRecord create(String definitionCode, RecordDraft draft, Actor actor) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        try (var ctx = LoggingContext.forDefinition(definition.code(), actor)) {
            EntityRecord record = lifecycleManager.prepareForCreate(definition, draft, actor);
            LoggingContext.setRecordId(record.id());

            BusinessKey key = definition.isVersioned()
                ? versioningEngine.resolveKey(definition, record)
                : null;
            repository.save(record, key);

            metrics.recordCreated(definition.code());
            auditRecorder.record(AuditEntry.of(AuditAction.RECORD_CREATED, definition.code(), record.id(),
                actor.id(), record.createdAt()));
            log.info("Created record {} of {}", record.id(), definition.code());
            return record;
        }
    }

    @Override
    public EntityRecord get(String definitionCode, UUID id) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        return load(definition, id);
    }

    @Override
    public EntityRecord update(String definitionCode, UUID id, RecordPatch patch, Actor actor) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        try (var ctx = LoggingContext.forRecord(definition.code(), id, actor)) {
            EntityRecord existing = load(definition, id);

            if (definition.isVersioned()) {
                EntityRecord successor = versioningEngine.applyUpdate(definition, existing, patch, actor);
                auditRecorder.record(new AuditEntry(AuditAction.RECORD_REVISED, definition.code(), successor.id(),
                    actor.id(), successor.createdAt(), Map.of(
                        "previousId", existing.id().toString(),
                        "version", String.valueOf(successor.version()))));
                return successor;
            }

            EntityRecord updated = lifecycleManager.prepareForUpdate(definition, existing, patch, actor);
            try {
                repository.update(updated);
            } catch (OptimisticLockException e) {
                metrics.concurrencyConflict(SUBJECT);
                log.warn("Concurrent modification of record {}", id);
                throw e;
            }

            metrics.recordUpdated(definition.code());
            auditRecorder.record(AuditEntry.of(AuditAction.RECORD_UPDATED, definition.code(), id,
                actor.id(), updated.updatedAt()));
            log.info("Updated record {} of {} (sequence {})", id, definition.code(), updated.sequenceNumber());
            return updated;
        }
    }

    @Override
    public EntityRecord toggleActivation(String definitionCode, UUID id, Actor actor) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        try (var ctx = LoggingContext.forRecord(definition.code(), id, actor)) {
            EntityRecord toggled = lifecycleManager.toggleActivation(definition, load(definition, id), actor);
            auditRecorder.record(new AuditEntry(AuditAction.RECORD_TOGGLED, definition.code(), id,
                actor.id(), toggled.updatedAt(), Map.of("isActive", String.valueOf(toggled.isActive()))));
            return toggled;
        }
    }

    @Override
    public void delete(String definitionCode, UUID id, Actor actor) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        try (var ctx = LoggingContext.forRecord(definition.code(), id, actor)) {
            lifecycleManager.delete(definition, load(definition, id), actor);
            auditRecorder.record(AuditEntry.of(AuditAction.RECORD_DELETED, definition.code(), id,
                actor.id(), clock.instant()));
        }
    }

    @Override
    public List<EntityRecord> listRevisions(String definitionCode, UUID id) {
        EntityDefinition definition = definitionRegistry.getByCode(definitionCode);
        return versioningEngine.listRevisions(definition, load(definition, id));
    }

    @Override
    public Page<EntityRecord> query(RecordQuery query) {
        EntityDefinition definition = definitionRegistry.getByCode(query.definitionCode());
        log.debug("Querying records of {}: currentOnly={} active={} search={} page={} limit={}",
            definition.code(), query.currentOnly(), query.active(), query.search(), query.page(), query.limit());
        return repository.query(new RecordQuery(
            definition.code(), query.currentOnly(), query.active(), query.search(), query.page(), query.limit()));
    }

    @Override
    public long countRecords(UUID definitionId) {
        return repository.countByDefinition(definitionId);
    }

    private EntityRecord load(EntityDefinition definition, UUID id) {
        return repository.findById(id)
            .filter(record -> definition.id().equals(record.definitionId()))
            .orElseThrow(() -> new NotFoundException(SUBJECT, String.valueOf(id)));
    }
}
