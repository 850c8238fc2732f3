package com.registry.engine.coordinator;

import com.registry.core.audit.AuditAction;
import com.registry.core.audit.AuditEntry;
import com.registry.core.audit.AuditRecorder;
import com.registry.core.exception.DuplicateBusinessKeyException;
import com.registry.core.exception.DuplicateCodeException;
import com.registry.core.exception.InvalidSchemaException;
import com.registry.core.exception.MonotonicConfigViolationException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.exception.ValidationFailedException;
import com.registry.core.model.Actor;
import com.registry.core.model.DefinitionDraft;
import com.registry.core.model.DefinitionPatch;
import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.DerivedRecordConfig;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.HierarchyConfig;
import com.registry.core.model.Page;
import com.registry.core.repository.EntityDefinitionRepository;
import com.registry.core.repository.EntityRecordRepository;
import com.registry.core.schema.SchemaDefinition;
import com.registry.core.schema.SchemaDefinitionChecker;
import com.registry.core.schema.SchemaViolation;
import com.registry.engine.logging.LoggingContext;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.service.DefinitionRegistry;
import com.registry.engine.versioning.BusinessKeyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Coordinates definition changes: normalizes and checks input, enforces the
 * configuration transition rules, and persists with optimistic locking.
 */
public class DefinitionCoordinator implements DefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefinitionCoordinator.class);

    private static final Pattern CODE = Pattern.compile(EntityDefinition.CODE_PATTERN);
    private static final String SUBJECT = "EntityDefinition";

    private final EntityDefinitionRepository repository;
    private final EntityRecordRepository recordRepository;
    private final BusinessKeyResolver keyResolver;
    private final SchemaDefinitionChecker schemaChecker;
    private final AuditRecorder auditRecorder;
    private final RegistryMetrics metrics;
    private final Clock clock;

    public DefinitionCoordinator(
            EntityDefinitionRepository repository,
            EntityRecordRepository recordRepository,
            BusinessKeyResolver keyResolver,
            SchemaDefinitionChecker schemaChecker,
            AuditRecorder auditRecorder,
            RegistryMetrics metrics,
            Clock clock) {
        this.repository = repository;
        this.recordRepository = recordRepository;
        this.keyResolver = keyResolver;
        this.schemaChecker = schemaChecker;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public EntityDefinition create(DefinitionDraft draft, Actor actor) {
        String code = normalizeCode(draft.code());
        try (var ctx = LoggingContext.forDefinition(code, actor)) {
            log.info("Creating entity definition: {}", code);

            List<SchemaViolation> violations = new ArrayList<>();
            if (code == null || code.isEmpty()) {
                violations.add(new SchemaViolation("code", SchemaViolation.REQUIRED, "is required"));
            } else if (!CODE.matcher(code).matches()) {
                violations.add(new SchemaViolation("code", SchemaViolation.PATTERN,
                    "must contain only A-Z, 0-9 and underscore"));
            }
            String name = trimToNull(draft.name());
            if (name == null) {
                violations.add(new SchemaViolation("name", SchemaViolation.REQUIRED, "is required"));
            }
            if (!violations.isEmpty()) {
                metrics.validationFailed(SUBJECT);
                throw new ValidationFailedException(violations);
            }

            SchemaDefinition schema = draft.schemaDefinition() != null
                ? draft.schemaDefinition()
                : SchemaDefinition.empty();
            DerivedRecordConfig config = DerivedRecordConfig.defaults().merge(draft.derivedRecordConfig());
            checkSchemaAndConfig(schema, config);

            if (repository.findByCode(code).isPresent()) {
                log.warn("Rejected duplicate definition code: {}", code);
                throw new DuplicateCodeException(code);
            }

            Instant now = clock.instant();
            EntityDefinition definition = EntityDefinition.builder()
                .id(UUID.randomUUID())
                .code(code)
                .name(name)
                .description(trimToNull(draft.description()))
                .schemaDefinition(schema)
                .derivedRecordConfig(config)
                .createdBy(actor.id())
                .createdAt(now)
                .touchedBy(actor.id(), now)
                .sequenceNumber(0)
                .build();

            repository.save(definition);
            metrics.definitionCreated();
            auditRecorder.record(AuditEntry.of(AuditAction.DEFINITION_CREATED, code, definition.id(), actor.id(), now));

            log.info("Created entity definition: {} ({})", code, definition.id());
            return definition;
        }
    }

    @Override
    public EntityDefinition update(String code, DefinitionPatch patch, Actor actor) {
        EntityDefinition current = getByCode(code);
        try (var ctx = LoggingContext.forDefinition(current.code(), actor)) {
            log.info("Updating entity definition: {}", current.code());
            Instant now = clock.instant();

            String attemptedCode = normalizeCode(patch.code());
            if (attemptedCode != null && !attemptedCode.isEmpty() && !attemptedCode.equals(current.code())) {
                log.warn("Ignoring attempt to change definition code {} to {}", current.code(), attemptedCode);
                auditRecorder.record(new AuditEntry(AuditAction.DEFINITION_CODE_CHANGE_IGNORED,
                    current.code(), current.id(), actor.id(), now, Map.of("attemptedCode", attemptedCode)));
            }

            DerivedRecordConfig config = current.derivedRecordConfig().merge(patch.derivedRecordConfig());
            requireMonotonic(current, config);

            EntityDefinition.Builder builder = current.toBuilder();
            if (patch.name() != null) {
                String name = trimToNull(patch.name());
                if (name == null) {
                    metrics.validationFailed(SUBJECT);
                    throw ValidationFailedException.of("name", SchemaViolation.REQUIRED, "must not be blank");
                }
                builder.name(name);
            }
            if (patch.description() != null) {
                builder.description(trimToNull(patch.description()));
            }

            SchemaDefinition schema = patch.schemaDefinition() != null
                ? patch.schemaDefinition()
                : current.schemaDefinition();
            checkSchemaAndConfig(schema, config);

            EntityDefinition updated = builder
                .schemaDefinition(schema)
                .derivedRecordConfig(config)
                .touchedBy(actor.id(), now)
                .incrementSequence()
                .build();

            if (!current.isVersioned() && updated.isVersioned()) {
                startRevisionChains(updated);
            }
            persist(updated);
            auditRecorder.record(AuditEntry.of(AuditAction.DEFINITION_UPDATED, updated.code(), updated.id(), actor.id(), now));

            log.info("Updated entity definition: {} (sequence {})", updated.code(), updated.sequenceNumber());
            return updated;
        }
    }

    @Override
    public EntityDefinition getByCode(String code) {
        String normalized = normalizeCode(code);
        return repository.findByCode(normalized)
            .orElseThrow(() -> new NotFoundException(SUBJECT, normalized));
    }

    @Override
    public EntityDefinition getById(UUID id) {
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException(SUBJECT, String.valueOf(id)));
    }

    @Override
    public EntityDefinition toggleUsable(UUID id, Actor actor) {
        EntityDefinition current = getById(id);
        try (var ctx = LoggingContext.forDefinition(current.code(), actor)) {
            Instant now = clock.instant();
            boolean usable = !current.isUsable();

            EntityDefinition toggled = current.toBuilder()
                .derivedRecordConfig(current.derivedRecordConfig().withEntityActive(usable))
                .touchedBy(actor.id(), now)
                .incrementSequence()
                .build();

            persist(toggled);
            auditRecorder.record(new AuditEntry(AuditAction.DEFINITION_TOGGLED, toggled.code(), toggled.id(),
                actor.id(), now, Map.of("entityActive", String.valueOf(usable))));

            log.info("Entity definition {} is now {}", toggled.code(), usable ? "active" : "inactive");
            return toggled;
        }
    }

    @Override
    public void delete(UUID id, Actor actor) {
        EntityDefinition current = getById(id);
        try (var ctx = LoggingContext.forDefinition(current.code(), actor)) {
            if (!repository.delete(id)) {
                throw new NotFoundException(SUBJECT, id.toString());
            }
            auditRecorder.record(AuditEntry.of(AuditAction.DEFINITION_DELETED, current.code(), id, actor.id(), clock.instant()));
            log.info("Deleted entity definition: {}", current.code());
        }
    }

    @Override
    public Page<EntityDefinition> list(DefinitionQuery query) {
        log.debug("Listing entity definitions: search={} active={} page={} limit={}",
            query.search(), query.active(), query.page(), query.limit());
        return repository.find(query);
    }

    // ========== Helper Methods ==========

    /**
     * Records written while the definition was unversioned become version 1 of their own chain.
     * Fails without changes if two of them share a business key.
     */
    private void startRevisionChains(EntityDefinition versioned) {
        try {
            int marked = recordRepository.startVersioning(versioned.id(),
                record -> keyResolver.resolve(versioned, record.data()));
            log.info("Versioning enabled on {}: {} existing records start at version 1", versioned.code(), marked);
        } catch (DuplicateBusinessKeyException e) {
            log.warn("Rejected enabling versioning on {}: existing records share a business key", versioned.code());
            throw e;
        }
    }

    private void persist(EntityDefinition updated) {
        try {
            repository.update(updated);
        } catch (OptimisticLockException e) {
            metrics.concurrencyConflict(SUBJECT);
            log.warn("Concurrent modification of entity definition {}", updated.code());
            throw e;
        }
    }

    private void requireMonotonic(EntityDefinition current, DerivedRecordConfig next) {
        if (current.derivedRecordConfig().versioning().enabled() && !next.versioning().enabled()) {
            log.warn("Rejected disabling versioning on {}", current.code());
            throw new MonotonicConfigViolationException(current.code(), "versioning.enabled");
        }
        if (current.derivedRecordConfig().hierarchy().enabled() && !next.hierarchy().enabled()) {
            log.warn("Rejected disabling hierarchy on {}", current.code());
            throw new MonotonicConfigViolationException(current.code(), "hierarchy.enabled");
        }
    }

    private void checkSchemaAndConfig(SchemaDefinition schema, DerivedRecordConfig config) {
        List<SchemaViolation> violations = new ArrayList<>(schemaChecker.check(schema));
        HierarchyConfig hierarchy = config.hierarchy();
        if (!hierarchy.hasUsableFieldName()) {
            violations.add(new SchemaViolation("derivedRecordConfig.hierarchy.parentLinkField",
                SchemaViolation.PATTERN,
                "'" + hierarchy.parentLinkField() + "' is not an identifier or is a reserved record attribute"));
        }
        if (!violations.isEmpty()) {
            metrics.validationFailed(SUBJECT);
            throw new InvalidSchemaException(violations);
        }
    }

    private static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
