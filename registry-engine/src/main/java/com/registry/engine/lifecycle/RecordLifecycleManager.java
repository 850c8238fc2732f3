package com.registry.engine.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.registry.core.exception.ActivationNotEnabledException;
import com.registry.core.exception.DefinitionInactiveException;
import com.registry.core.exception.ImmutableFieldViolationException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.exception.ValidationFailedException;
import com.registry.core.model.ActivationConfig;
import com.registry.core.model.Actor;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.HierarchyConfig;
import com.registry.core.model.ParentLink;
import com.registry.core.model.RecordDraft;
import com.registry.core.model.RecordPatch;
import com.registry.core.repository.EntityRecordRepository;
import com.registry.core.schema.SchemaValidator;
import com.registry.core.schema.SchemaViolation;
import com.registry.core.schema.ValidationResult;
import com.registry.engine.metrics.RegistryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies a definition's record behavior when a record is created or changed.
 *
 * Rules:
 * - writes require a usable definition (activation.entityActive); toggle and delete do not
 * - data is validated after defaults are applied; every violation is reported at once
 * - isActive exists only with activation enabled, bounds only with time-bounding,
 *   a parent link only with hierarchy enabled
 * - effectiveFrom must precede effectiveTo when both are set
 *
 * prepareFor* methods only build the record; persisting it is the caller's job.
 */
public class RecordLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(RecordLifecycleManager.class);

    private static final String SUBJECT = "EntityRecord";

    private final SchemaValidator validator;
    private final EntityRecordRepository repository;
    private final RegistryMetrics metrics;
    private final Clock clock;

    public RecordLifecycleManager(
            SchemaValidator validator,
            EntityRecordRepository repository,
            RegistryMetrics metrics,
            Clock clock) {
        this.validator = validator;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Build a new, not yet stored record from caller input.
     */
    public EntityRecord prepareForCreate(EntityDefinition definition, RecordDraft draft, Actor actor) {
        requireUsable(definition);
        Instant now = clock.instant();

        List<SchemaViolation> violations = new ArrayList<>();
        ValidationResult validation = validator.validate(definition.schemaDefinition(), dataOrEmpty(draft.data()));
        violations.addAll(validation.violations());

        ActivationConfig activation = definition.activation();
        Boolean isActive = null;
        if (activation.enabled()) {
            isActive = draft.isActive() != null ? draft.isActive() : activation.defaultState();
        }

        Instant effectiveFrom = null;
        Instant effectiveTo = null;
        if (activation.useTimeBounding()) {
            effectiveFrom = draft.effectiveFrom() != null ? draft.effectiveFrom() : now;
            effectiveTo = draft.effectiveTo();
            checkBounds(effectiveFrom, effectiveTo, violations);
        }

        rejectIfInvalid(definition, violations);

        boolean versioned = definition.isVersioned();
        return EntityRecord.builder()
            .id(UUID.randomUUID())
            .definition(definition)
            .data(validation.payload())
            .isActive(isActive)
            .effectiveFrom(effectiveFrom)
            .effectiveTo(effectiveTo)
            .version(versioned ? 1 : null)
            .isCurrent(versioned ? Boolean.TRUE : null)
            .expiredAt(null)
            .parentRef(parentLink(definition.hierarchy(), draft.parent(), null))
            .createdBy(actor.id(), now)
            .updatedBy(actor.id(), now)
            .sequenceNumber(0)
            .build();
    }

    /**
     * Build the changed copy of a record, with its sequence number incremented.
     * Under versioning the caller turns this candidate into a new revision.
     */
    public EntityRecord prepareForUpdate(EntityDefinition definition, EntityRecord existing,
                                         RecordPatch patch, Actor actor) {
        requireUsable(definition);
        if (patch.definitionCode() != null && !patch.definitionCode().trim().equalsIgnoreCase(existing.definitionCode())) {
            log.warn("Rejected attempt to move record {} to definition {}", existing.id(), patch.definitionCode());
            throw new ImmutableFieldViolationException(SUBJECT, "definitionCode");
        }

        List<SchemaViolation> violations = new ArrayList<>();
        ObjectNode merged = mergeData(existing.data(), patch.data());
        ValidationResult validation = validator.validate(definition.schemaDefinition(), merged);
        violations.addAll(validation.violations());

        ActivationConfig activation = definition.activation();
        Boolean isActive = null;
        if (activation.enabled()) {
            isActive = firstNonNull(patch.isActive(), existing.isActive(), activation.defaultState());
        }

        Instant effectiveFrom = null;
        Instant effectiveTo = null;
        if (activation.useTimeBounding()) {
            effectiveFrom = firstNonNull(patch.effectiveFrom(), existing.effectiveFrom(), existing.createdAt());
            effectiveTo = patch.effectiveTo() != null ? patch.effectiveTo() : existing.effectiveTo();
            checkBounds(effectiveFrom, effectiveTo, violations);
        }

        rejectIfInvalid(definition, violations);

        return existing.toBuilder()
            .data(validation.payload())
            .isActive(isActive)
            .effectiveFrom(effectiveFrom)
            .effectiveTo(effectiveTo)
            .parentRef(parentLink(definition.hierarchy(), patch.parent(), existing.parentRef()))
            .updatedBy(actor.id(), clock.instant())
            .incrementSequence()
            .build();
    }

    /**
     * Flip isActive and store the change conditionally.
     *
     * @throws ActivationNotEnabledException if the definition has no activation
     * @throws OptimisticLockException if the record is a retired revision or changed meanwhile
     */
    public EntityRecord toggleActivation(EntityDefinition definition, EntityRecord record, Actor actor) {
        if (!definition.activation().enabled()) {
            throw new ActivationNotEnabledException(definition.code());
        }
        if (!record.isCurrentRevision()) {
            throw new OptimisticLockException(String.format(
                "Revision %s of %s is retired; toggle the current revision", record.id(), definition.code()));
        }

        boolean current = record.isActive() != null ? record.isActive() : definition.activation().defaultState();
        EntityRecord toggled = record.toBuilder()
            .isActive(!current)
            .updatedBy(actor.id(), clock.instant())
            .incrementSequence()
            .build();

        try {
            repository.update(toggled);
        } catch (OptimisticLockException e) {
            metrics.concurrencyConflict(SUBJECT);
            throw e;
        }
        log.info("Record {} is now {}", record.id(), toggled.isActive() ? "active" : "inactive");
        return toggled;
    }

    /**
     * Hard-delete one record, whichever revision it is.
     */
    public void delete(EntityDefinition definition, EntityRecord record, Actor actor) {
        if (!repository.deleteById(record.id())) {
            throw new NotFoundException(SUBJECT, record.id().toString());
        }
        log.info("Deleted record {} of {} on behalf of {}", record.id(), definition.code(), actor.id());
    }

    // ========== Helper Methods ==========

    private void requireUsable(EntityDefinition definition) {
        if (!definition.isUsable()) {
            log.warn("Rejected record write on inactive definition {}", definition.code());
            throw new DefinitionInactiveException(definition.code());
        }
    }

    private void rejectIfInvalid(EntityDefinition definition, List<SchemaViolation> violations) {
        if (!violations.isEmpty()) {
            metrics.validationFailed(SUBJECT);
            log.warn("Rejected record for {}: {} violation(s)", definition.code(), violations.size());
            throw new ValidationFailedException(violations);
        }
    }

    private static void checkBounds(Instant from, Instant to, List<SchemaViolation> violations) {
        if (from != null && to != null && !from.isBefore(to)) {
            violations.add(new SchemaViolation("effectiveTo", SchemaViolation.EFFECTIVE_RANGE,
                "must be after effectiveFrom"));
        }
    }

    /**
     * Top-level merge: patch keys replace existing ones, JSON null removes a key.
     */
    static ObjectNode mergeData(ObjectNode existing, ObjectNode patch) {
        ObjectNode merged = existing != null ? existing.deepCopy() : JsonNodeFactory.instance.objectNode();
        if (patch == null) {
            return merged;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue() == null || field.getValue().isNull()) {
                merged.remove(field.getKey());
            } else {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return merged;
    }

    /**
     * A blank supplied value clears the link; no value keeps the existing one.
     */
    private static ParentLink parentLink(HierarchyConfig hierarchy, String supplied, ParentLink existing) {
        if (!hierarchy.enabled()) {
            return null;
        }
        if (supplied == null) {
            return existing;
        }
        if (supplied.isBlank()) {
            return null;
        }
        return new ParentLink(hierarchy.linkType(), supplied.trim());
    }

    private static JsonNode dataOrEmpty(ObjectNode data) {
        return data != null ? data : JsonNodeFactory.instance.objectNode();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
