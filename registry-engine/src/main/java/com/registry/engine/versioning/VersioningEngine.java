package com.registry.engine.versioning;

import com.registry.core.exception.IndeterminateIdentityException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.exception.VersioningNotEnabledException;
import com.registry.core.model.Actor;
import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.RecordPatch;
import com.registry.core.repository.EntityRecordRepository;
import com.registry.engine.lifecycle.RecordLifecycleManager;
import com.registry.engine.metrics.RegistryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Turns an update of a versioned record into a version transition: the current
 * revision is retired and an immutable successor becomes current.
 *
 * Transition:
 *   current(v=n, isCurrent=true)  ->  retired(v=n, isCurrent=false, expiredAt=now)
 *                                 +   successor(v=n+1, isCurrent=true, new id)
 *
 * Both writes commit together, and only if the targeted revision is still current
 * with the same sequence number. Of two racing transitions on one revision,
 * exactly one succeeds; the other gets {@link OptimisticLockException}.
 */
public class VersioningEngine {

    private static final Logger log = LoggerFactory.getLogger(VersioningEngine.class);

    private static final String SUBJECT = "EntityRecord";

    private final RecordLifecycleManager lifecycleManager;
    private final EntityRecordRepository repository;
    private final BusinessKeyResolver keyResolver;
    private final RegistryMetrics metrics;
    private final Clock clock;

    public VersioningEngine(
            RecordLifecycleManager lifecycleManager,
            EntityRecordRepository repository,
            BusinessKeyResolver keyResolver,
            RegistryMetrics metrics,
            Clock clock) {
        this.lifecycleManager = lifecycleManager;
        this.repository = repository;
        this.keyResolver = keyResolver;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Apply a patch by creating the next revision.
     *
     * @return The new current revision
     * @throws VersioningNotEnabledException if the definition is not versioned
     * @throws IndeterminateIdentityException if the revision has no business key
     * @throws OptimisticLockException if the revision is retired or changed meanwhile
     */
    public EntityRecord applyUpdate(EntityDefinition definition, EntityRecord currentRevision,
                                    RecordPatch patch, Actor actor) {
        requireVersioned(definition);
        if (!currentRevision.isCurrentRevision()) {
            log.warn("Rejected update of retired revision {} (version {})",
                currentRevision.id(), currentRevision.version());
            throw new OptimisticLockException(String.format(
                "Revision %s of %s is retired; update the current revision",
                currentRevision.id(), definition.code()));
        }
        resolveKey(definition, currentRevision);

        EntityRecord candidate = lifecycleManager.prepareForUpdate(definition, currentRevision, patch, actor);
        BusinessKey successorKey = resolveKey(definition, candidate);

        Instant now = clock.instant();
        int nextVersion = (currentRevision.version() != null ? currentRevision.version() : 1) + 1;

        EntityRecord successor = candidate.toBuilder()
            .id(UUID.randomUUID())
            .version(nextVersion)
            .isCurrent(true)
            .expiredAt(null)
            .createdBy(actor.id(), now)
            .updatedBy(actor.id(), now)
            .sequenceNumber(0)
            .build();

        // Only the chain markers change on the predecessor
        EntityRecord retired = currentRevision.toBuilder()
            .version(currentRevision.version() != null ? currentRevision.version() : 1)
            .isCurrent(false)
            .expiredAt(now)
            .incrementSequence()
            .build();

        try {
            metrics.timeVersionTransition(definition.code(), () -> {
                repository.retireAndInsert(retired, successor, successorKey);
                return successor;
            });
        } catch (OptimisticLockException e) {
            metrics.concurrencyConflict(SUBJECT);
            log.warn("Lost version transition race on record {} of {}", currentRevision.id(), definition.code());
            throw e;
        }

        metrics.revisionCreated(definition.code());
        log.info("Record {} of {} revised: version {} -> {} (new id {})",
            currentRevision.id(), definition.code(), nextVersion - 1, nextVersion, successor.id());
        return successor;
    }

    /**
     * Every revision sharing the given revision's business key, newest version first.
     */
    public List<EntityRecord> listRevisions(EntityDefinition definition, EntityRecord revision) {
        requireVersioned(definition);
        BusinessKey key = resolveKey(definition, revision);
        log.debug("Listing revisions of {} for key {}", definition.code(), key);
        return repository.findByBusinessKey(definition.id(), key);
    }

    /**
     * Resolve the key, failing when a versioned record has none.
     */
    public BusinessKey resolveKey(EntityDefinition definition, EntityRecord record) {
        BusinessKey key = keyResolver.resolve(definition, record.data());
        if (key.isEmpty()) {
            throw new IndeterminateIdentityException(definition.code(), String.valueOf(record.id()));
        }
        return key;
    }

    private static void requireVersioned(EntityDefinition definition) {
        if (!definition.isVersioned()) {
            throw new VersioningNotEnabledException(definition.code());
        }
    }
}
