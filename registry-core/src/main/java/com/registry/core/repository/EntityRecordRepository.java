package com.registry.core.repository;

import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.Page;
import com.registry.core.model.RecordQuery;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Repository for EntityRecord persistence.
 * Supports optimistic locking via sequence numbers and the atomic
 * retire-and-insert step of a version transition.
 */
public interface EntityRecordRepository {

    /**
     * Store a new record.
     *
     * @param record The record to store
     * @param businessKey Key of a versioned record, or null for non-versioned records
     * @throws com.registry.core.exception.DuplicateBusinessKeyException if another current
     *         revision of the same definition already holds the key
     */
    void save(EntityRecord record, BusinessKey businessKey);

    /**
     * Update a record in place with optimistic locking.
     * The stored copy must carry {@code record.sequenceNumber() - 1}.
     *
     * @param record The record with its sequence number already incremented
     * @throws com.registry.core.exception.OptimisticLockException if the stored sequence moved
     */
    void update(EntityRecord record);

    /**
     * Retire the current revision and insert its successor as one atomic step.
     * Commits only if the stored revision is still current and still carries
     * {@code retired.sequenceNumber() - 1}.
     *
     * @param retired The predecessor with isCurrent=false, expiredAt set and sequence incremented
     * @param successor The new current revision
     * @param businessKey Key of the successor, checked against the other current revisions
     * @throws com.registry.core.exception.OptimisticLockException if the predecessor changed
     * @throws com.registry.core.exception.DuplicateBusinessKeyException if another chain holds the key
     */
    void retireAndInsert(EntityRecord retired, EntityRecord successor, BusinessKey businessKey);

    /**
     * Start the revision chains of a definition that is becoming versioned: every
     * record without a version becomes version 1, current, and stores its key.
     * All records are marked or none are.
     *
     * @param definitionId The definition ID
     * @param keyOf Resolves a record's business key; an empty key is stored as none
     * @return Number of records marked
     * @throws com.registry.core.exception.DuplicateBusinessKeyException if two current
     *         records would share a key
     */
    int startVersioning(UUID definitionId, Function<EntityRecord, BusinessKey> keyOf);

    /**
     * Find a record by ID.
     *
     * @param id The record ID
     * @return The record if found
     */
    Optional<EntityRecord> findById(UUID id);

    /**
     * List records of one definition, newest first.
     *
     * @param query Filter and page
     * @return The requested page
     */
    Page<EntityRecord> query(RecordQuery query);

    /**
     * Find every revision of a definition whose data contains the key.
     *
     * @param definitionId The definition ID
     * @param businessKey The resolved business key
     * @return Matching revisions ordered by version descending
     */
    List<EntityRecord> findByBusinessKey(UUID definitionId, BusinessKey businessKey);

    /**
     * Count records (all revisions) of a definition.
     */
    long countByDefinition(UUID definitionId);

    /**
     * Hard-delete one record.
     *
     * @param id The record ID
     * @return true if a record was deleted
     */
    boolean deleteById(UUID id);
}
