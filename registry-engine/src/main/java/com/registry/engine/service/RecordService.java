package com.registry.engine.service;

import com.registry.core.model.Actor;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.Page;
import com.registry.core.model.RecordDraft;
import com.registry.core.model.RecordPatch;
import com.registry.core.model.RecordQuery;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for record operations. Records are addressed by definition code and id;
 * a record belonging to another definition is reported as not found.
 */
public interface RecordService {

    /**
     * Create a record of the given definition.
     *
     * @param definitionCode The definition code
     * @param draft The record input
     * @param actor The creating actor
     * @return The stored record
     */
    EntityRecord create(String definitionCode, RecordDraft draft, Actor actor);

    /**
     * Get one record.
     *
     * @throws com.registry.core.exception.NotFoundException if absent or of another definition
     */
    EntityRecord get(String definitionCode, UUID id);

    /**
     * Update a record. Versioned definitions produce a new revision instead of
     * mutating the targeted one.
     *
     * @return The updated record, or the new current revision
     */
    EntityRecord update(String definitionCode, UUID id, RecordPatch patch, Actor actor);

    /**
     * Flip a record's isActive flag.
     */
    EntityRecord toggleActivation(String definitionCode, UUID id, Actor actor);

    /**
     * Hard-delete one record (any revision).
     */
    void delete(String definitionCode, UUID id, Actor actor);

    /**
     * List every revision sharing the record's business key, newest version first.
     */
    List<EntityRecord> listRevisions(String definitionCode, UUID id);

    /**
     * List records of one definition, newest first.
     */
    Page<EntityRecord> query(RecordQuery query);

    /**
     * Count all records (every revision) of a definition.
     */
    long countRecords(UUID definitionId);
}
