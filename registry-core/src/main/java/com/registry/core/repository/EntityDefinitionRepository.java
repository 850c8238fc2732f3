package com.registry.core.repository;

import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.Page;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for EntityDefinition persistence.
 * Supports optimistic locking via sequence numbers.
 */
public interface EntityDefinitionRepository {

    /**
     * Store a new definition.
     *
     * @param definition The definition to store
     * @throws com.registry.core.exception.DuplicateCodeException if the code is taken
     */
    void save(EntityDefinition definition);

    /**
     * Update an existing definition with optimistic locking.
     * The stored copy must carry {@code definition.sequenceNumber() - 1}.
     *
     * @param definition The definition with its sequence number already incremented
     * @throws com.registry.core.exception.OptimisticLockException if the stored sequence moved
     */
    void update(EntityDefinition definition);

    /**
     * Find a definition by ID.
     *
     * @param id The definition ID
     * @return The definition if found
     */
    Optional<EntityDefinition> findById(UUID id);

    /**
     * Find a definition by its (upper-case) code.
     *
     * @param code The definition code
     * @return The definition if found
     */
    Optional<EntityDefinition> findByCode(String code);

    /**
     * List definitions, newest first.
     *
     * @param query Filter and page
     * @return The requested page
     */
    Page<EntityDefinition> find(DefinitionQuery query);

    /**
     * Delete a definition.
     *
     * @param id The definition ID
     * @return true if a definition was deleted
     */
    boolean delete(UUID id);

    /**
     * Count stored definitions.
     */
    long count();
}
