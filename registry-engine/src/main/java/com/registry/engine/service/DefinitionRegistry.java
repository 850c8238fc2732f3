package com.registry.engine.service;

import com.registry.core.model.Actor;
import com.registry.core.model.DefinitionDraft;
import com.registry.core.model.DefinitionPatch;
import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.Page;

import java.util.UUID;

/**
 * Owns entity definitions: identity, immutability of the code, and the rules
 * for how a definition's record behavior may change over time.
 */
public interface DefinitionRegistry {

    /**
     * Create a new definition.
     *
     * @param draft The definition input; code is trimmed and upper-cased
     * @param actor The creating actor
     * @return The stored definition
     * @throws com.registry.core.exception.ValidationFailedException for a malformed code or blank name
     * @throws com.registry.core.exception.InvalidSchemaException for an unusable schema or link field
     * @throws com.registry.core.exception.DuplicateCodeException if the code is taken
     */
    EntityDefinition create(DefinitionDraft draft, Actor actor);

    /**
     * Apply a partial change. A code in the patch is ignored and audited.
     *
     * @param code The definition code
     * @param patch The change
     * @param actor The changing actor
     * @return The stored definition
     * @throws com.registry.core.exception.NotFoundException if no definition has the code
     * @throws com.registry.core.exception.MonotonicConfigViolationException if versioning or
     *         hierarchy would be switched off
     * @throws com.registry.core.exception.OptimisticLockException if the definition changed meanwhile
     */
    EntityDefinition update(String code, DefinitionPatch patch, Actor actor);

    /**
     * Get a definition by code (case-insensitive).
     *
     * @throws com.registry.core.exception.NotFoundException if absent
     */
    EntityDefinition getByCode(String code);

    /**
     * Get a definition by ID.
     *
     * @throws com.registry.core.exception.NotFoundException if absent
     */
    EntityDefinition getById(UUID id);

    /**
     * Flip activation.entityActive, i.e. whether the definition accepts record writes.
     */
    EntityDefinition toggleUsable(UUID id, Actor actor);

    /**
     * Delete a definition. Callers check that no records reference it first.
     */
    void delete(UUID id, Actor actor);

    /**
     * List definitions, newest first.
     */
    Page<EntityDefinition> list(DefinitionQuery query);
}
