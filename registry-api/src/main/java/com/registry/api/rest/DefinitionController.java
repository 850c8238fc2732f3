package com.registry.api.rest;

import com.registry.api.security.Capabilities;
import com.registry.api.security.CapabilityCheck;
import com.registry.core.model.Actor;
import com.registry.core.model.DefinitionDraft;
import com.registry.core.model.DefinitionPatch;
import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.EntityDefinition;
import com.registry.core.schema.SchemaDefinition;
import com.registry.engine.config.RegistryProperties;
import com.registry.engine.service.DefinitionRegistry;
import com.registry.engine.service.RecordService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for entity definitions.
 */
@RestController
@RequestMapping("/api/v1/definitions")
public class DefinitionController {

    private final DefinitionRegistry definitionRegistry;
    private final RecordService recordService;
    private final CapabilityCheck capabilityCheck;
    private final RegistryProperties.Pagination pagination;

    public DefinitionController(
            DefinitionRegistry definitionRegistry,
            RecordService recordService,
            CapabilityCheck capabilityCheck,
            RegistryProperties properties) {
        this.definitionRegistry = definitionRegistry;
        this.recordService = recordService;
        this.capabilityCheck = capabilityCheck;
        this.pagination = properties.getPagination();
    }

    /**
     * List definitions, newest first.
     */
    @GetMapping
    public ResponseEntity<PageResponse<DefinitionResponse>> listDefinitions(
            Actor actor,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        capabilityCheck.require(actor, Capabilities.VIEW_ENTITIES);
        DefinitionQuery query = new DefinitionQuery(search, active,
            pagination.resolvePage(page), pagination.resolveLimit(limit));
        return ResponseEntity.ok(PageResponse.from(definitionRegistry.list(query), DefinitionResponse::from));
    }

    @PostMapping
    public ResponseEntity<DefinitionResponse> createDefinition(
            Actor actor,
            @RequestBody DefinitionDraft draft) {

        capabilityCheck.require(actor, Capabilities.CREATE_ENTITY);
        EntityDefinition created = definitionRegistry.create(draft, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(DefinitionResponse.from(created));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DefinitionResponse> getDefinition(Actor actor, @PathVariable UUID id) {
        capabilityCheck.require(actor, Capabilities.VIEW_ENTITIES);
        return ResponseEntity.ok(DefinitionResponse.from(definitionRegistry.getById(id)));
    }

    @GetMapping("/code/{code}")
    public ResponseEntity<DefinitionResponse> getDefinitionByCode(Actor actor, @PathVariable String code) {
        capabilityCheck.require(actor, Capabilities.VIEW_ENTITIES);
        return ResponseEntity.ok(DefinitionResponse.from(definitionRegistry.getByCode(code)));
    }

    @GetMapping("/{id}/schema")
    public ResponseEntity<SchemaDefinition> getSchema(Actor actor, @PathVariable UUID id) {
        capabilityCheck.require(actor, Capabilities.VIEW_ENTITIES);
        return ResponseEntity.ok(definitionRegistry.getById(id).schemaDefinition());
    }

    /**
     * Update a definition. A code in the body is ignored.
     */
    @PutMapping("/{id}")
    public ResponseEntity<DefinitionResponse> updateDefinition(
            Actor actor,
            @PathVariable UUID id,
            @RequestBody DefinitionPatch patch) {

        capabilityCheck.require(actor, Capabilities.EDIT_ENTITY);
        EntityDefinition current = definitionRegistry.getById(id);
        EntityDefinition updated = definitionRegistry.update(current.code(), patch, actor);
        return ResponseEntity.ok(DefinitionResponse.from(updated));
    }

    @PatchMapping("/{id}/toggle-activation")
    public ResponseEntity<DefinitionResponse> toggleActivation(Actor actor, @PathVariable UUID id) {
        capabilityCheck.require(actor, Capabilities.EDIT_ENTITY);
        return ResponseEntity.ok(DefinitionResponse.from(definitionRegistry.toggleUsable(id, actor)));
    }

    /**
     * Delete a definition that has no records left.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDefinition(Actor actor, @PathVariable UUID id) {
        capabilityCheck.require(actor, Capabilities.DELETE_ENTITY);
        EntityDefinition definition = definitionRegistry.getById(id);
        long records = recordService.countRecords(id);
        if (records > 0) {
            throw new DefinitionInUseException(definition.code(), records);
        }
        definitionRegistry.delete(id, actor);
        return ResponseEntity.noContent().build();
    }
}
