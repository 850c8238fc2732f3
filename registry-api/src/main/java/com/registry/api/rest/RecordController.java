package com.registry.api.rest;

import com.registry.api.security.Capabilities;
import com.registry.api.security.CapabilityCheck;
import com.registry.core.model.Actor;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.RecordQuery;
import com.registry.engine.config.RegistryProperties;
import com.registry.engine.service.DefinitionRegistry;
import com.registry.engine.service.RecordService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the records of one definition.
 */
@RestController
@RequestMapping("/api/v1/records/{code}")
public class RecordController {

    private final RecordService recordService;
    private final DefinitionRegistry definitionRegistry;
    private final CapabilityCheck capabilityCheck;
    private final RegistryProperties.Pagination pagination;

    public RecordController(
            RecordService recordService,
            DefinitionRegistry definitionRegistry,
            CapabilityCheck capabilityCheck,
            RegistryProperties properties) {
        this.recordService = recordService;
        this.definitionRegistry = definitionRegistry;
        this.capabilityCheck = capabilityCheck;
        this.pagination = properties.getPagination();
    }

    @GetMapping
    public ResponseEntity<PageResponse<RecordResponse>> queryRecords(
            Actor actor,
            @PathVariable String code,
            @RequestParam(defaultValue = "true") boolean currentOnly,
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        capabilityCheck.require(actor, Capabilities.VIEW_ENTITY_RECORDS);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        RecordQuery query = new RecordQuery(definition.code(), currentOnly, active, search,
            pagination.resolvePage(page), pagination.resolveLimit(limit));
        return ResponseEntity.ok(PageResponse.from(recordService.query(query),
            record -> RecordResponse.from(record, definition)));
    }

    @PostMapping
    public ResponseEntity<RecordResponse> createRecord(
            Actor actor,
            @PathVariable String code,
            @RequestBody RecordRequest request) {

        capabilityCheck.require(actor, Capabilities.CREATE_ENTITY_RECORD);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        EntityRecord created = recordService.create(definition.code(),
            request.toDraft(definition.hierarchy().parentLinkField()), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordResponse.from(created, definition));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RecordResponse> getRecord(
            Actor actor,
            @PathVariable String code,
            @PathVariable UUID id) {

        capabilityCheck.require(actor, Capabilities.VIEW_ENTITY_RECORDS);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        return ResponseEntity.ok(RecordResponse.from(recordService.get(definition.code(), id), definition));
    }

    /**
     * Update a record. Under versioning the response is the new revision, with a new id.
     */
    @PutMapping("/{id}")
    public ResponseEntity<RecordResponse> updateRecord(
            Actor actor,
            @PathVariable String code,
            @PathVariable UUID id,
            @RequestBody RecordRequest request) {

        capabilityCheck.require(actor, Capabilities.EDIT_ENTITY_RECORD);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        EntityRecord updated = recordService.update(definition.code(), id,
            request.toPatch(definition.hierarchy().parentLinkField()), actor);
        return ResponseEntity.ok(RecordResponse.from(updated, definition));
    }

    @PatchMapping("/{id}/toggle-activation")
    public ResponseEntity<RecordResponse> toggleActivation(
            Actor actor,
            @PathVariable String code,
            @PathVariable UUID id) {

        capabilityCheck.require(actor, Capabilities.EDIT_ENTITY_RECORD);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        return ResponseEntity.ok(RecordResponse.from(
            recordService.toggleActivation(definition.code(), id, actor), definition));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRecord(
            Actor actor,
            @PathVariable String code,
            @PathVariable UUID id) {

        capabilityCheck.require(actor, Capabilities.DELETE_ENTITY_RECORD);
        recordService.delete(code, id, actor);
        return ResponseEntity.noContent().build();
    }

    /**
     * Every revision sharing this record's business key, newest first.
     */
    @GetMapping("/{id}/versions")
    public ResponseEntity<List<RecordResponse>> listVersions(
            Actor actor,
            @PathVariable String code,
            @PathVariable UUID id) {

        capabilityCheck.require(actor, Capabilities.VIEW_ENTITY_RECORDS);
        EntityDefinition definition = definitionRegistry.getByCode(code);
        List<RecordResponse> revisions = recordService.listRevisions(definition.code(), id).stream()
            .map(record -> RecordResponse.from(record, definition))
            .toList();
        return ResponseEntity.ok(revisions);
    }
}
