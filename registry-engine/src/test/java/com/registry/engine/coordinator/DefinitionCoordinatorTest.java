package com.registry.engine.coordinator;

import com.registry.core.audit.AuditAction;
import com.registry.core.exception.*;
import com.registry.core.model.*;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.test.RegistryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for definition identity, configuration transitions and listing.
 */
class DefinitionCoordinatorTest {

    private RegistryFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture();
    }

    private DefinitionDraft draft(String json) {
        return fixture.read(json, DefinitionDraft.class);
    }

    private EntityDefinition createCustomer() {
        return fixture.definitions.create(draft("""
            {"code": " customer ", "name": " Customer ",
             "schemaDefinition": {"type": "object",
               "properties": {"email": {"type": "string", "format": "email"},
                              "name": {"type": "string"}},
               "required": ["email"]}}
            """), fixture.alice);
    }

    private DefinitionPatch patch(String json) {
        return fixture.read(json, DefinitionPatch.class);
    }

    // ========== Create ==========

    @Test
    @DisplayName("Create normalizes code and name and applies config defaults")
    void createNormalizes() {
        EntityDefinition created = createCustomer();

        assertThat(created.code()).isEqualTo("CUSTOMER");
        assertThat(created.name()).isEqualTo("Customer");
        assertThat(created.derivedRecordConfig()).isEqualTo(DerivedRecordConfig.defaults());
        assertThat(created.createdBy()).isEqualTo("alice");
        assertThat(created.createdAt()).isEqualTo(RegistryFixture.START);
        assertThat(created.sequenceNumber()).isZero();

        assertThat(fixture.definitions.getByCode("customer").id()).isEqualTo(created.id());
        assertThat(fixture.counter(RegistryMetrics.DEFINITIONS_CREATED)).isEqualTo(1.0);
        assertThat(fixture.audit.entries()).extracting(e -> e.action()).containsExactly(AuditAction.DEFINITION_CREATED);
    }

    @Test
    @DisplayName("Create rejects a malformed code and a blank name together")
    void createRejectsBadIdentity() {
        assertThatThrownBy(() -> fixture.definitions.create(draft("""
            {"code": "bad-code", "name": "  "}
            """), fixture.alice))
            .isInstanceOf(ValidationFailedException.class)
            .satisfies(e -> assertThat(((ValidationFailedException) e).getViolations())
                .extracting(v -> v.field())
                .containsExactly("code", "name"));
    }

    @Test
    @DisplayName("Create rejects a code that is already taken")
    void createRejectsDuplicateCode() {
        createCustomer();

        assertThatThrownBy(() -> fixture.definitions.create(draft("""
            {"code": "CUSTOMER", "name": "Another"}
            """), fixture.bob))
            .isInstanceOf(DuplicateCodeException.class);
    }

    @Test
    @DisplayName("Create rejects an unusable schema")
    void createRejectsInvalidSchema() {
        assertThatThrownBy(() -> fixture.definitions.create(draft("""
            {"code": "ORDER", "name": "Order",
             "schemaDefinition": {"properties": {"qty": {"type": "integer", "minimum": 5, "maximum": 1}},
                                  "required": ["total"]}}
            """), fixture.alice))
            .isInstanceOf(InvalidSchemaException.class)
            .satisfies(e -> assertThat(((InvalidSchemaException) e).getViolations()).hasSize(2));
    }

    @Test
    @DisplayName("Create rejects a parent link field that shadows a record attribute")
    void createRejectsReservedParentLinkField() {
        assertThatThrownBy(() -> fixture.definitions.create(draft("""
            {"code": "NODE", "name": "Node",
             "derivedRecordConfig": {"hierarchy": {"enabled": true, "parentLinkField": "version"}}}
            """), fixture.alice))
            .isInstanceOf(InvalidSchemaException.class)
            .hasMessageContaining("parentLinkField");
    }

    // ========== Update ==========

    @Test
    @DisplayName("A code in an update is ignored and audited, not rejected")
    void updateIgnoresCode() {
        EntityDefinition created = createCustomer();
        fixture.time.advanceMinutes(1);

        EntityDefinition updated = fixture.definitions.update("CUSTOMER",
            patch("{\"code\": \"CLIENT\", \"name\": \"Client\"}"), fixture.bob);

        assertThat(updated.code()).isEqualTo("CUSTOMER");
        assertThat(updated.name()).isEqualTo("Client");
        assertThat(updated.updatedBy()).isEqualTo("bob");
        assertThat(updated.updatedAt()).isEqualTo(RegistryFixture.START.plusSeconds(60));
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(updated.sequenceNumber()).isEqualTo(1);
        assertThat(fixture.audit.entries())
            .filteredOn(e -> e.action() == AuditAction.DEFINITION_CODE_CHANGE_IGNORED)
            .singleElement()
            .satisfies(e -> assertThat(e.details()).containsEntry("attemptedCode", "CLIENT"));
    }

    @Test
    @DisplayName("Versioning and hierarchy can be switched on but never off")
    void monotonicConfig() {
        createCustomer();
        fixture.definitions.update("CUSTOMER", patch("""
            {"derivedRecordConfig": {"versioning": {"enabled": true},
                                     "hierarchy": {"enabled": true, "linkType": "code"}}}
            """), fixture.alice);

        assertThatThrownBy(() -> fixture.definitions.update("CUSTOMER",
            patch("{\"derivedRecordConfig\": {\"versioning\": {\"enabled\": false}}}"), fixture.alice))
            .isInstanceOf(MonotonicConfigViolationException.class);
        assertThatThrownBy(() -> fixture.definitions.update("CUSTOMER",
            patch("{\"derivedRecordConfig\": {\"hierarchy\": {\"enabled\": false}}}"), fixture.alice))
            .isInstanceOf(MonotonicConfigViolationException.class);

        EntityDefinition stored = fixture.definitions.getByCode("CUSTOMER");
        assertThat(stored.isVersioned()).isTrue();
        assertThat(stored.hierarchy().linkType()).isEqualTo(LinkType.CODE);
        assertThat(stored.hierarchy().parentLinkField()).isEqualTo("parentId");
    }

    @Test
    @DisplayName("Nested config patches merge field by field")
    void configMergesFieldByField() {
        createCustomer();

        EntityDefinition updated = fixture.definitions.update("CUSTOMER", patch("""
            {"derivedRecordConfig": {"activation": {"useTimeBounding": true}}}
            """), fixture.alice);

        ActivationConfig activation = updated.activation();
        assertThat(activation.useTimeBounding()).isTrue();
        assertThat(activation.enabled()).isTrue();
        assertThat(activation.defaultState()).isTrue();
        assertThat(activation.entityActive()).isTrue();
    }

    @Test
    @DisplayName("A replaced schema is checked again")
    void updateChecksReplacedSchema() {
        createCustomer();

        assertThatThrownBy(() -> fixture.definitions.update("CUSTOMER", patch("""
            {"schemaDefinition": {"properties": {"a": {"type": "string", "pattern": "("}}}}
            """), fixture.alice))
            .isInstanceOf(InvalidSchemaException.class);
    }

    @Test
    @DisplayName("An update of an unknown code is NotFound")
    void updateUnknown() {
        assertThatThrownBy(() -> fixture.definitions.update("NOPE", patch("{}"), fixture.alice))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A stale copy cannot overwrite a newer definition")
    void staleDefinitionUpdateRejected() {
        EntityDefinition created = createCustomer();
        fixture.definitions.update("CUSTOMER", patch("{\"name\": \"First\"}"), fixture.alice);

        EntityDefinition stale = created.toBuilder().name("Stale").incrementSequence().build();

        assertThatThrownBy(() -> fixture.definitionRepository.update(stale))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(fixture.definitions.getById(created.id()).name()).isEqualTo("First");
    }

    // ========== Toggle / Delete ==========

    @Test
    @DisplayName("Toggling flips entityActive both ways")
    void toggleUsable() {
        EntityDefinition created = createCustomer();

        EntityDefinition off = fixture.definitions.toggleUsable(created.id(), fixture.alice);
        EntityDefinition on = fixture.definitions.toggleUsable(created.id(), fixture.alice);

        assertThat(off.isUsable()).isFalse();
        assertThat(on.isUsable()).isTrue();
        assertThat(on.sequenceNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("Deleted definitions are gone")
    void delete() {
        EntityDefinition created = createCustomer();

        fixture.definitions.delete(created.id(), fixture.alice);

        assertThatThrownBy(() -> fixture.definitions.getById(created.id()))
            .isInstanceOf(NotFoundException.class);
        assertThat(fixture.audit.entries()).extracting(e -> e.action())
            .contains(AuditAction.DEFINITION_DELETED);
    }

    // ========== List ==========

    @Test
    @DisplayName("List filters, orders newest first and paginates")
    void list() {
        for (String code : List.of("ALPHA", "BETA", "GAMMA")) {
            fixture.definitions.create(draft("{\"code\": \"" + code + "\", \"name\": \"" + code + " type\"}"),
                fixture.alice);
            fixture.time.advanceSeconds(1);
        }
        EntityDefinition beta = fixture.definitions.getByCode("BETA");
        fixture.definitions.toggleUsable(beta.id(), fixture.alice);

        Page<EntityDefinition> all = fixture.definitions.list(new DefinitionQuery(null, null, 1, 2));
        assertThat(all.total()).isEqualTo(3);
        assertThat(all.totalPages()).isEqualTo(2);
        assertThat(all.items()).extracting(EntityDefinition::code).containsExactly("GAMMA", "BETA");

        Page<EntityDefinition> active = fixture.definitions.list(new DefinitionQuery(null, true, 1, 20));
        assertThat(active.items()).extracting(EntityDefinition::code).containsExactly("GAMMA", "ALPHA");

        Page<EntityDefinition> search = fixture.definitions.list(new DefinitionQuery("alp", null, 1, 20));
        assertThat(search.items()).extracting(EntityDefinition::code).containsExactly("ALPHA");
    }
}
