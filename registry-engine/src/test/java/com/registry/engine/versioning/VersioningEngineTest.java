package com.registry.engine.versioning;

import com.registry.core.exception.DuplicateBusinessKeyException;
import com.registry.core.exception.IndeterminateIdentityException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.exception.VersioningNotEnabledException;
import com.registry.core.model.DefinitionDraft;
import com.registry.core.model.DefinitionPatch;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.RecordDraft;
import com.registry.core.model.RecordPatch;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.test.RegistryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for copy-on-write revisions of versioned records.
 */
class VersioningEngineTest {

    private RegistryFixture fixture;
    private EntityDefinition customer;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture();
        customer = fixture.definitions.create(fixture.read("""
            {"code": "CUSTOMER", "name": "Customer",
             "schemaDefinition": {"type": "object",
               "properties": {"email": {"type": "string", "format": "email"},
                              "name": {"type": "string"},
                              "tier": {"type": "string"}},
               "required": ["email"]},
             "derivedRecordConfig": {"versioning": {"enabled": true}}}
            """, DefinitionDraft.class), fixture.alice);
    }

    private EntityRecord createCustomer(String email, String name) {
        return fixture.records.create("CUSTOMER", new RecordDraft(
            fixture.json("{\"email\": \"" + email + "\", \"name\": \"" + name + "\"}"), null, null, null, null),
            fixture.alice);
    }

    private RecordPatch rename(String name) {
        return RecordPatch.ofData(fixture.json("{\"name\": \"" + name + "\"}"));
    }

    @Test
    @DisplayName("Updating a versioned record retires it and creates version 2")
    void updateCreatesRevision() {
        EntityRecord first = createCustomer("ann@example.com", "Ann");
        assertThat(first.version()).isEqualTo(1);
        assertThat(first.isCurrent()).isTrue();
        fixture.time.advanceMinutes(5);

        EntityRecord second = fixture.versioning.applyUpdate(customer, first, rename("Ann Lee"), fixture.bob);

        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(second.version()).isEqualTo(2);
        assertThat(second.isCurrent()).isTrue();
        assertThat(second.data().get("name").asText()).isEqualTo("Ann Lee");
        assertThat(second.createdBy()).isEqualTo("bob");
        assertThat(second.createdAt()).isEqualTo(RegistryFixture.START.plusSeconds(300));

        EntityRecord retired = fixture.recordRepository.findById(first.id()).orElseThrow();
        assertThat(retired.isCurrent()).isFalse();
        assertThat(retired.expiredAt()).isEqualTo(RegistryFixture.START.plusSeconds(300));
        assertThat(retired.data().get("name").asText()).isEqualTo("Ann");
        assertThat(retired.version()).isEqualTo(1);

        assertThat(fixture.versioning.listRevisions(customer, second))
            .extracting(EntityRecord::version)
            .containsExactly(2, 1);
        assertThat(fixture.versioning.listRevisions(customer, retired))
            .extracting(EntityRecord::id)
            .containsExactly(second.id(), first.id());
        assertThat(fixture.counter(RegistryMetrics.RECORDS_REVISIONS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Successive revisions are numbered without gaps and one stays current")
    void revisionsNumberedWithoutGaps() {
        EntityRecord current = createCustomer("bo@example.com", "Bo");
        for (int i = 2; i <= 5; i++) {
            current = fixture.versioning.applyUpdate(customer, current, rename("Bo " + i), fixture.alice);
        }

        List<EntityRecord> revisions = fixture.versioning.listRevisions(customer, current);
        assertThat(revisions).extracting(EntityRecord::version).containsExactly(5, 4, 3, 2, 1);
        assertThat(revisions).filteredOn(EntityRecord::isCurrentRevision).singleElement()
            .extracting(EntityRecord::id).isEqualTo(current.id());
    }

    @Test
    @DisplayName("A retired revision cannot be updated again")
    void retiredRevisionRejected() {
        EntityRecord first = createCustomer("cy@example.com", "Cy");
        fixture.versioning.applyUpdate(customer, first, rename("Cy 2"), fixture.alice);
        EntityRecord retired = fixture.recordRepository.findById(first.id()).orElseThrow();

        assertThatThrownBy(() -> fixture.versioning.applyUpdate(customer, retired, rename("Cy 3"), fixture.alice))
            .isInstanceOf(OptimisticLockException.class);
    }

    @Test
    @DisplayName("A stale copy of the current revision loses to the first update")
    void staleCopyRejected() {
        EntityRecord first = createCustomer("di@example.com", "Di");
        fixture.versioning.applyUpdate(customer, first, rename("Di 2"), fixture.alice);

        assertThatThrownBy(() -> fixture.versioning.applyUpdate(customer, first, rename("Di 3"), fixture.bob))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(fixture.counter(RegistryMetrics.CONCURRENCY_CONFLICTS)).isEqualTo(1.0);
        assertThat(fixture.versioning.listRevisions(customer, first)).hasSize(2);
    }

    @Test
    @DisplayName("Of concurrent transitions on one revision exactly one succeeds")
    void concurrentTransitions() throws Exception {
        EntityRecord first = createCustomer("ed@example.com", "Ed");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();

        try {
            List<Future<EntityRecord>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String name = "Ed " + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        return fixture.versioning.applyUpdate(customer, first, rename(name), fixture.alice);
                    } catch (OptimisticLockException e) {
                        conflicts.incrementAndGet();
                        return null;
                    }
                }));
            }
            start.countDown();

            List<EntityRecord> winners = new ArrayList<>();
            for (Future<EntityRecord> result : results) {
                EntityRecord successor = result.get(10, TimeUnit.SECONDS);
                if (successor != null) {
                    winners.add(successor);
                }
            }

            assertThat(winners).hasSize(1);
            assertThat(conflicts.get()).isEqualTo(threads - 1);
            assertThat(fixture.versioning.listRevisions(customer, first))
                .extracting(EntityRecord::version)
                .containsExactly(2, 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A versioned record without a business key is indeterminate")
    void indeterminateIdentity() {
        EntityRecord first = createCustomer("fay@example.com", "Fay");
        EntityRecord keyless = first.toBuilder().data(fixture.json("{\"name\": \"Fay\"}")).build();

        assertThatThrownBy(() -> fixture.versioning.applyUpdate(customer, keyless, rename("Fay 2"), fixture.alice))
            .isInstanceOf(IndeterminateIdentityException.class);
        assertThatThrownBy(() -> fixture.versioning.listRevisions(customer, keyless))
            .isInstanceOf(IndeterminateIdentityException.class);
    }

    @Test
    @DisplayName("Two current records cannot share a business key")
    void duplicateBusinessKey() {
        createCustomer("gus@example.com", "Gus");

        assertThatThrownBy(() -> createCustomer("gus@example.com", "Gus again"))
            .isInstanceOf(DuplicateBusinessKeyException.class);
    }

    @Test
    @DisplayName("Moving a revision onto a key that is already current is rejected")
    void successorKeyMustBeFree() {
        createCustomer("hal@example.com", "Hal");
        EntityRecord other = createCustomer("ida@example.com", "Ida");

        assertThatThrownBy(() -> fixture.versioning.applyUpdate(customer, other,
            RecordPatch.ofData(fixture.json("{\"email\": \"hal@example.com\"}")), fixture.alice))
            .isInstanceOf(DuplicateBusinessKeyException.class);
        assertThat(fixture.recordRepository.findById(other.id()).orElseThrow().isCurrent()).isTrue();
    }

    @Test
    @DisplayName("Revision operations need versioning")
    void versioningNotEnabled() {
        EntityDefinition plain = fixture.definitions.create(fixture.read("""
            {"code": "PLAIN", "name": "Plain"}
            """, DefinitionDraft.class), fixture.alice);
        EntityRecord record = fixture.records.create("PLAIN",
            new RecordDraft(fixture.json("{\"x\": 1}"), null, null, null, null), fixture.alice);

        assertThat(record.version()).isNull();
        assertThatThrownBy(() -> fixture.versioning.listRevisions(plain, record))
            .isInstanceOf(VersioningNotEnabledException.class);
        assertThatThrownBy(() -> fixture.versioning.applyUpdate(plain, record, rename("x"), fixture.alice))
            .isInstanceOf(VersioningNotEnabledException.class);
    }

    private EntityDefinition lateDefinition() {
        return fixture.definitions.create(fixture.read("""
            {"code": "LATE", "name": "Late",
             "schemaDefinition": {"properties": {"ref": {"type": "string"}}, "required": ["ref"]}}
            """, DefinitionDraft.class), fixture.alice);
    }

    private EntityRecord createLate(String ref) {
        return fixture.records.create("LATE",
            new RecordDraft(fixture.json("{\"ref\": \"" + ref + "\"}"), null, null, null, null), fixture.alice);
    }

    private EntityDefinition enableVersioning(String code) {
        return fixture.definitions.update(code, fixture.read(
            "{\"derivedRecordConfig\": {\"versioning\": {\"enabled\": true}}}",
            DefinitionPatch.class), fixture.alice);
    }

    @Test
    @DisplayName("Records written before versioning was enabled become version 1 of their own chain")
    void legacyRecordBecomesVersioned() {
        EntityDefinition late = lateDefinition();
        EntityRecord legacy = createLate("r-1");
        EntityRecord other = createLate("r-2");
        EntityDefinition versioned = enableVersioning("LATE");

        EntityRecord marked = fixture.recordRepository.findById(legacy.id()).orElseThrow();
        assertThat(marked.version()).isEqualTo(1);
        assertThat(marked.isCurrent()).isTrue();
        assertThat(marked.sequenceNumber()).isEqualTo(legacy.sequenceNumber() + 1);

        EntityRecord successor = fixture.versioning.applyUpdate(versioned, marked,
            RecordPatch.ofData(fixture.json("{\"note\": \"n\"}")), fixture.alice);

        assertThat(successor.version()).isEqualTo(2);
        assertThat(fixture.versioning.listRevisions(versioned, successor))
            .extracting(EntityRecord::version)
            .containsExactly(2, 1);
        assertThat(fixture.recordRepository.findById(other.id()).orElseThrow().version()).isEqualTo(1);
        assertThat(late.isVersioned()).isFalse();
    }

    @Test
    @DisplayName("Versioning cannot be enabled while existing records share a business key")
    void legacyDuplicateKeysBlockVersioning() {
        lateDefinition();
        EntityRecord first = createLate("r-1");
        EntityRecord second = createLate("r-1");

        assertThatThrownBy(() -> enableVersioning("LATE"))
            .isInstanceOf(DuplicateBusinessKeyException.class);

        assertThat(fixture.definitions.getByCode("LATE").isVersioned()).isFalse();
        assertThat(fixture.recordRepository.findById(first.id()).orElseThrow().version()).isNull();
        assertThat(fixture.recordRepository.findById(second.id()).orElseThrow().version()).isNull();

        fixture.records.delete("LATE", second.id(), fixture.alice);
        EntityDefinition versioned = enableVersioning("LATE");
        EntityRecord successor = fixture.records.update("LATE", first.id(),
            RecordPatch.ofData(fixture.json("{\"note\": \"n\"}")), fixture.alice);

        assertThat(fixture.versioning.listRevisions(versioned, successor))
            .extracting(EntityRecord::version, EntityRecord::isCurrent)
            .containsExactly(tuple(2, true), tuple(1, false));
    }
}
