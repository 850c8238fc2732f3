package com.registry.engine.persistence;

import com.registry.core.exception.DuplicateBusinessKeyException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.Page;
import com.registry.core.model.RecordQuery;
import com.registry.core.repository.EntityRecordRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of EntityRecordRepository.
 * Reads are lock-free; every conditional write (uniqueness of current business keys,
 * sequence checks, retire-and-insert) checks and commits under the repository monitor.
 * Record data is copied on the way in and out so callers cannot alter stored state.
 */
@Repository
@ConditionalOnProperty(prefix = "registry", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryEntityRecordRepository implements EntityRecordRepository {

    private final Map<UUID, EntityRecord> records = new ConcurrentHashMap<>();

    // Canonical business key per record id, for versioned records only
    private final Map<UUID, String> businessKeys = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(EntityRecord record, BusinessKey businessKey) {
        if (businessKey != null) {
            requireUniqueCurrentKey(record, businessKey, null);
            businessKeys.put(record.id(), businessKey.canonical());
        }
        records.put(record.id(), copy(record));
    }

    @Override
    public synchronized void update(EntityRecord record) {
        requireSequence(record);
        records.put(record.id(), copy(record));
    }

    @Override
    public synchronized void retireAndInsert(EntityRecord retired, EntityRecord successor, BusinessKey businessKey) {
        EntityRecord stored = requireSequence(retired);
        if (!stored.isCurrentRevision()) {
            throw new OptimisticLockException("EntityRecord", retired.id().toString(), retired.sequenceNumber() - 1);
        }
        requireUniqueCurrentKey(successor, businessKey, retired.id());

        records.put(retired.id(), copy(retired));
        records.put(successor.id(), copy(successor));
        businessKeys.put(successor.id(), businessKey.canonical());
    }

    @Override
    public synchronized int startVersioning(UUID definitionId, Function<EntityRecord, BusinessKey> keyOf) {
        List<EntityRecord> unversioned = records.values().stream()
            .filter(r -> r.definitionId().equals(definitionId))
            .filter(r -> r.version() == null)
            .toList();

        // Check every key before the first write
        Map<String, UUID> claimed = new HashMap<>();
        records.values().stream()
            .filter(r -> r.definitionId().equals(definitionId))
            .filter(EntityRecord::isCurrentRevision)
            .filter(r -> businessKeys.containsKey(r.id()))
            .forEach(r -> claimed.put(businessKeys.get(r.id()), r.id()));
        Map<UUID, String> assigned = new HashMap<>();
        for (EntityRecord record : unversioned) {
            BusinessKey key = keyOf.apply(record);
            if (key == null || key.isEmpty()) {
                continue;
            }
            String canonical = key.canonical();
            if (claimed.putIfAbsent(canonical, record.id()) != null) {
                throw new DuplicateBusinessKeyException(record.definitionCode(), canonical);
            }
            assigned.put(record.id(), canonical);
        }

        for (EntityRecord record : unversioned) {
            records.put(record.id(), record.toBuilder()
                .version(1)
                .isCurrent(true)
                .expiredAt(null)
                .incrementSequence()
                .build());
            String canonical = assigned.get(record.id());
            if (canonical != null) {
                businessKeys.put(record.id(), canonical);
            }
        }
        return unversioned.size();
    }

    @Override
    public Optional<EntityRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id)).map(InMemoryEntityRecordRepository::copy);
    }

    @Override
    public Page<EntityRecord> query(RecordQuery query) {
        String needle = query.search() == null || query.search().isBlank()
            ? null
            : query.search().trim().toLowerCase(Locale.ROOT);

        List<EntityRecord> ordered = records.values().stream()
            .filter(r -> r.definitionCode().equals(query.definitionCode()))
            .filter(r -> !query.currentOnly() || r.isCurrentRevision())
            .filter(r -> query.active() == null || Objects.equals(r.isActive(), query.active()))
            .filter(r -> needle == null || r.data().toString().toLowerCase(Locale.ROOT).contains(needle))
            .sorted(Comparator.comparing(EntityRecord::createdAt).reversed().thenComparing(EntityRecord::id))
            .map(InMemoryEntityRecordRepository::copy)
            .toList();
        return Page.slice(ordered, query.page(), query.limit());
    }

    @Override
    public List<EntityRecord> findByBusinessKey(UUID definitionId, BusinessKey businessKey) {
        return records.values().stream()
            .filter(r -> r.definitionId().equals(definitionId))
            .filter(r -> businessKey.matches(r.data()))
            .sorted(Comparator.comparing((EntityRecord r) -> r.version() != null ? r.version() : 0).reversed())
            .map(InMemoryEntityRecordRepository::copy)
            .toList();
    }

    @Override
    public long countByDefinition(UUID definitionId) {
        return records.values().stream()
            .filter(r -> r.definitionId().equals(definitionId))
            .count();
    }

    @Override
    public synchronized boolean deleteById(UUID id) {
        businessKeys.remove(id);
        return records.remove(id) != null;
    }

    // ========== Helper Methods ==========

    private EntityRecord requireSequence(EntityRecord changed) {
        EntityRecord stored = records.get(changed.id());
        long expected = changed.sequenceNumber() - 1;
        if (stored == null || stored.sequenceNumber() != expected) {
            throw new OptimisticLockException("EntityRecord", changed.id().toString(), expected);
        }
        return stored;
    }

    private void requireUniqueCurrentKey(EntityRecord record, BusinessKey businessKey, UUID retiring) {
        String canonical = businessKey.canonical();
        boolean taken = records.values().stream()
            .filter(r -> r.definitionId().equals(record.definitionId()))
            .filter(r -> !r.id().equals(retiring))
            .filter(EntityRecord::isCurrentRevision)
            .anyMatch(r -> canonical.equals(businessKeys.get(r.id())));
        if (taken) {
            throw new DuplicateBusinessKeyException(record.definitionCode(), canonical);
        }
    }

    private static EntityRecord copy(EntityRecord record) {
        return record.data() == null ? record : record.toBuilder().data(record.data().deepCopy()).build();
    }
}
