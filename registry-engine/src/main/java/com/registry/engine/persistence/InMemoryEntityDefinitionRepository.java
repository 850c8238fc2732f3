package com.registry.engine.persistence;

import com.registry.core.exception.DuplicateCodeException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.Page;
import com.registry.core.repository.EntityDefinitionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * In-memory implementation of EntityDefinitionRepository.
 * Reads are lock-free; conditional writes check and commit under the repository monitor.
 */
@Repository
@ConditionalOnProperty(prefix = "registry", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryEntityDefinitionRepository implements EntityDefinitionRepository {

    private final Map<UUID, EntityDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(EntityDefinition definition) {
        if (findByCode(definition.code()).isPresent()) {
            throw new DuplicateCodeException(definition.code());
        }
        definitions.put(definition.id(), definition);
    }

    @Override
    public synchronized void update(EntityDefinition definition) {
        EntityDefinition stored = definitions.get(definition.id());
        long expected = definition.sequenceNumber() - 1;
        if (stored == null || stored.sequenceNumber() != expected) {
            throw new OptimisticLockException("EntityDefinition", definition.code(), expected);
        }
        definitions.put(definition.id(), definition);
    }

    @Override
    public Optional<EntityDefinition> findById(UUID id) {
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public Optional<EntityDefinition> findByCode(String code) {
        return definitions.values().stream()
            .filter(d -> d.code().equals(code))
            .findFirst();
    }

    @Override
    public Page<EntityDefinition> find(DefinitionQuery query) {
        List<EntityDefinition> ordered = definitions.values().stream()
            .filter(d -> query.active() == null || d.isUsable() == query.active())
            .filter(d -> matchesSearch(d, query.search()))
            .sorted(Comparator.comparing(EntityDefinition::createdAt).reversed().thenComparing(EntityDefinition::code))
            .toList();
        return Page.slice(ordered, query.page(), query.limit());
    }

    @Override
    public boolean delete(UUID id) {
        return definitions.remove(id) != null;
    }

    @Override
    public long count() {
        return definitions.size();
    }

    private static boolean matchesSearch(EntityDefinition definition, String search) {
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        return Stream.of(definition.name(), definition.description(), definition.code())
            .anyMatch(value -> value != null && value.toLowerCase(Locale.ROOT).contains(needle));
    }
}
