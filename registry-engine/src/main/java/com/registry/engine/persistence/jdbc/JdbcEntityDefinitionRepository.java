package com.registry.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.DuplicateCodeException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.model.DefinitionQuery;
import com.registry.core.model.DerivedRecordConfig;
import com.registry.core.model.EntityDefinition;
import com.registry.core.model.Page;
import com.registry.core.repository.EntityDefinitionRepository;
import com.registry.core.schema.SchemaDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EntityDefinitionRepository.
 * Supports optimistic locking via sequence numbers for concurrent access.
 *
 * Uses JSONB columns for:
 * - the data schema (schema_definition)
 * - record behavior (derived_record_config)
 */
@Repository("jdbcEntityDefinitionRepository")
@ConditionalOnProperty(prefix = "registry", name = "store", havingValue = "jdbc")
public class JdbcEntityDefinitionRepository implements EntityDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EntityDefinitionRowMapper rowMapper;

    public JdbcEntityDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EntityDefinitionRowMapper();
    }

    @Override
    @Transactional
    public void save(EntityDefinition definition) {
        String sql = """
            INSERT INTO entity_definitions (
                id, code, name, description,
                schema_definition, derived_record_config,
                created_by, created_at, updated_by, updated_at, sequence_number
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                definition.id(),
                definition.code(),
                definition.name(),
                definition.description(),
                toJson(definition.schemaDefinition()),
                toJson(definition.derivedRecordConfig()),
                definition.createdBy(),
                toTimestamp(definition.createdAt()),
                definition.updatedBy(),
                toTimestamp(definition.updatedAt()),
                definition.sequenceNumber()
            );
        } catch (DuplicateKeyException e) {
            log.debug("Entity definition code already exists: {}", definition.code());
            throw new DuplicateCodeException(definition.code());
        }
    }

    @Override
    @Transactional
    public void update(EntityDefinition definition) {
        String sql = """
            UPDATE entity_definitions SET
                name = ?,
                description = ?,
                schema_definition = ?::jsonb,
                derived_record_config = ?::jsonb,
                updated_by = ?,
                updated_at = ?,
                sequence_number = ?
            WHERE id = ? AND sequence_number = ?
            """;

        int rows = jdbcTemplate.update(sql,
            definition.name(),
            definition.description(),
            toJson(definition.schemaDefinition()),
            toJson(definition.derivedRecordConfig()),
            definition.updatedBy(),
            toTimestamp(definition.updatedAt()),
            definition.sequenceNumber(),
            definition.id(),
            definition.sequenceNumber() - 1  // Expected previous sequence
        );

        if (rows == 0) {
            throw new OptimisticLockException("EntityDefinition", definition.code(), definition.sequenceNumber() - 1);
        }
    }

    @Override
    public Optional<EntityDefinition> findById(UUID id) {
        String sql = "SELECT * FROM entity_definitions WHERE id = ?";
        List<EntityDefinition> results = jdbcTemplate.query(sql, rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<EntityDefinition> findByCode(String code) {
        String sql = "SELECT * FROM entity_definitions WHERE code = ?";
        List<EntityDefinition> results = jdbcTemplate.query(sql, rowMapper, code);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Page<EntityDefinition> find(DefinitionQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (query.active() != null) {
            where.append(" AND (derived_record_config -> 'activation' ->> 'entityActive')::boolean = ?");
            args.add(query.active());
        }
        if (query.search() != null && !query.search().isBlank()) {
            String pattern = SqlPatterns.contains(query.search());
            where.append(" AND (name ILIKE ? OR description ILIKE ? OR code ILIKE ?)");
            args.add(pattern);
            args.add(pattern);
            args.add(pattern);
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_definitions" + where, Long.class, args.toArray());

        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(query.limit());
        pageArgs.add((long) (query.page() - 1) * query.limit());
        List<EntityDefinition> items = jdbcTemplate.query(
            "SELECT * FROM entity_definitions" + where + " ORDER BY created_at DESC, code LIMIT ? OFFSET ?",
            rowMapper, pageArgs.toArray());

        return new Page<>(items, total != null ? total : 0, query.page(), query.limit());
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        return jdbcTemplate.update("DELETE FROM entity_definitions WHERE id = ?", id) > 0;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM entity_definitions", Long.class);
        return count != null ? count : 0;
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class EntityDefinitionRowMapper implements RowMapper<EntityDefinition> {
        @Override
        public EntityDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new EntityDefinition(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("code"),
                    rs.getString("name"),
                    rs.getString("description"),
                    objectMapper.readValue(rs.getString("schema_definition"), SchemaDefinition.class),
                    objectMapper.readValue(rs.getString("derived_record_config"), DerivedRecordConfig.class),
                    rs.getString("created_by"),
                    toInstant(rs.getTimestamp("created_at")),
                    rs.getString("updated_by"),
                    toInstant(rs.getTimestamp("updated_at")),
                    rs.getLong("sequence_number")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map entity definition row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
