package com.registry.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.registry.core.exception.DuplicateBusinessKeyException;
import com.registry.core.exception.OptimisticLockException;
import com.registry.core.model.BusinessKey;
import com.registry.core.model.EntityRecord;
import com.registry.core.model.LinkType;
import com.registry.core.model.Page;
import com.registry.core.model.ParentLink;
import com.registry.core.model.RecordQuery;
import com.registry.core.repository.EntityRecordRepository;
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
import java.util.function.Function;

/**
 * PostgreSQL-backed implementation of EntityRecordRepository.
 *
 * Record data lives in a JSONB column. The canonical business key of a versioned
 * record is stored in {@code business_key}; a partial unique index over
 * (definition_id, business_key) WHERE is_current keeps one current revision per key.
 * Version transitions run as one transaction: a conditional retire, then the insert.
 */
@Repository("jdbcEntityRecordRepository")
@ConditionalOnProperty(prefix = "registry", name = "store", havingValue = "jdbc")
public class JdbcEntityRecordRepository implements EntityRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityRecordRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EntityRecordRowMapper rowMapper;

    public JdbcEntityRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EntityRecordRowMapper();
    }

    @Override
    @Transactional
    public void save(EntityRecord record, BusinessKey businessKey) {
        insert(record, businessKey);
    }

    @Override
    @Transactional
    public void update(EntityRecord record) {
        String sql = """
            UPDATE entity_records SET
                data = ?::jsonb,
                is_active = ?,
                effective_from = ?,
                effective_to = ?,
                parent_link_type = ?,
                parent_value = ?,
                updated_by = ?,
                updated_at = ?,
                sequence_number = ?
            WHERE id = ? AND sequence_number = ?
            """;

        ParentLink parent = record.parentRef();
        int rows = jdbcTemplate.update(sql,
            toJson(record.data()),
            record.isActive(),
            toTimestamp(record.effectiveFrom()),
            toTimestamp(record.effectiveTo()),
            parent != null ? parent.linkType().wireName() : null,
            parent != null ? parent.value() : null,
            record.updatedBy(),
            toTimestamp(record.updatedAt()),
            record.sequenceNumber(),
            record.id(),
            record.sequenceNumber() - 1  // Expected previous sequence
        );

        if (rows == 0) {
            throw new OptimisticLockException("EntityRecord", record.id().toString(), record.sequenceNumber() - 1);
        }
    }

    @Override
    @Transactional
    public void retireAndInsert(EntityRecord retired, EntityRecord successor, BusinessKey businessKey) {
        String retireSql = """
            UPDATE entity_records SET
                version = ?,
                is_current = FALSE,
                expired_at = ?,
                sequence_number = ?
            WHERE id = ? AND is_current IS NOT FALSE AND sequence_number = ?
            """;

        int rows = jdbcTemplate.update(retireSql,
            retired.version(),
            toTimestamp(retired.expiredAt()),
            retired.sequenceNumber(),
            retired.id(),
            retired.sequenceNumber() - 1
        );

        if (rows == 0) {
            // Rolls back: nothing was written
            throw new OptimisticLockException("EntityRecord", retired.id().toString(), retired.sequenceNumber() - 1);
        }

        insert(successor, businessKey);
        log.debug("Retired revision {} and inserted {}", retired.id(), successor.id());
    }

    @Override
    @Transactional
    public int startVersioning(UUID definitionId, Function<EntityRecord, BusinessKey> keyOf) {
        List<EntityRecord> unversioned = jdbcTemplate.query(
            "SELECT * FROM entity_records WHERE definition_id = ? AND version IS NULL FOR UPDATE",
            rowMapper, definitionId);

        String sql = """
            UPDATE entity_records SET
                version = 1,
                is_current = TRUE,
                expired_at = NULL,
                business_key = ?,
                sequence_number = sequence_number + 1
            WHERE id = ?
            """;

        for (EntityRecord record : unversioned) {
            BusinessKey key = keyOf.apply(record);
            String canonical = key == null || key.isEmpty() ? null : key.canonical();
            try {
                jdbcTemplate.update(sql, canonical, record.id());
            } catch (DuplicateKeyException e) {
                // Rolls back every record marked so far
                throw new DuplicateBusinessKeyException(record.definitionCode(), canonical);
            }
        }
        log.debug("Started revision chains for {} records of definition {}", unversioned.size(), definitionId);
        return unversioned.size();
    }

    @Override
    public Optional<EntityRecord> findById(UUID id) {
        String sql = "SELECT * FROM entity_records WHERE id = ?";
        List<EntityRecord> results = jdbcTemplate.query(sql, rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Page<EntityRecord> query(RecordQuery query) {
        StringBuilder where = new StringBuilder(" WHERE definition_code = ?");
        List<Object> args = new ArrayList<>();
        args.add(query.definitionCode());

        if (query.currentOnly()) {
            where.append(" AND is_current IS NOT FALSE");
        }
        if (query.active() != null) {
            where.append(" AND is_active = ?");
            args.add(query.active());
        }
        if (query.search() != null && !query.search().isBlank()) {
            where.append(" AND data::text ILIKE ?");
            args.add(SqlPatterns.contains(query.search()));
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_records" + where, Long.class, args.toArray());

        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(query.limit());
        pageArgs.add((long) (query.page() - 1) * query.limit());
        List<EntityRecord> items = jdbcTemplate.query(
            "SELECT * FROM entity_records" + where + " ORDER BY created_at DESC, id LIMIT ? OFFSET ?",
            rowMapper, pageArgs.toArray());

        return new Page<>(items, total != null ? total : 0, query.page(), query.limit());
    }

    @Override
    public List<EntityRecord> findByBusinessKey(UUID definitionId, BusinessKey businessKey) {
        String sql = """
            SELECT * FROM entity_records
            WHERE definition_id = ? AND data @> ?::jsonb
            ORDER BY version DESC NULLS LAST, created_at DESC
            """;
        return jdbcTemplate.query(sql, rowMapper, definitionId, toJson(businessKey.toJson()));
    }

    @Override
    public long countByDefinition(UUID definitionId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_records WHERE definition_id = ?", Long.class, definitionId);
        return count != null ? count : 0;
    }

    @Override
    @Transactional
    public boolean deleteById(UUID id) {
        return jdbcTemplate.update("DELETE FROM entity_records WHERE id = ?", id) > 0;
    }

    // ========== Helper Methods ==========

    private void insert(EntityRecord record, BusinessKey businessKey) {
        String sql = """
            INSERT INTO entity_records (
                id, definition_id, definition_code, data,
                is_active, effective_from, effective_to,
                version, is_current, expired_at,
                parent_link_type, parent_value, business_key,
                created_by, updated_by, created_at, updated_at, sequence_number
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        ParentLink parent = record.parentRef();
        try {
            jdbcTemplate.update(sql,
                record.id(),
                record.definitionId(),
                record.definitionCode(),
                toJson(record.data()),
                record.isActive(),
                toTimestamp(record.effectiveFrom()),
                toTimestamp(record.effectiveTo()),
                record.version(),
                record.isCurrent(),
                toTimestamp(record.expiredAt()),
                parent != null ? parent.linkType().wireName() : null,
                parent != null ? parent.value() : null,
                businessKey != null ? businessKey.canonical() : null,
                record.createdBy(),
                record.updatedBy(),
                toTimestamp(record.createdAt()),
                toTimestamp(record.updatedAt()),
                record.sequenceNumber()
            );
        } catch (DuplicateKeyException e) {
            String key = businessKey != null ? businessKey.canonical() : record.id().toString();
            throw new DuplicateBusinessKeyException(record.definitionCode(), key);
        }
    }

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

    private class EntityRecordRowMapper implements RowMapper<EntityRecord> {
        @Override
        public EntityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String linkType = rs.getString("parent_link_type");
                ParentLink parent = linkType != null
                    ? new ParentLink(LinkType.fromWire(linkType), rs.getString("parent_value"))
                    : null;

                return new EntityRecord(
                    UUID.fromString(rs.getString("id")),
                    UUID.fromString(rs.getString("definition_id")),
                    rs.getString("definition_code"),
                    (ObjectNode) objectMapper.readTree(rs.getString("data")),
                    rs.getObject("is_active", Boolean.class),
                    toInstant(rs.getTimestamp("effective_from")),
                    toInstant(rs.getTimestamp("effective_to")),
                    rs.getObject("version", Integer.class),
                    rs.getObject("is_current", Boolean.class),
                    toInstant(rs.getTimestamp("expired_at")),
                    parent,
                    rs.getString("created_by"),
                    rs.getString("updated_by"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    rs.getLong("sequence_number")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map entity record row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
