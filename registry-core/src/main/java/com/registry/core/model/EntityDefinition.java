package com.registry.core.model;

import com.registry.core.schema.SchemaDefinition;

import java.time.Instant;
import java.util.UUID;

/**
 * A runtime-defined record type: identity, data schema, and record behavior.
 *
 * Primary Key: id
 * Unique Constraint: code
 *
 * Invariants:
 * - code matches ^[A-Z0-9_]+$ and never changes after creation
 * - every required schema field is declared in the schema properties
 * - versioning.enabled and hierarchy.enabled never go from true to false
 * - sequenceNumber increases by one on every stored change
 */
public record EntityDefinition(
    // Identity
    UUID id,
    String code,

    // Metadata
    String name,
    String description,

    // Behavior
    SchemaDefinition schemaDefinition,
    DerivedRecordConfig derivedRecordConfig,

    // Audit
    String createdBy,
    Instant createdAt,
    String updatedBy,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long sequenceNumber
) {
    public static final String CODE_PATTERN = "^[A-Z0-9_]+$";

    /**
     * Whether the definition currently accepts new or changed records.
     */
    public boolean isUsable() {
        return derivedRecordConfig.activation().entityActive();
    }

    public boolean isVersioned() {
        return derivedRecordConfig.versioning().enabled();
    }

    public ActivationConfig activation() {
        return derivedRecordConfig.activation();
    }

    public HierarchyConfig hierarchy() {
        return derivedRecordConfig.hierarchy();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id;
        private String code;
        private String name;
        private String description;
        private SchemaDefinition schemaDefinition = SchemaDefinition.empty();
        private DerivedRecordConfig derivedRecordConfig = DerivedRecordConfig.defaults();
        private String createdBy;
        private Instant createdAt;
        private String updatedBy;
        private Instant updatedAt;
        private long sequenceNumber;

        public Builder() {
        }

        public Builder(EntityDefinition definition) {
            this.id = definition.id();
            this.code = definition.code();
            this.name = definition.name();
            this.description = definition.description();
            this.schemaDefinition = definition.schemaDefinition();
            this.derivedRecordConfig = definition.derivedRecordConfig();
            this.createdBy = definition.createdBy();
            this.createdAt = definition.createdAt();
            this.updatedBy = definition.updatedBy();
            this.updatedAt = definition.updatedAt();
            this.sequenceNumber = definition.sequenceNumber();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder schemaDefinition(SchemaDefinition schemaDefinition) {
            this.schemaDefinition = schemaDefinition;
            return this;
        }

        public Builder derivedRecordConfig(DerivedRecordConfig derivedRecordConfig) {
            this.derivedRecordConfig = derivedRecordConfig;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Stamp a change by the given actor at the given instant.
         */
        public Builder touchedBy(String actorId, Instant at) {
            this.updatedBy = actorId;
            this.updatedAt = at;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder incrementSequence() {
            this.sequenceNumber++;
            return this;
        }

        public EntityDefinition build() {
            return new EntityDefinition(
                id, code, name, description, schemaDefinition, derivedRecordConfig,
                createdBy, createdAt, updatedBy, updatedAt, sequenceNumber
            );
        }
    }
}
