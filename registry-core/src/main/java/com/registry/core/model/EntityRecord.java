package com.registry.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * One instance of an {@link EntityDefinition}.
 *
 * Optional attributes are null when the owning definition does not enable them:
 * - isActive: activation.enabled
 * - effectiveFrom/effectiveTo: activation.useTimeBounding (effectiveTo null means unbounded)
 * - version/isCurrent/expiredAt: versioning.enabled
 * - parentRef: hierarchy.enabled and a parent was supplied
 *
 * Invariants:
 * - definitionId and definitionCode never change
 * - effectiveFrom < effectiveTo when both are set
 * - a retired revision (isCurrent=false) is never modified again
 */
public record EntityRecord(
    // Identity
    UUID id,
    UUID definitionId,
    String definitionCode,

    // Payload
    ObjectNode data,

    // Activation
    Boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,

    // Revision chain
    Integer version,
    Boolean isCurrent,
    Instant expiredAt,

    // Hierarchy
    ParentLink parentRef,

    // Audit
    String createdBy,
    String updatedBy,
    Instant createdAt,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long sequenceNumber
) {
    /**
     * Non-versioned records have no revision chain and always count as current.
     */
    public boolean isCurrentRevision() {
        return isCurrent == null || isCurrent;
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
        private UUID definitionId;
        private String definitionCode;
        private ObjectNode data;
        private Boolean isActive;
        private Instant effectiveFrom;
        private Instant effectiveTo;
        private Integer version;
        private Boolean isCurrent;
        private Instant expiredAt;
        private ParentLink parentRef;
        private String createdBy;
        private String updatedBy;
        private Instant createdAt;
        private Instant updatedAt;
        private long sequenceNumber;

        public Builder() {
        }

        public Builder(EntityRecord record) {
            this.id = record.id();
            this.definitionId = record.definitionId();
            this.definitionCode = record.definitionCode();
            this.data = record.data();
            this.isActive = record.isActive();
            this.effectiveFrom = record.effectiveFrom();
            this.effectiveTo = record.effectiveTo();
            this.version = record.version();
            this.isCurrent = record.isCurrent();
            this.expiredAt = record.expiredAt();
            this.parentRef = record.parentRef();
            this.createdBy = record.createdBy();
            this.updatedBy = record.updatedBy();
            this.createdAt = record.createdAt();
            this.updatedAt = record.updatedAt();
            this.sequenceNumber = record.sequenceNumber();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder definition(EntityDefinition definition) {
            this.definitionId = definition.id();
            this.definitionCode = definition.code();
            return this;
        }

        public Builder data(ObjectNode data) {
            this.data = data;
            return this;
        }

        public Builder isActive(Boolean isActive) {
            this.isActive = isActive;
            return this;
        }

        public Builder effectiveFrom(Instant effectiveFrom) {
            this.effectiveFrom = effectiveFrom;
            return this;
        }

        public Builder effectiveTo(Instant effectiveTo) {
            this.effectiveTo = effectiveTo;
            return this;
        }

        public Builder version(Integer version) {
            this.version = version;
            return this;
        }

        public Builder isCurrent(Boolean isCurrent) {
            this.isCurrent = isCurrent;
            return this;
        }

        public Builder expiredAt(Instant expiredAt) {
            this.expiredAt = expiredAt;
            return this;
        }

        public Builder parentRef(ParentLink parentRef) {
            this.parentRef = parentRef;
            return this;
        }

        public Builder createdBy(String actorId, Instant at) {
            this.createdBy = actorId;
            this.createdAt = at;
            return this;
        }

        public Builder updatedBy(String actorId, Instant at) {
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

        public EntityRecord build() {
            return new EntityRecord(
                id, definitionId, definitionCode, data,
                isActive, effectiveFrom, effectiveTo,
                version, isCurrent, expiredAt, parentRef,
                createdBy, updatedBy, createdAt, updatedAt,
                sequenceNumber
            );
        }
    }
}
