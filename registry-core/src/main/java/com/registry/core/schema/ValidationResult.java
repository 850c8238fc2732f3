package com.registry.core.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Outcome of validating a payload: the default-filled payload plus every violation found.
 */
public record ValidationResult(
    ObjectNode payload,
    List<SchemaViolation> violations
) {
    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }
}
