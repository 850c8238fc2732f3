package com.registry.core.exception;

import com.registry.core.schema.SchemaViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when input fails validation. Carries every violation, not just the first.
 */
public class ValidationFailedException extends RegistryException {
    
    public static final String ERROR_CODE = "VALIDATION_FAILED";

    private final List<SchemaViolation> violations;
    
    public ValidationFailedException(List<SchemaViolation> violations) {
        this(ERROR_CODE, "Validation failed", violations);
    }

    protected ValidationFailedException(String errorCode, String prefix, List<SchemaViolation> violations) {
        super(errorCode, prefix + ": " + describe(violations));
        this.violations = List.copyOf(violations);
    }

    public static ValidationFailedException of(String field, String constraint, String message) {
        return new ValidationFailedException(List.of(new SchemaViolation(field, constraint, message)));
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    private static String describe(List<SchemaViolation> violations) {
        return violations.stream()
            .map(v -> v.field() + " (" + v.constraint() + "): " + v.message())
            .collect(Collectors.joining("; "));
    }
}
