package com.registry.core.schema;

/**
 * One violated constraint, named by field path and constraint keyword.
 *
 * @param field path of the offending field ({@code address.zip}, {@code tags[2]})
 * @param constraint the constraint keyword that failed
 * @param message human-readable explanation
 */
public record SchemaViolation(
    String field,
    String constraint,
    String message
) {
    public static final String REQUIRED = "required";
    public static final String TYPE = "type";
    public static final String MIN_LENGTH = "minLength";
    public static final String MAX_LENGTH = "maxLength";
    public static final String PATTERN = "pattern";
    public static final String FORMAT = "format";
    public static final String MINIMUM = "minimum";
    public static final String MAXIMUM = "maximum";
    public static final String ENUM = "enum";
    public static final String DEFAULT = "default";
    public static final String APPLICABILITY = "applicability";
    public static final String RANGE = "range";
    public static final String EFFECTIVE_RANGE = "effectiveRange";
}
