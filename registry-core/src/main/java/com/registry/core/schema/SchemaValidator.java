package com.registry.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates record payloads against a {@link SchemaDefinition}.
 *
 * Rules:
 * - defaults are applied to absent optional fields before any check
 * - every required field must be present and non-null
 * - every present field must match its declared kind and constraints
 * - undeclared fields pass through untouched (open schema)
 *
 * The input payload is never modified; the result carries a default-filled copy.
 * Thread-safe: the only state is a cache of compiled patterns.
 */
public class SchemaValidator {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * Validate a payload, collecting every violation.
     */
    public ValidationResult validate(SchemaDefinition schema, JsonNode payload) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            violations.add(new SchemaViolation("data", SchemaViolation.TYPE,
                "record data must be a JSON object"));
            return new ValidationResult(JsonNodeFactory.instance.objectNode(), violations);
        }

        ObjectNode materialized = ((ObjectNode) payload).deepCopy();
        validateObject("", schema.properties(), schema.required(), materialized, violations);
        return new ValidationResult(materialized, violations);
    }

    private void validateObject(String prefix,
                                Map<String, FieldSchema> properties,
                                List<String> required,
                                ObjectNode node,
                                List<SchemaViolation> violations) {
        applyDefaults(properties, node);

        for (String name : required) {
            if (!JsonValues.isPresent(node.get(name))) {
                violations.add(new SchemaViolation(path(prefix, name), SchemaViolation.REQUIRED,
                    "is required"));
            }
        }

        for (Map.Entry<String, FieldSchema> entry : properties.entrySet()) {
            JsonNode value = node.get(entry.getKey());
            if (!JsonValues.isPresent(value)) {
                continue;
            }
            validateField(path(prefix, entry.getKey()), entry.getValue(), value, violations);
        }
    }

    private void applyDefaults(Map<String, FieldSchema> properties, ObjectNode node) {
        properties.forEach((name, field) -> {
            if (field.hasDefault() && !JsonValues.isPresent(node.get(name))) {
                node.set(name, field.defaultValue().deepCopy());
            }
        });
    }

    /**
     * Validate one present value against its field declaration.
     * Package-private so the schema checker can vet declared defaults.
     */
    void validateField(String path, FieldSchema field, JsonNode value, List<SchemaViolation> violations) {
        if (field.type() == null) {
            return;
        }
        if (!matchesType(field.type(), value)) {
            violations.add(new SchemaViolation(path, SchemaViolation.TYPE,
                "expected " + field.type().wireName() + " but was " + describe(value)));
            return;
        }

        switch (field.type()) {
            case STRING -> checkString(path, field, value.textValue(), violations);
            case NUMBER, INTEGER -> checkRange(path, field, value.decimalValue(), violations);
            case ARRAY -> checkArray(path, field, (ArrayNode) value, violations);
            case OBJECT -> {
                if (field.properties() != null || field.required() != null) {
                    validateObject(path, field.propertiesOrEmpty(), field.requiredOrEmpty(),
                        (ObjectNode) value, violations);
                }
            }
            case BOOLEAN -> {
                // kind check is the only constraint
            }
        }

        checkEnum(path, field, value, violations);
    }

    private boolean matchesType(FieldType type, JsonNode value) {
        return switch (type) {
            case STRING -> value.isTextual();
            case NUMBER -> JsonValues.isFiniteNumber(value);
            case INTEGER -> JsonValues.isFiniteNumber(value) && JsonValues.isWholeNumber(value);
            case BOOLEAN -> value.isBoolean();
            case ARRAY -> value.isArray();
            case OBJECT -> value.isObject();
        };
    }

    private void checkString(String path, FieldSchema field, String value, List<SchemaViolation> violations) {
        int length = value.codePointCount(0, value.length());
        checkLength(path, field, length, "characters", violations);

        if (field.pattern() != null && !compile(field.pattern()).matcher(value).find()) {
            violations.add(new SchemaViolation(path, SchemaViolation.PATTERN,
                "must match pattern " + field.pattern()));
        }
        if (field.format() != null && !field.format().matches(value)) {
            violations.add(new SchemaViolation(path, SchemaViolation.FORMAT,
                "must be a valid " + field.format().wireName()));
        }
    }

    private void checkArray(String path, FieldSchema field, ArrayNode value, List<SchemaViolation> violations) {
        checkLength(path, field, value.size(), "items", violations);

        if (field.items() != null) {
            for (int i = 0; i < value.size(); i++) {
                JsonNode element = value.get(i);
                String elementPath = path + "[" + i + "]";
                if (!JsonValues.isPresent(element)) {
                    violations.add(new SchemaViolation(elementPath, SchemaViolation.TYPE,
                        "expected " + field.items().type().wireName() + " but was null"));
                    continue;
                }
                validateField(elementPath, field.items(), element, violations);
            }
        }
    }

    private void checkLength(String path, FieldSchema field, int length, String unit,
                             List<SchemaViolation> violations) {
        if (field.minLength() != null && length < field.minLength()) {
            violations.add(new SchemaViolation(path, SchemaViolation.MIN_LENGTH,
                "must have at least " + field.minLength() + " " + unit));
        }
        if (field.maxLength() != null && length > field.maxLength()) {
            violations.add(new SchemaViolation(path, SchemaViolation.MAX_LENGTH,
                "must have at most " + field.maxLength() + " " + unit));
        }
    }

    private void checkRange(String path, FieldSchema field, BigDecimal value, List<SchemaViolation> violations) {
        if (field.minimum() != null && value.compareTo(field.minimum()) < 0) {
            violations.add(new SchemaViolation(path, SchemaViolation.MINIMUM,
                "must be >= " + field.minimum().toPlainString()));
        }
        if (field.maximum() != null && value.compareTo(field.maximum()) > 0) {
            violations.add(new SchemaViolation(path, SchemaViolation.MAXIMUM,
                "must be <= " + field.maximum().toPlainString()));
        }
    }

    private void checkEnum(String path, FieldSchema field, JsonNode value, List<SchemaViolation> violations) {
        if (field.enumValues() == null || field.enumValues().isEmpty()) {
            return;
        }
        boolean allowed = field.enumValues().stream().anyMatch(candidate -> JsonValues.sameValue(candidate, value));
        if (!allowed) {
            violations.add(new SchemaViolation(path, SchemaViolation.ENUM,
                "must be one of " + field.enumValues().stream()
                    .map(JsonNode::toString)
                    .collect(Collectors.joining(", ", "[", "]"))));
        }
    }

    Pattern compile(String regex) {
        return patternCache.computeIfAbsent(regex, Pattern::compile);
    }

    private static String path(String prefix, String name) {
        return prefix.isEmpty() ? name : prefix + "." + name;
    }

    private static String describe(JsonNode value) {
        if (value.isTextual()) {
            return "string";
        }
        if (value.isNumber() && !JsonValues.isFiniteNumber(value)) {
            return "out-of-range number";
        }
        if (value.isNumber()) {
            return JsonValues.isWholeNumber(value) ? "integer" : "number";
        }
        return value.getNodeType().name().toLowerCase();
    }
}
