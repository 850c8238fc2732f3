package com.registry.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Checks that a schema definition is itself usable before it is stored.
 */
public class SchemaDefinitionChecker {

    private static final String ROOT = "schemaDefinition";

    private final SchemaValidator validator;

    public SchemaDefinitionChecker(SchemaValidator validator) {
        this.validator = validator;
    }

    /**
     * Collect every problem with the given schema. Empty means usable.
     */
    public List<SchemaViolation> check(SchemaDefinition schema) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (schema == null) {
            return violations;
        }
        if (!SchemaDefinition.OBJECT_TYPE.equals(schema.type())) {
            violations.add(new SchemaViolation(ROOT + ".type", SchemaViolation.TYPE,
                "root schema type must be 'object' but was '" + schema.type() + "'"));
        }
        checkObject(ROOT, schema.properties(), schema.required(), violations);
        return violations;
    }

    private void checkObject(String path, Map<String, FieldSchema> properties, List<String> required,
                             List<SchemaViolation> violations) {
        for (String name : required) {
            if (!properties.containsKey(name)) {
                violations.add(new SchemaViolation(path + ".required", SchemaViolation.REQUIRED,
                    "required field '" + name + "' is not defined in properties"));
            }
        }
        properties.forEach((name, field) -> checkField(path + ".properties." + name, field, violations));
    }

    private void checkField(String path, FieldSchema field, List<SchemaViolation> violations) {
        if (field == null || field.type() == null) {
            violations.add(new SchemaViolation(path + ".type", SchemaViolation.TYPE,
                "field type is required"));
            return;
        }
        FieldType type = field.type();

        if (!type.hasLength() && (field.minLength() != null || field.maxLength() != null)) {
            notApplicable(path, "minLength/maxLength", type, violations);
        }
        if (type != FieldType.STRING && (field.pattern() != null || field.format() != null)) {
            notApplicable(path, "pattern/format", type, violations);
        }
        if (!type.isNumeric() && (field.minimum() != null || field.maximum() != null)) {
            notApplicable(path, "minimum/maximum", type, violations);
        }
        if (type != FieldType.ARRAY && field.items() != null) {
            notApplicable(path, "items", type, violations);
        }
        if (type != FieldType.OBJECT && (field.properties() != null || field.required() != null)) {
            notApplicable(path, "properties/required", type, violations);
        }

        checkBounds(path, field, violations);

        if (field.pattern() != null) {
            try {
                validator.compile(field.pattern());
            } catch (PatternSyntaxException e) {
                violations.add(new SchemaViolation(path + ".pattern", SchemaViolation.PATTERN,
                    "invalid regular expression: " + e.getDescription()));
            }
        }

        if (type == FieldType.ARRAY && field.items() != null) {
            checkField(path + ".items", field.items(), violations);
        }
        if (type == FieldType.OBJECT) {
            checkObject(path, field.propertiesOrEmpty(), field.requiredOrEmpty(), violations);
        }

        checkDeclaredValues(path, field, violations);
    }

    private void checkBounds(String path, FieldSchema field, List<SchemaViolation> violations) {
        if (field.minLength() != null && field.minLength() < 0) {
            violations.add(new SchemaViolation(path + ".minLength", SchemaViolation.RANGE,
                "must not be negative"));
        }
        if (field.maxLength() != null && field.maxLength() < 0) {
            violations.add(new SchemaViolation(path + ".maxLength", SchemaViolation.RANGE,
                "must not be negative"));
        }
        if (field.minLength() != null && field.maxLength() != null && field.minLength() > field.maxLength()) {
            violations.add(new SchemaViolation(path, SchemaViolation.RANGE,
                "minLength must not exceed maxLength"));
        }
        if (field.minimum() != null && field.maximum() != null && field.minimum().compareTo(field.maximum()) > 0) {
            violations.add(new SchemaViolation(path, SchemaViolation.RANGE,
                "minimum must not exceed maximum"));
        }
    }

    /**
     * A declared default or enum member must itself satisfy the field.
     * Only run when the field declaration is otherwise sound.
     */
    private void checkDeclaredValues(String path, FieldSchema field, List<SchemaViolation> violations) {
        if (violations.stream().anyMatch(v -> v.field().equals(path) || v.field().startsWith(path + "."))) {
            return;
        }
        if (field.hasDefault()) {
            List<SchemaViolation> defaultViolations = new ArrayList<>();
            validator.validateField(path + ".default", field, field.defaultValue(), defaultViolations);
            defaultViolations.forEach(v -> violations.add(new SchemaViolation(
                v.field(), SchemaViolation.DEFAULT, "default value " + v.message())));
        }
        if (field.enumValues() != null) {
            FieldSchema kindOnly = FieldSchema.of(field.type());
            for (JsonNode member : field.enumValues()) {
                List<SchemaViolation> memberViolations = new ArrayList<>();
                if (JsonValues.isPresent(member)) {
                    validator.validateField(path + ".enum", kindOnly, member, memberViolations);
                }
                memberViolations.forEach(v -> violations.add(new SchemaViolation(
                    v.field(), SchemaViolation.ENUM, "enum member " + member + " " + v.message())));
            }
        }
    }

    private static void notApplicable(String path, String constraint, FieldType type,
                                      List<SchemaViolation> violations) {
        violations.add(new SchemaViolation(path, SchemaViolation.APPLICABILITY,
            constraint + " does not apply to " + type.wireName() + " fields"));
    }
}
