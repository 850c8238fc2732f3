package com.registry.core.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The data schema of an entity definition: an object with declared properties
 * and a set of required property names.
 *
 * Invariants (checked by {@link SchemaDefinitionChecker}):
 * - type is "object"
 * - every required name is declared in properties
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchemaDefinition(
    String type,
    Map<String, FieldSchema> properties,
    List<String> required
) {
    public static final String OBJECT_TYPE = "object";

    public SchemaDefinition {
        type = type != null ? type : OBJECT_TYPE;
        properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Map.of();
        required = required != null ? List.copyOf(new LinkedHashSet<>(required)) : List.of();
    }

    public static SchemaDefinition empty() {
        return new SchemaDefinition(OBJECT_TYPE, Map.of(), List.of());
    }

    public static SchemaDefinition of(Map<String, FieldSchema> properties, List<String> required) {
        return new SchemaDefinition(OBJECT_TYPE, properties, required);
    }
}
