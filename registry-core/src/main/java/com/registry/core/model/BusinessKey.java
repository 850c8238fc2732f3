package com.registry.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.registry.core.schema.JsonValues;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Identity of a versioned record across its revisions: the values of the
 * definition's required fields that are present in the data.
 */
public record BusinessKey(Map<String, JsonNode> fields) {

    public BusinessKey {
        fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Whether the given data holds every key field with an equal value.
     */
    public boolean matches(JsonNode data) {
        if (isEmpty() || data == null) {
            return false;
        }
        return fields.entrySet().stream()
            .allMatch(e -> JsonValues.sameValue(e.getValue(), data.get(e.getKey())));
    }

    /**
     * Key as a JSON object, usable for containment queries.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        fields.forEach((name, value) -> node.set(name, value.deepCopy()));
        return node;
    }

    /**
     * Stable string form; numerically equal values render the same way.
     */
    public String canonical() {
        return fields.entrySet().stream()
            .map(e -> e.getKey() + "=" + canonicalValue(e.getValue()))
            .collect(Collectors.joining("|"));
    }

    private static String canonicalValue(JsonNode value) {
        if (JsonValues.isFiniteNumber(value)) {
            return value.decimalValue().stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
