package com.registry.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/**
 * Value comparisons over JSON trees.
 */
public final class JsonValues {

    /**
     * Treats numbers as equal when their decimal values are equal, so {@code 1} matches {@code 1.0}.
     */
    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (isFiniteNumber(a) && isFiniteNumber(b)) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return 1;
    };

    private JsonValues() {
    }

    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equals(NUMERIC_AWARE, b);
    }

    /**
     * Null-safe check for a usable value: Java null and JSON null both count as absent.
     */
    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    /**
     * Check for a number with an exact decimal value. A literal beyond double range, such as
     * {@code 1e400}, parses to an infinite double node and is not one.
     */
    public static boolean isFiniteNumber(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return false;
        }
        if (node.isDouble() || node.isFloat()) {
            return Double.isFinite(node.doubleValue());
        }
        return true;
    }

    /**
     * Check whether a numeric node holds a whole number, e.g. {@code 3} or {@code 3.0}.
     */
    public static boolean isWholeNumber(JsonNode node) {
        if (node.isIntegralNumber()) {
            return true;
        }
        return isFiniteNumber(node) && node.decimalValue().stripTrailingZeros().scale() <= 0;
    }
}
