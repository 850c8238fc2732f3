package com.registry.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of value kinds a schema field may declare.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Check whether length constraints (minLength/maxLength) apply to this kind.
     */
    public boolean hasLength() {
        return this == STRING || this == ARRAY;
    }

    /**
     * Check whether range constraints (minimum/maximum) apply to this kind.
     */
    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }

    @JsonCreator
    public static FieldType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type '" + value + "'");
    }
}
