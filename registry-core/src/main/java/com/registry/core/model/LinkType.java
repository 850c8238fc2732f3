package com.registry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a child record refers to its parent: by the parent's id or by a code value.
 */
public enum LinkType {
    ID("id"),
    CODE("code");

    private final String wireName;

    LinkType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Accepts {@code id}, {@code _id} and {@code code}, case-insensitively.
     */
    @JsonCreator
    public static LinkType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "id", "_id" -> ID;
            case "code" -> CODE;
            default -> throw new IllegalArgumentException("Unknown link type: " + value);
        };
    }
}
