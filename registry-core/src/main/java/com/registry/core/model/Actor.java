package com.registry.core.model;

/**
 * The caller on whose behalf an operation runs. Authentication happens upstream.
 */
public record Actor(String id, String displayName) {

    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("actor id must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    public static Actor of(String id) {
        return new Actor(id, null);
    }
}
