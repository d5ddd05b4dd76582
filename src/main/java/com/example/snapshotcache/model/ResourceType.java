package com.example.snapshotcache.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of upstream entity classes the cache holds a snapshot for.
 */
public enum ResourceType {
    PROJECTS,
    TASKS,
    TODOS;

    /** Lower-case id used in URLs, Redis keys and JSON. */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResourceType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Resource type must not be blank");
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        for (ResourceType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + id);
    }
}
