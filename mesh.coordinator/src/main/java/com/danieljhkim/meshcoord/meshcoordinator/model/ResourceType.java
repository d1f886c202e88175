package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Locale;

import com.danieljhkim.meshcoord.meshcommon.exception.InvalidRequestException;

/**
 * Kinds of shareable hardware a node can expose to the mesh.
 */
public enum ResourceType {
    CPU,
    GPU,
    MEMORY,
    STORAGE,
    NETWORK,
    CONTAINER;

    /**
     * Case-insensitive lookup used when reading configuration.
     */
    public static ResourceType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("resource type cannot be blank");
        }
        try {
            return ResourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown resource type: " + value);
        }
    }
}
