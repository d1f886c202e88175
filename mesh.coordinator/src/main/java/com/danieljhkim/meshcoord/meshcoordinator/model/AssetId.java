package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one allocation and the kind of resource it consumes.
 */
public record AssetId(UUID uuid, ResourceType resourceType) {

    public AssetId {
        Objects.requireNonNull(uuid, "uuid cannot be null");
        Objects.requireNonNull(resourceType, "resourceType cannot be null");
    }

    public static AssetId random(ResourceType type) {
        return new AssetId(UUID.randomUUID(), type);
    }

    @Override
    public String toString() {
        return resourceType.name().toLowerCase() + ":" + uuid;
    }
}
