package com.danieljhkim.meshcoord.meshcoordinator.migration;

import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What to move, where, and how.
 *
 * @param priority higher runs first when several plans compete; informational for now
 */
public record MigrationPlan(
        AssetId assetId,
        NodeId source,
        NodeId target,
        MigrationStrategy strategy,
        Duration estimatedDuration,
        long dataSizeBytes,
        int priority,
        Instant createdAt) {

    public MigrationPlan {
        Objects.requireNonNull(assetId, "assetId cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        Objects.requireNonNull(estimatedDuration, "estimatedDuration cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (dataSizeBytes < 0) {
            throw new IllegalArgumentException("dataSizeBytes cannot be negative");
        }
    }
}
