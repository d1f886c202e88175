package com.danieljhkim.meshcoord.meshcoordinator.topology;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A group of nodes cut off from the primary group. Kept after healing for audit; {@link #markHealed(Instant)} succeeds
 * exactly once.
 */
public final class NetworkPartition {

    private final String partitionId;
    private final Set<NodeId> nodes;
    private final Instant detectedAt;
    private final AtomicBoolean healed = new AtomicBoolean(false);
    private volatile Instant healedAt;

    public NetworkPartition(String partitionId, Set<NodeId> nodes, Instant detectedAt) {
        if (partitionId == null || partitionId.isBlank()) {
            throw new IllegalArgumentException("partitionId cannot be null or blank");
        }
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("partition must contain at least one node");
        }
        this.partitionId = partitionId;
        this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt cannot be null");
    }

    public String getPartitionId() {
        return partitionId;
    }

    public Set<NodeId> getNodes() {
        return nodes;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public boolean isHealed() {
        return healed.get();
    }

    public Instant getHealedAt() {
        return healedAt;
    }

    /**
     * Flips the healed flag.
     *
     * @return true only for the call that performed the flip
     */
    public boolean markHealed(Instant now) {
        if (healed.compareAndSet(false, true)) {
            healedAt = now;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "NetworkPartition{" + "id='" + partitionId + '\'' + ", nodes=" + nodes + ", detectedAt=" + detectedAt
                + ", healed=" + healed.get() + '}';
    }
}
