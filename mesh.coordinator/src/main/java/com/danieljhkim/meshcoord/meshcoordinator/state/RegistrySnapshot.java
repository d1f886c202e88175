package com.danieljhkim.meshcoord.meshcoordinator.state;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the registry taken under its read lock. Iteration follows first-join order and trust scores are
 * captured when the snapshot is taken, so anything scored over a snapshot is deterministic even if trust is adjusted
 * afterwards.
 */
public final class RegistrySnapshot {

    private final Map<NodeId, NodeInfo> nodes;
    private final Map<NodeId, Double> trust;
    private final Instant takenAt;

    public RegistrySnapshot(Map<NodeId, NodeInfo> nodes, Instant takenAt) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<NodeId, Double> captured = new HashMap<>();
        nodes.keySet().forEach(id -> captured.put(id, id.getTrustScore()));
        this.trust = Collections.unmodifiableMap(captured);
        this.takenAt = takenAt;
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(Map.of(), Instant.EPOCH);
    }

    public Map<NodeId, NodeInfo> asMap() {
        return nodes;
    }

    public List<NodeInfo> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<NodeInfo> withStatus(NodeStatus status) {
        return nodes.values().stream().filter(n -> n.status() == status).toList();
    }

    public Optional<NodeInfo> get(NodeId nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * Trust score of {@code nodeId} at the time the snapshot was taken, 0 for nodes outside it.
     */
    public double trustOf(NodeId nodeId) {
        return trust.getOrDefault(nodeId, 0.0);
    }

    public int size() {
        return nodes.size();
    }

    public Instant takenAt() {
        return takenAt;
    }
}
