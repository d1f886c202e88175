package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable per-node record held by the registry. Mutations produce a new record through the {@code with*} methods.
 */
public record NodeInfo(
        NodeId nodeId,
        NodeCapabilities capabilities,
        NodeStatus status,
        Instant lastHeartbeat,
        NodeLocation location,
        AvailableResources availableResources,
        NodePerformanceMetrics performanceMetrics) {

    public NodeInfo {
        Objects.requireNonNull(nodeId, "nodeId cannot be null");
        Objects.requireNonNull(capabilities, "capabilities cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(lastHeartbeat, "lastHeartbeat cannot be null");
        if (location == null) {
            location = NodeLocation.unknown();
        }
        if (availableResources == null) {
            availableResources = AvailableResources.full(capabilities);
        }
        if (!availableResources.fitsWithin(capabilities)) {
            throw new IllegalArgumentException(
                    "available resources " + availableResources + " exceed capabilities of node " + nodeId);
        }
        if (performanceMetrics == null) {
            performanceMetrics = NodePerformanceMetrics.initial();
        }
    }

    /**
     * Record for a node that has just joined: active, everything free.
     */
    public static NodeInfo joined(NodeId nodeId, NodeCapabilities capabilities, NodeLocation location, Instant now) {
        return new NodeInfo(
                nodeId,
                capabilities,
                NodeStatus.ACTIVE,
                now,
                location,
                AvailableResources.full(capabilities),
                NodePerformanceMetrics.initial());
    }

    public NodeInfo withStatus(NodeStatus newStatus) {
        return new NodeInfo(
                nodeId, capabilities, newStatus, lastHeartbeat, location, availableResources, performanceMetrics);
    }

    public NodeInfo withHeartbeat(Instant heartbeat) {
        return new NodeInfo(nodeId, capabilities, status, heartbeat, location, availableResources, performanceMetrics);
    }

    public NodeInfo withAvailableResources(AvailableResources available) {
        return new NodeInfo(nodeId, capabilities, status, lastHeartbeat, location, available, performanceMetrics);
    }

    public NodeInfo withPerformanceMetrics(NodePerformanceMetrics metrics) {
        return new NodeInfo(nodeId, capabilities, status, lastHeartbeat, location, availableResources, metrics);
    }

    public boolean isActive() {
        return status == NodeStatus.ACTIVE;
    }
}
