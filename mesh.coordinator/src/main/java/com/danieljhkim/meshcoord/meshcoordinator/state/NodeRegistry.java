package com.danieljhkim.meshcoord.meshcoordinator.state;

import com.danieljhkim.meshcoord.meshcommon.exception.AllocationFailedException;
import com.danieljhkim.meshcoord.meshcommon.exception.InvalidStateTransitionException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.model.AvailableResources;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeLocation;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodePerformanceMetrics;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceDemand;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Authoritative set of known nodes.
 *
 * <p>
 * Every mutation replaces the node's immutable {@link NodeInfo} under the write lock; readers either look up single
 * records or take a {@link RegistrySnapshot}. Iteration order is first-join order.
 */
@Slf4j
public class NodeRegistry {

    private final Map<NodeId, NodeInfo> nodes = new LinkedHashMap<>();
    private final List<DepartedNode> departed = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public NodeRegistry(Clock clock) {
        this.clock = clock;
    }

    public NodeRegistry() {
        this(Clock.systemUTC());
    }

    // ============================
    // Membership
    // ============================

    /**
     * Adds a node, or re-creates a known one, as ACTIVE with all capacity free and a fresh heartbeat. This is the only
     * way out of FAILED.
     */
    public NodeInfo join(NodeId nodeId, NodeCapabilities capabilities, NodeLocation location) {
        NodeInfo info = NodeInfo.joined(nodeId, capabilities, location, clock.instant());
        lock.writeLock().lock();
        try {
            NodeInfo previous = nodes.put(nodeId, info);
            if (previous != null) {
                log.info("Node {} rejoined (was {})", nodeId, previous.status());
            } else {
                log.info("Node {} joined at {}", nodeId, nodeId.getAddress());
            }
            return info;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a node from the live set and archives its last record.
     *
     * @return the removed record, empty if the node was unknown
     */
    public Optional<NodeInfo> leave(NodeId nodeId, String reason) {
        lock.writeLock().lock();
        try {
            NodeInfo removed = nodes.remove(nodeId);
            if (removed == null) {
                return Optional.empty();
            }
            departed.add(new DepartedNode(removed, reason, clock.instant()));
            log.info("Node {} left: {}", nodeId, reason);
            return Optional.of(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================
    // Heartbeats
    // ============================

    /**
     * Refreshes the heartbeat timestamp. Status is left alone, so a FAILED node stays FAILED until it rejoins.
     */
    public NodeInfo updateHeartbeat(NodeId nodeId) {
        return mutate(nodeId, info -> info.withHeartbeat(clock.instant()));
    }

    /**
     * Refreshes the heartbeat and replaces the reported metrics. Reported free capacity is capped at the node's
     * capabilities.
     */
    public NodeInfo updateHeartbeat(NodeId nodeId, NodePerformanceMetrics metrics, AvailableResources available) {
        return mutate(nodeId, info -> {
            NodeInfo updated = info.withHeartbeat(clock.instant());
            if (metrics != null) {
                updated = updated.withPerformanceMetrics(metrics);
            }
            if (available != null) {
                updated = updated.withAvailableResources(available.clampTo(info.capabilities()));
            }
            return updated;
        });
    }

    // ============================
    // Status
    // ============================

    /**
     * Moves a node to {@code status}. Setting the current status again is a no-op.
     *
     * @throws InvalidStateTransitionException if the move is not in the node status table
     */
    public NodeInfo setStatus(NodeId nodeId, NodeStatus status) {
        return mutate(nodeId, info -> {
            if (info.status() == status) {
                return info;
            }
            if (!info.status().canTransitionTo(status)) {
                throw new InvalidStateTransitionException("node " + nodeId, info.status(), status);
            }
            log.debug("Node {} status {} -> {}", nodeId, info.status(), status);
            return info.withStatus(status);
        });
    }

    /**
     * Atomically moves a node to {@code status} when {@code condition} holds for its current record and the move is
     * legal.
     *
     * @return true if this call changed the status
     */
    public boolean transitionIf(NodeId nodeId, Predicate<NodeInfo> condition, NodeStatus status) {
        lock.writeLock().lock();
        try {
            NodeInfo info = nodes.get(nodeId);
            if (info == null || info.status() == status || !condition.test(info)) {
                return false;
            }
            if (!info.status().canTransitionTo(status)) {
                return false;
            }
            nodes.put(nodeId, info.withStatus(status));
            log.debug("Node {} status {} -> {}", nodeId, info.status(), status);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================
    // Capacity
    // ============================

    /**
     * Takes {@code demand} out of the node's free capacity.
     *
     * @throws AllocationFailedException if the node cannot hold the demand
     */
    public NodeInfo reserve(NodeId nodeId, ResourceDemand demand) {
        if (demand == null || demand.isEmpty()) {
            return require(nodeId);
        }
        return mutate(nodeId, info -> {
            if (!info.availableResources().canSatisfy(demand)) {
                throw new AllocationFailedException(AllocationFailedException.INSUFFICIENT_RESOURCES);
            }
            return info.withAvailableResources(info.availableResources().minus(demand));
        });
    }

    /**
     * Returns {@code demand} to the node's free capacity, never beyond its capabilities. Unknown nodes are ignored
     * since their capacity left with them.
     */
    public void release(NodeId nodeId, ResourceDemand demand) {
        if (demand == null || demand.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            NodeInfo info = nodes.get(nodeId);
            if (info == null) {
                return;
            }
            nodes.put(
                    nodeId,
                    info.withAvailableResources(info.availableResources().plus(demand, info.capabilities())));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================
    // Reads
    // ============================

    public Optional<NodeInfo> get(NodeId nodeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public NodeInfo require(NodeId nodeId) {
        return get(nodeId).orElseThrow(() -> new NotFoundException("node " + nodeId));
    }

    public boolean contains(NodeId nodeId) {
        return get(nodeId).isPresent();
    }

    public RegistrySnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new RegistrySnapshot(nodes, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DepartedNode> getDeparted() {
        lock.readLock().lock();
        try {
            return List.copyOf(departed);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant now() {
        return clock.instant();
    }

    private NodeInfo mutate(NodeId nodeId, UnaryOperator<NodeInfo> change) {
        lock.writeLock().lock();
        try {
            NodeInfo info = nodes.get(nodeId);
            if (info == null) {
                throw new NotFoundException("node " + nodeId);
            }
            NodeInfo updated = change.apply(info);
            nodes.put(nodeId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
