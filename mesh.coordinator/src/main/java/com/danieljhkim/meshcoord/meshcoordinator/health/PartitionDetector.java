package com.danieljhkim.meshcoord.meshcoordinator.health;

import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import com.danieljhkim.meshcoord.meshcoordinator.state.RegistrySnapshot;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkPartition;
import com.danieljhkim.meshcoord.meshcoordinator.topology.TopologyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Detects partitions from pairwise reachability and heals them once every member is ACTIVE again.
 *
 * <p>
 * A tick probes the ACTIVE, DEGRADED and PARTITIONED nodes, splits them into mutual-reachability components and
 * treats the component holding the local node (or else the largest one) as primary. Partitioned nodes back in the
 * primary component return to ACTIVE, healed partitions are closed, and every other component is recorded as a new
 * partition unless an open partition with the same members already exists.
 */
@Slf4j
public class PartitionDetector {

    private static final Set<NodeStatus> CANDIDATE_STATUSES =
            Set.of(NodeStatus.ACTIVE, NodeStatus.DEGRADED, NodeStatus.PARTITIONED);

    private final NodeRegistry registry;
    private final TopologyStore topology;
    private final ReachabilityProbe probe;
    private final EventPublisher publisher;
    private final Clock clock;
    private volatile NodeId localNode;

    public PartitionDetector(
            NodeRegistry registry,
            TopologyStore topology,
            ReachabilityProbe probe,
            EventPublisher publisher,
            Clock clock) {
        this.registry = registry;
        this.topology = topology;
        this.probe = probe;
        this.publisher = publisher;
        this.clock = clock;
    }

    public void setLocalNode(NodeId localNode) {
        this.localNode = localNode;
    }

    /**
     * One complete tick. A probe failure skips the tick.
     *
     * @return partitions recorded by this tick
     */
    public List<NetworkPartition> tick() {
        RegistrySnapshot snapshot = registry.snapshot();
        List<NodeId> candidates = snapshot.nodes().stream()
                .filter(n -> CANDIDATE_STATUSES.contains(n.status()))
                .map(NodeInfo::nodeId)
                .toList();

        Map<NodeId, Set<NodeId>> reachability;
        try {
            reachability = probe.probe(candidates);
        } catch (RuntimeException e) {
            log.warn("Reachability probe failed, skipping partition check: {}", e.getMessage());
            return List.of();
        }

        List<Set<NodeId>> components = ConnectedComponents.compute(candidates, reachability);
        Optional<Set<NodeId>> primary = primaryComponent(components);
        primary.ifPresent(this::restore);

        checkHealed();

        List<NetworkPartition> detected = new ArrayList<>();
        for (Set<NodeId> component : components) {
            if (primary.isPresent() && component == primary.get()) {
                continue;
            }
            if (isAlreadyOpen(component)) {
                continue;
            }
            detected.add(record(component));
        }
        return detected;
    }

    /**
     * Closes every open partition whose members are all ACTIVE. Members that left the registry do not block healing.
     * A partition is healed at most once, so calling this again publishes nothing new.
     *
     * @return ids of the partitions healed by this call
     */
    public List<String> checkHealed() {
        List<String> healed = new ArrayList<>();
        for (NetworkPartition partition : topology.getOpenPartitions()) {
            boolean allActive = partition.getNodes().stream()
                    .allMatch(id -> registry.get(id).map(NodeInfo::isActive).orElse(true));
            if (allActive && partition.markHealed(clock.instant())) {
                log.info("Partition {} healed", partition.getPartitionId());
                healed.add(partition.getPartitionId());
                publisher.publish(new MeshEvent.PartitionHealed(partition.getPartitionId()));
            }
        }
        return healed;
    }

    private Optional<Set<NodeId>> primaryComponent(List<Set<NodeId>> components) {
        NodeId local = localNode;
        if (local != null) {
            for (Set<NodeId> component : components) {
                if (component.contains(local)) {
                    return Optional.of(component);
                }
            }
        }
        Set<NodeId> largest = null;
        for (Set<NodeId> component : components) {
            if (largest == null || component.size() > largest.size()) {
                largest = component;
            }
        }
        return Optional.ofNullable(largest);
    }

    private void restore(Set<NodeId> primary) {
        for (NodeId node : primary) {
            if (registry.transitionIf(node, info -> info.status() == NodeStatus.PARTITIONED, NodeStatus.ACTIVE)) {
                log.info("Node {} reachable again, back to ACTIVE", node);
            }
        }
    }

    private boolean isAlreadyOpen(Set<NodeId> members) {
        return topology.getOpenPartitions().stream().anyMatch(p -> p.getNodes().equals(members));
    }

    private NetworkPartition record(Set<NodeId> members) {
        Instant now = clock.instant();
        NetworkPartition partition = new NetworkPartition(UUID.randomUUID().toString(), members, now);
        topology.addPartition(partition);
        for (NodeId node : members) {
            registry.transitionIf(node, info -> info.status().isReachable(), NodeStatus.PARTITIONED);
        }
        log.warn("Partition {} detected with {} node(s): {}", partition.getPartitionId(), members.size(), members);
        publisher.publish(new MeshEvent.PartitionDetected(partition));
        return partition;
    }
}
