package com.danieljhkim.meshcoord.meshcoordinator.allocation;

import com.danieljhkim.meshcoord.meshcommon.exception.AllocationFailedException;
import com.danieljhkim.meshcoord.meshcoordinator.model.AvailableResources;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodePerformanceMetrics;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceDemand;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import com.danieljhkim.meshcoord.meshcoordinator.state.RegistrySnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Picks the node that should host an allocation.
 *
 * <p>
 * Eligible nodes are ACTIVE and support the resource type. Each is scored as
 *
 * <pre>
 * trust * (0.3 * cpuFree + 0.3 * memFree + 0.2 * successRate + 0.2 / (1 + avgResponseMs / 1000))
 * </pre>
 *
 * and the highest score wins; on equal scores the node seen first in registry order wins.
 */
@Slf4j
public class AllocationSelector {

    static final double CPU_WEIGHT = 0.3;
    static final double MEMORY_WEIGHT = 0.3;
    static final double SUCCESS_WEIGHT = 0.2;
    static final double LATENCY_WEIGHT = 0.2;

    private final NodeRegistry registry;

    public AllocationSelector(NodeRegistry registry) {
        this.registry = registry;
    }

    public ScoredNode select(ResourceType type) {
        return select(registry.snapshot(), type, ResourceDemand.NONE, Set.of());
    }

    public ScoredNode select(ResourceType type, ResourceDemand demand, Set<NodeId> excluded) {
        return select(registry.snapshot(), type, demand, excluded);
    }

    /**
     * Scores over a fixed snapshot; the same snapshot always yields the same node.
     *
     * @throws AllocationFailedException with {@link AllocationFailedException#NO_ELIGIBLE_NODES} when no active node
     *     supports the type, or {@link AllocationFailedException#INSUFFICIENT_RESOURCES} when none of those can hold
     *     the demand
     */
    public ScoredNode select(RegistrySnapshot snapshot, ResourceType type, ResourceDemand demand, Set<NodeId> excluded) {
        List<NodeInfo> eligible = snapshot.nodes().stream()
                .filter(NodeInfo::isActive)
                .filter(n -> n.capabilities().supports(type))
                .filter(n -> excluded == null || !excluded.contains(n.nodeId()))
                .toList();
        if (eligible.isEmpty()) {
            throw new AllocationFailedException(AllocationFailedException.NO_ELIGIBLE_NODES);
        }

        ResourceDemand required = demand == null ? ResourceDemand.NONE : demand;
        NodeInfo best = null;
        double bestScore = 0.0;
        for (NodeInfo node : eligible) {
            if (!node.availableResources().canSatisfy(required)) {
                continue;
            }
            double score = score(node, snapshot.trustOf(node.nodeId()));
            if (best == null || score > bestScore) {
                best = node;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new AllocationFailedException(AllocationFailedException.INSUFFICIENT_RESOURCES);
        }
        log.debug("Selected {} for {} with score {}", best.nodeId(), type, bestScore);
        return new ScoredNode(best, bestScore);
    }

    public static double score(NodeInfo node) {
        return score(node, node.nodeId().getTrustScore());
    }

    static double score(NodeInfo node, double trust) {
        NodeCapabilities caps = node.capabilities();
        AvailableResources free = node.availableResources();
        NodePerformanceMetrics metrics = node.performanceMetrics();

        double cpuFree = ratio(free.cpuCores(), caps.cpuCores());
        double memFree = ratio(free.memoryBytes(), caps.memoryBytes());
        double latency = 1.0 / (1.0 + metrics.avgResponseTimeMs() / 1000.0);

        double base = CPU_WEIGHT * cpuFree
                + MEMORY_WEIGHT * memFree
                + SUCCESS_WEIGHT * metrics.successRate()
                + LATENCY_WEIGHT * latency;
        return base * trust;
    }

    private static double ratio(double free, double capacity) {
        return capacity <= 0 ? 0.0 : free / capacity;
    }
}
