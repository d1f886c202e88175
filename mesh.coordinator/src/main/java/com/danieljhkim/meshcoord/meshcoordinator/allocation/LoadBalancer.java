package com.danieljhkim.meshcoord.meshcoordinator.allocation;

import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.state.AssetStateStore;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Proposes moves off overloaded nodes.
 *
 * <p>
 * Load is the mean of CPU and memory utilization over ACTIVE nodes. A node is overloaded when its load exceeds the
 * fleet average by more than the imbalance threshold. For each overloaded node, the first of its assets that some
 * under-average node supports is proposed for a move to the least loaded such node. At most one move per overloaded
 * node per tick; the move itself runs when the {@link MeshEvent.RebalanceRequested} is processed.
 */
@Slf4j
public class LoadBalancer {

    private final NodeRegistry registry;
    private final AssetStateStore assets;
    private final EventPublisher publisher;
    private final double imbalanceThreshold;
    private final Predicate<AssetId> migrating;

    /**
     * @param migrating tells whether an asset already has an active migration; such assets are skipped
     */
    public LoadBalancer(
            NodeRegistry registry,
            AssetStateStore assets,
            EventPublisher publisher,
            double imbalanceThreshold,
            Predicate<AssetId> migrating) {
        this.registry = registry;
        this.assets = assets;
        this.publisher = publisher;
        this.imbalanceThreshold = imbalanceThreshold;
        this.migrating = migrating;
    }

    /**
     * One complete tick.
     *
     * @return the moves proposed
     */
    public List<MeshEvent.RebalanceRequested> rebalance() {
        List<NodeInfo> active = registry.snapshot().nodes().stream()
                .filter(NodeInfo::isActive)
                .toList();
        if (active.size() < 2) {
            return List.of();
        }

        double average = active.stream()
                .mapToDouble(n -> n.performanceMetrics().combinedLoad())
                .average()
                .orElse(0.0);
        List<NodeInfo> underloaded = active.stream()
                .filter(n -> load(n) < average)
                .sorted(Comparator.comparingDouble(LoadBalancer::load))
                .toList();

        List<MeshEvent.RebalanceRequested> proposals = new ArrayList<>();
        for (NodeInfo node : active) {
            if (load(node) - average <= imbalanceThreshold) {
                continue;
            }
            log.info("Node {} overloaded: load {} vs average {}", node.nodeId(), load(node), average);
            proposeMove(node, underloaded).ifPresent(move -> {
                proposals.add(move);
                publisher.publish(move);
            });
        }
        return proposals;
    }

    private Optional<MeshEvent.RebalanceRequested> proposeMove(NodeInfo overloaded, List<NodeInfo> underloaded) {
        for (AssetId assetId : assets.assetsOnNode(overloaded.nodeId())) {
            if (migrating.test(assetId)) {
                continue;
            }
            Optional<DistributedAssetState> state = assets.get(assetId);
            if (state.isEmpty()) {
                continue;
            }
            for (NodeInfo target : underloaded) {
                if (target.capabilities().supports(assetId.resourceType())
                        && target.availableResources().canSatisfy(state.get().demand())) {
                    log.debug("Proposing {} from {} to {}", assetId, overloaded.nodeId(), target.nodeId());
                    return Optional.of(new MeshEvent.RebalanceRequested(assetId, overloaded.nodeId(), target.nodeId()));
                }
            }
        }
        return Optional.empty();
    }

    private static double load(NodeInfo node) {
        return node.performanceMetrics().combinedLoad();
    }
}
