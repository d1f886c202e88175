package com.danieljhkim.meshcoord.meshcoordinator.health;

import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetStateReport;
import com.danieljhkim.meshcoord.meshcoordinator.model.ByzantineEvidence;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.state.AssetStateStore;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags nodes whose reports disagree with the honest majority too often.
 *
 * <p>
 * Per node: every asset it reported on counts as observed; a report that differs from the value held by a strict
 * majority of the other observers is a disagreement, and a success rate below {@value #MIN_SUCCESS_RATE} adds one more
 * suspicious behavior. The node is flagged when suspicious / max(1, observed) is strictly above the threshold. Flags
 * are advisory.
 */
@Slf4j
public class ByzantineDetector {

    static final double MIN_SUCCESS_RATE = 0.5;

    private final NodeRegistry registry;
    private final AssetStateStore assets;
    private final EventPublisher publisher;
    private final double threshold;
    private final Set<NodeId> flagged = ConcurrentHashMap.newKeySet();

    public ByzantineDetector(NodeRegistry registry, AssetStateStore assets, EventPublisher publisher, double threshold) {
        this.registry = registry;
        this.assets = assets;
        this.publisher = publisher;
        this.threshold = threshold;
    }

    /**
     * One complete tick. {@link MeshEvent.ByzantineDetected} is published only for nodes that were not already
     * flagged; nodes that drop back under the threshold are unflagged.
     *
     * @return every node over the threshold in this scan
     */
    public List<NodeId> scan() {
        List<DistributedAssetState> states = assets.all();
        List<NodeId> overThreshold = new ArrayList<>();

        for (NodeInfo node : registry.snapshot().nodes()) {
            NodeId nodeId = node.nodeId();
            List<ByzantineEvidence> evidence = new ArrayList<>();
            int observed = 0;
            for (DistributedAssetState state : states) {
                AssetStateReport own = state.nodeStates().get(nodeId);
                if (own == null) {
                    continue;
                }
                observed++;
                Optional<AssetStateReport> majority = majorityOfOthers(state, nodeId);
                if (majority.isPresent() && !majority.get().equals(own)) {
                    evidence.add(ByzantineEvidence.disagreement(state.assetId(), own, majority.get()));
                }
            }
            double successRate = node.performanceMetrics().successRate();
            if (successRate < MIN_SUCCESS_RATE) {
                evidence.add(ByzantineEvidence.lowSuccessRate(successRate));
            }

            double ratio = (double) evidence.size() / Math.max(1, observed);
            if (ratio > threshold) {
                overThreshold.add(nodeId);
                if (flagged.add(nodeId)) {
                    log.warn(
                            "Node {} flagged as Byzantine: {} suspicious of {} observed (ratio {})",
                            nodeId,
                            evidence.size(),
                            observed,
                            ratio);
                    publisher.publish(new MeshEvent.ByzantineDetected(nodeId, evidence));
                }
            } else if (flagged.remove(nodeId)) {
                log.info("Node {} back under Byzantine threshold (ratio {})", nodeId, ratio);
            }
        }
        flagged.retainAll(registry.snapshot().asMap().keySet());
        return overThreshold;
    }

    public Set<NodeId> getFlagged() {
        return Set.copyOf(flagged);
    }

    /**
     * Value reported by more than half of the observers other than {@code exclude}, if any.
     */
    static Optional<AssetStateReport> majorityOfOthers(DistributedAssetState state, NodeId exclude) {
        Map<AssetStateReport, Integer> counts = new HashMap<>();
        int others = 0;
        for (Map.Entry<NodeId, AssetStateReport> entry : state.nodeStates().entrySet()) {
            if (entry.getKey().equals(exclude)) {
                continue;
            }
            others++;
            counts.merge(entry.getValue(), 1, Integer::sum);
        }
        for (Map.Entry<AssetStateReport, Integer> entry : counts.entrySet()) {
            if (entry.getValue() * 2 > others) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
