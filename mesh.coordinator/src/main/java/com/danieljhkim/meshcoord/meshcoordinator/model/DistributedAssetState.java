package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Replicated view of one allocation: which node hosts it and what every observer reports about it.
 */
public record DistributedAssetState(
        AssetId assetId,
        NodeId primaryNode,
        Map<NodeId, AssetStateReport> nodeStates,
        ResourceDemand demand,
        Instant lastUpdated) {

    public DistributedAssetState {
        Objects.requireNonNull(assetId, "assetId cannot be null");
        Objects.requireNonNull(primaryNode, "primaryNode cannot be null");
        nodeStates = nodeStates == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(nodeStates));
        if (demand == null) {
            demand = ResourceDemand.NONE;
        }
        Objects.requireNonNull(lastUpdated, "lastUpdated cannot be null");
    }

    /**
     * State of a fresh allocation: the primary is the only observer and reports ALLOCATED.
     */
    public static DistributedAssetState allocated(
            AssetId assetId, NodeId primaryNode, ResourceDemand demand, Instant now) {
        return new DistributedAssetState(
                assetId, primaryNode, Map.of(primaryNode, AssetStateReport.of(AssetState.ALLOCATED)), demand, now);
    }

    public DistributedAssetState withReport(NodeId observer, AssetStateReport report, Instant now) {
        Map<NodeId, AssetStateReport> updated = new LinkedHashMap<>(nodeStates);
        updated.put(observer, report);
        return new DistributedAssetState(assetId, primaryNode, updated, demand, now);
    }

    public DistributedAssetState withPrimary(NodeId newPrimary, Instant now) {
        return new DistributedAssetState(assetId, newPrimary, nodeStates, demand, now);
    }
}
