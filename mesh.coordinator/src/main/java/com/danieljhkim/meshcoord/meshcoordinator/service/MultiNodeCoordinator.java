package com.danieljhkim.meshcoord.meshcoordinator.service;

import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshMetricsSnapshot;
import com.danieljhkim.meshcoord.meshcoordinator.market.ResourceOffer;
import com.danieljhkim.meshcoord.meshcoordinator.market.ResourceRequest;
import com.danieljhkim.meshcoord.meshcoordinator.model.AllocationDecision;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetStateReport;
import com.danieljhkim.meshcoord.meshcoordinator.model.AvailableResources;
import com.danieljhkim.meshcoord.meshcoordinator.model.ConsensusProof;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.LocalNode;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeLocation;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodePerformanceMetrics;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceDemand;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkTopology;

import java.util.List;
import java.util.function.Consumer;

/**
 * Operation contract of the coordination engine, consumed by the surrounding orchestration.
 *
 * <p>
 * Every operation reports failure by throwing a subclass of
 * {@link com.danieljhkim.meshcoord.meshcommon.exception.MeshException}.
 */
public interface MultiNodeCoordinator {

    // ============================
    // Lifecycle
    // ============================

    void initialize(LocalNode localNode);

    /**
     * Registers the local node, then starts the event consumer and every periodic task.
     */
    void joinNetwork();

    /**
     * Removes the local node from the mesh and stops the periodic tasks.
     */
    void leaveNetwork();

    void shutdown();

    // ============================
    // Membership
    // ============================

    NodeInfo registerNode(NodeId nodeId, NodeCapabilities capabilities, NodeLocation location);

    void deregisterNode(NodeId nodeId, String reason);

    NodeInfo heartbeat(NodeId nodeId);

    NodeInfo heartbeat(NodeId nodeId, NodePerformanceMetrics metrics, AvailableResources available);

    /**
     * Re-places every asset whose primary is {@code nodeId}. Safe to call again after a partial run.
     *
     * @throws com.danieljhkim.meshcoord.meshcommon.exception.AllocationFailedException the first failure, after every
     *     asset has been attempted
     */
    void handleNodeFailure(NodeId nodeId);

    List<NodeId> detectByzantineNodes();

    NetworkTopology getTopology();

    // ============================
    // Allocation
    // ============================

    AllocationDecision allocateAsset(AssetId assetId);

    /**
     * @param proof optional consensus proof; one whose verdict is negative rejects the allocation
     */
    AllocationDecision allocateAsset(AssetId assetId, ResourceDemand demand, ConsensusProof proof);

    void deallocateAsset(AssetId assetId);

    void migrateAsset(AssetId assetId, NodeId target);

    DistributedAssetState syncAssetState(AssetId assetId);

    DistributedAssetState reportAssetState(AssetId assetId, NodeId observer, AssetStateReport report);

    // ============================
    // Market
    // ============================

    List<ResourceOffer> requestResources(ResourceRequest request);

    void offerResources(ResourceOffer offer);

    // ============================
    // Events
    // ============================

    /**
     * Injects an externally observed event into the event channel.
     *
     * @throws com.danieljhkim.meshcoord.meshcommon.exception.NetworkException if the channel is closed
     */
    void handleEvent(MeshEvent event);

    void subscribe(Consumer<MeshEvent> listener);

    MeshMetricsSnapshot getMetrics();
}
