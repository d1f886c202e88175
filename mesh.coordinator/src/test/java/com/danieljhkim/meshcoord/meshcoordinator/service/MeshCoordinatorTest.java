package com.danieljhkim.meshcoord.meshcoordinator.service;

import static org.junit.jupiter.api.Assertions.*;

import com.danieljhkim.meshcoord.meshcommon.exception.AllocationFailedException;
import com.danieljhkim.meshcoord.meshcommon.exception.AssetNotFoundException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.allocation.AllocationSelector;
import com.danieljhkim.meshcoord.meshcoordinator.config.CoordinatorConfig;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshMetricsSnapshot;
import com.danieljhkim.meshcoord.meshcoordinator.health.ReachabilityProbe;
import com.danieljhkim.meshcoord.meshcoordinator.migration.InMemoryMigrationTransport;
import com.danieljhkim.meshcoord.meshcoordinator.model.AllocationDecision;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetStateReport;
import com.danieljhkim.meshcoord.meshcoordinator.model.ConsensusProof;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.LocalNode;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceDemand;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;
import com.danieljhkim.meshcoord.meshcoordinator.support.MutableClock;
import com.danieljhkim.meshcoord.meshcoordinator.support.TestNodes;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkTopology;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MeshCoordinatorTest {

    private MutableClock clock;
    private InMemoryMigrationTransport transport;
    private MeshCoordinator coordinator;
    private NodeId local;
    private NodeId nodeA;
    private NodeId nodeB;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        transport = new InMemoryMigrationTransport();
        coordinator = newCoordinator(CoordinatorConfig.defaults());

        local = TestNodes.nodeId("local");
        nodeA = TestNodes.nodeId("node-a");
        nodeB = TestNodes.nodeId("node-b");
        coordinator.initialize(new LocalNode(local, TestNodes.capabilities(2, ResourceType.STORAGE), null));
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private MeshCoordinator newCoordinator(CoordinatorConfig config) {
        return new MeshCoordinator(config, ReachabilityProbe.fullyConnected(), transport, null, clock);
    }

    @Test
    void testInitializeTwiceFails() {
        assertThrows(
                IllegalStateException.class,
                () -> coordinator.initialize(new LocalNode(local, TestNodes.cpuNode(1), null)));
    }

    @Test
    void testFailedNodeAssetsMoveToSurvivor() {
        // Given: A has 8 free cores and B has 2, both support CPU and both are fully trusted
        coordinator.registerNode(nodeA, TestNodes.cpuNode(8), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(2), null);
        AllocationSelector selector = new AllocationSelector(coordinator.getRegistry());
        assertEquals(nodeA, selector.select(ResourceType.CPU).node().nodeId());
        AssetId asset = AssetId.random(ResourceType.CPU);
        AllocationDecision decision = coordinator.allocateAsset(asset, ResourceDemand.cpu(1), null);
        assertEquals(nodeA, decision.targetNode());
        assertEquals(7.0, coordinator.getRegistry().require(nodeA).availableResources().cpuCores());

        // When: A stops heartbeating past the failure timeout
        failNodeA();

        // Then
        assertEquals(NodeStatus.FAILED, coordinator.getRegistry().require(nodeA).status());
        DistributedAssetState state = coordinator.syncAssetState(asset);
        assertEquals(nodeB, state.primaryNode());
        assertEquals(1.0, coordinator.getRegistry().require(nodeB).availableResources().cpuCores());
        assertFalse(coordinator.getMigrator().isMigrating(asset));

        MeshMetricsSnapshot metrics = coordinator.getMetrics();
        assertEquals(2, metrics.totalNodes());
        assertEquals(1, metrics.healthyNodes());
        assertEquals(1, metrics.failedNodes());
        assertEquals(1, metrics.migrationsStarted());
        assertEquals(1, metrics.successfulMigrations());
    }

    @Test
    void testRepeatAllocationAfterFailoverPointsAtNewPrimary() {
        // Given
        coordinator.registerNode(nodeA, TestNodes.cpuNode(8), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(2), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        AllocationDecision first = coordinator.allocateAsset(asset, ResourceDemand.cpu(1), null);
        assertEquals(nodeA, first.targetNode());
        failNodeA();

        // When
        AllocationDecision again = coordinator.allocateAsset(asset, ResourceDemand.cpu(1), null);

        // Then
        assertEquals(nodeB, again.targetNode());
        assertEquals(first.attestations(), again.attestations());
        assertEquals(nodeB, coordinator.getDecision(asset).orElseThrow().targetNode());
        // nothing reserved twice
        assertEquals(1.0, coordinator.getRegistry().require(nodeB).availableResources().cpuCores());
    }

    private void failNodeA() {
        clock.advance(Duration.ofSeconds(20));
        coordinator.heartbeat(nodeB);
        clock.advance(Duration.ofSeconds(11));
        coordinator.heartbeatTick();
        coordinator.getEventProcessor().processPending();
    }

    @Test
    void testFailureWithoutAutoMigrationLeavesAssets() {
        coordinator.shutdown();
        coordinator = newCoordinator(CoordinatorConfig.builder().autoMigration(false).build());
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset);

        clock.advance(Duration.ofSeconds(31));
        coordinator.heartbeat(nodeB);
        coordinator.heartbeatTick();
        coordinator.getEventProcessor().processPending();

        assertEquals(nodeA, coordinator.syncAssetState(asset).primaryNode());
        assertEquals(0, coordinator.getMetrics().migrationsStarted());
    }

    @Test
    void testRejectedProofBlocksAllocation() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);

        AllocationFailedException ex = assertThrows(
                AllocationFailedException.class,
                () -> coordinator.allocateAsset(asset, ResourceDemand.NONE, ConsensusProof.verdictOnly(false)));

        assertEquals(MeshCoordinator.CONSENSUS_REJECTED, ex.getReason());
        assertTrue(coordinator.getAssetStates().get(asset).isEmpty());
    }

    @Test
    void testAcceptedProofIsAttested() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        ConsensusProof proof = new ConsensusProof(new byte[] {1}, new byte[] {2}, new byte[] {3}, new byte[] {4}, true);

        AllocationDecision decision = coordinator.allocateAsset(asset, ResourceDemand.NONE, proof);

        assertEquals(1, decision.attestations().size());
        assertEquals(local, decision.attestations().get(0).node());
        assertArrayEquals(proof.digest(), decision.attestations().get(0).signature());
        assertEquals(decision, coordinator.getDecision(asset).orElseThrow());
    }

    @Test
    void testRepeatedAllocationReturnsSameDecision() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);

        AllocationDecision first = coordinator.allocateAsset(asset, ResourceDemand.cpu(2), null);
        AllocationDecision second = coordinator.allocateAsset(asset, ResourceDemand.cpu(2), null);

        assertSame(first, second);
        assertEquals(2.0, coordinator.getRegistry().require(nodeA).availableResources().cpuCores());
        assertEquals(1, coordinator.getAssetStates().size());
    }

    @Test
    void testAllocationSpillsOverWhenCapacityRunsOut() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(2), null);

        AllocationDecision first =
                coordinator.allocateAsset(AssetId.random(ResourceType.CPU), ResourceDemand.cpu(3), null);
        AllocationDecision second =
                coordinator.allocateAsset(AssetId.random(ResourceType.CPU), ResourceDemand.cpu(2), null);

        assertEquals(nodeA, first.targetNode());
        assertEquals(nodeB, second.targetNode());
        AllocationFailedException ex = assertThrows(
                AllocationFailedException.class,
                () -> coordinator.allocateAsset(AssetId.random(ResourceType.CPU), ResourceDemand.cpu(2), null));
        assertEquals(AllocationFailedException.INSUFFICIENT_RESOURCES, ex.getReason());
    }

    @Test
    void testDeallocateReturnsCapacity() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset, ResourceDemand.cpu(4), null);

        coordinator.deallocateAsset(asset);

        assertEquals(4.0, coordinator.getRegistry().require(nodeA).availableResources().cpuCores());
        assertTrue(coordinator.getDecision(asset).isEmpty());
        assertThrows(AssetNotFoundException.class, () -> coordinator.deallocateAsset(asset));
        assertThrows(AssetNotFoundException.class, () -> coordinator.syncAssetState(asset));
    }

    @Test
    void testDeregisterMovesAssetsAndForgetsNode() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset);
        coordinator.recordLink(nodeA, nodeB, Duration.ofMillis(3), 1000);

        coordinator.deregisterNode(nodeA, "maintenance window");
        coordinator.getEventProcessor().processPending();

        assertEquals(nodeB, coordinator.syncAssetState(asset).primaryNode());
        NetworkTopology topology = coordinator.getTopology();
        assertFalse(topology.nodes().containsKey(nodeA));
        assertTrue(topology.latencyMatrix().isEmpty());
        assertEquals(1, coordinator.getMetrics().totalNodes());
        assertThrows(NotFoundException.class, () -> coordinator.deregisterNode(nodeA, "again"));
    }

    @Test
    void testRejoinDoesNotDoubleCount() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.getRegistry().setStatus(nodeA, NodeStatus.FAILED);
        coordinator.handleEvent(new MeshEvent.NodeFailed(nodeA, clock.instant()));

        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.getEventProcessor().processPending();

        assertEquals(NodeStatus.ACTIVE, coordinator.getRegistry().require(nodeA).status());
        assertEquals(1, coordinator.getMetrics().totalNodes());
        assertEquals(1, coordinator.getMetrics().healthyNodes());
    }

    @Test
    void testByzantineDetectionLowersTrust() {
        NodeId liar = TestNodes.nodeId("liar");
        coordinator.registerNode(liar, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset);

        AssetStateReport honest = new AssetStateReport(AssetState.RUNNING, "c0ffee", 3);
        coordinator.reportAssetState(asset, liar, new AssetStateReport(AssetState.SUSPENDED, "c0ffee", 3));
        coordinator.reportAssetState(asset, nodeA, honest);
        coordinator.reportAssetState(asset, nodeB, honest);

        assertEquals(List.of(liar), coordinator.detectByzantineNodes());
        coordinator.getEventProcessor().processPending();

        assertEquals(0.9, liar.getTrustScore(), 1e-9);
        assertEquals(1, coordinator.getMetrics().byzantineNodesDetected());
    }

    @Test
    void testReportFromUnknownObserverRejected() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset);

        assertThrows(
                NotFoundException.class,
                () -> coordinator.reportAssetState(asset, nodeB, AssetStateReport.of(AssetState.RUNNING)));
    }

    @Test
    void testRebalanceRequestIsExecuted() {
        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.registerNode(nodeB, TestNodes.cpuNode(4), null);
        AssetId asset = AssetId.random(ResourceType.CPU);
        coordinator.allocateAsset(asset);

        coordinator.handleEvent(new MeshEvent.RebalanceRequested(asset, nodeA, nodeB));
        coordinator.getEventProcessor().processPending();

        assertEquals(nodeB, coordinator.syncAssetState(asset).primaryNode());
        assertEquals(1, coordinator.getMetrics().rebalanceRequests());
    }

    @Test
    void testSubscribersSeeEvents() {
        List<MeshEvent> seen = new ArrayList<>();
        coordinator.subscribe(seen::add);

        coordinator.registerNode(nodeA, TestNodes.cpuNode(4), null);
        coordinator.getEventProcessor().processPending();

        assertEquals(1, seen.size());
        assertInstanceOf(MeshEvent.NodeJoined.class, seen.get(0));
    }

    @Test
    void testJoinAndLeaveNetwork() throws InterruptedException {
        List<MeshEvent> seen = Collections.synchronizedList(new ArrayList<>());
        coordinator.subscribe(seen::add);

        coordinator.joinNetwork();
        assertTrue(coordinator.getEventProcessor().isRunning());
        assertTrue(coordinator.getRegistry().contains(local));

        coordinator.leaveNetwork();
        assertTrue(coordinator.getEventProcessor().awaitIdle(Duration.ofSeconds(5)));

        assertFalse(coordinator.getRegistry().contains(local));
        assertEquals(2, seen.size());
        assertEquals(new MeshEvent.NodeLeft(local, "local node leaving network"), seen.get(1));
    }

    @Test
    void testJoinWithoutInitializeFails() {
        MeshCoordinator uninitialized = newCoordinator(CoordinatorConfig.defaults());

        assertThrows(IllegalStateException.class, uninitialized::joinNetwork);
    }
}
