package com.danieljhkim.meshcoord.meshcoordinator.health;

import static org.junit.jupiter.api.Assertions.*;

import com.danieljhkim.meshcoord.meshcommon.exception.NetworkException;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import com.danieljhkim.meshcoord.meshcoordinator.support.MutableClock;
import com.danieljhkim.meshcoord.meshcoordinator.support.RecordingPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.support.TestNodes;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkPartition;
import com.danieljhkim.meshcoord.meshcoordinator.topology.TopologyStore;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PartitionDetectorTest {

    private NodeRegistry registry;
    private TopologyStore topology;
    private RecordingPublisher publisher;
    private PartitionDetector detector;
    private final Map<NodeId, Set<NodeId>> links = new HashMap<>();

    private NodeId local;
    private NodeId nodeA;
    private NodeId nodeB;
    private NodeId nodeC;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        registry = new NodeRegistry(clock);
        topology = new TopologyStore();
        publisher = new RecordingPublisher();
        detector = new PartitionDetector(registry, topology, candidates -> links, publisher, clock);

        local = TestNodes.nodeId("local");
        nodeA = TestNodes.nodeId("node-a");
        nodeB = TestNodes.nodeId("node-b");
        nodeC = TestNodes.nodeId("node-c");
        for (NodeId id : List.of(local, nodeA, nodeB, nodeC)) {
            registry.join(id, TestNodes.cpuNode(2), null);
        }
        detector.setLocalNode(local);
    }

    @Test
    void testFullyConnectedMeshHasNoPartitions() {
        connectAll(local, nodeA, nodeB, nodeC);

        assertTrue(detector.tick().isEmpty());
        assertTrue(topology.getPartitions().isEmpty());
    }

    @Test
    void testSplitRecordsMinorityComponent() {
        // Given: {local, A} and {B, C} cannot see each other
        connectAll(local, nodeA);
        connectAll(nodeB, nodeC);

        // When
        List<NetworkPartition> detected = detector.tick();

        // Then
        assertEquals(1, detected.size());
        assertEquals(Set.of(nodeB, nodeC), detected.get(0).getNodes());
        assertEquals(NodeStatus.PARTITIONED, registry.require(nodeB).status());
        assertEquals(NodeStatus.PARTITIONED, registry.require(nodeC).status());
        assertEquals(NodeStatus.ACTIVE, registry.require(nodeA).status());
        assertEquals(1, publisher.eventsOfType(MeshEvent.PartitionDetected.class).size());

        // Same split on the next tick is not recorded twice
        assertTrue(detector.tick().isEmpty());
        assertEquals(1, topology.getOpenPartitions().size());
    }

    @Test
    void testOneWayLinkIsNotConnectivity() {
        connectAll(local, nodeA, nodeB);
        links.put(nodeC, new HashSet<>(Set.of(local)));

        List<NetworkPartition> detected = detector.tick();

        assertEquals(1, detected.size());
        assertEquals(Set.of(nodeC), detected.get(0).getNodes());
    }

    @Test
    void testLargestComponentIsPrimaryWithoutLocalNode() {
        detector.setLocalNode(null);
        connectAll(nodeA, nodeB, nodeC);
        links.put(local, Set.of());

        List<NetworkPartition> detected = detector.tick();

        assertEquals(1, detected.size());
        assertEquals(Set.of(local), detected.get(0).getNodes());
    }

    @Test
    void testReconnectRestoresNodesAndHealsOnce() {
        connectAll(local, nodeA);
        connectAll(nodeB, nodeC);
        NetworkPartition partition = detector.tick().get(0);

        // When: the link comes back
        links.clear();
        connectAll(local, nodeA, nodeB, nodeC);
        assertTrue(detector.tick().isEmpty());

        // Then
        assertEquals(NodeStatus.ACTIVE, registry.require(nodeB).status());
        assertEquals(NodeStatus.ACTIVE, registry.require(nodeC).status());
        assertTrue(partition.isHealed());
        assertNotNull(partition.getHealedAt());

        List<MeshEvent.PartitionHealed> healed = publisher.eventsOfType(MeshEvent.PartitionHealed.class);
        assertEquals(1, healed.size());
        assertEquals(partition.getPartitionId(), healed.get(0).partitionId());

        assertTrue(detector.checkHealed().isEmpty());
        assertEquals(1, publisher.eventsOfType(MeshEvent.PartitionHealed.class).size());
        assertEquals(1, topology.getPartitions().size());
    }

    @Test
    void testPartitionWithFailedMemberDoesNotHeal() {
        connectAll(local, nodeA);
        connectAll(nodeB, nodeC);
        NetworkPartition partition = detector.tick().get(0);

        registry.setStatus(nodeC, NodeStatus.FAILED);
        links.clear();
        connectAll(local, nodeA, nodeB);
        detector.tick();

        assertEquals(NodeStatus.ACTIVE, registry.require(nodeB).status());
        assertFalse(partition.isHealed());

        // C leaving the mesh no longer blocks healing
        registry.leave(nodeC, "decommissioned");
        assertEquals(List.of(partition.getPartitionId()), detector.checkHealed());
    }

    @Test
    void testProbeFailureSkipsTick() {
        PartitionDetector failing = new PartitionDetector(
                registry,
                topology,
                candidates -> {
                    throw new NetworkException("probe unavailable");
                },
                publisher,
                new MutableClock());

        assertTrue(failing.tick().isEmpty());
        assertTrue(publisher.events().isEmpty());
    }

    @Test
    void testConnectedComponentsKeepCandidateOrder() {
        connectAll(nodeA, nodeC);
        connectAll(local, nodeB);

        List<Set<NodeId>> components = ConnectedComponents.compute(List.of(local, nodeA, nodeB, nodeC), links);

        assertEquals(2, components.size());
        assertEquals(List.of(local, nodeB), List.copyOf(components.get(0)));
        assertEquals(List.of(nodeA, nodeC), List.copyOf(components.get(1)));
    }

    private void connectAll(NodeId... nodes) {
        for (NodeId from : nodes) {
            Set<NodeId> reachable = links.computeIfAbsent(from, k -> new HashSet<>());
            for (NodeId to : nodes) {
                if (!from.equals(to)) {
                    reachable.add(to);
                }
            }
        }
    }
}
