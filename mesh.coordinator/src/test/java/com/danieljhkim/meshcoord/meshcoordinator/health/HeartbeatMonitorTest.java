package com.danieljhkim.meshcoord.meshcoordinator.health;

import static org.junit.jupiter.api.Assertions.*;

import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import com.danieljhkim.meshcoord.meshcoordinator.support.MutableClock;
import com.danieljhkim.meshcoord.meshcoordinator.support.RecordingPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.support.TestNodes;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HeartbeatMonitorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private NodeRegistry registry;
    private RecordingPublisher publisher;
    private HeartbeatMonitor monitor;
    private NodeId nodeA;
    private NodeId nodeB;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new NodeRegistry(clock);
        publisher = new RecordingPublisher();
        monitor = new HeartbeatMonitor(registry, publisher, TIMEOUT, clock);
        nodeA = TestNodes.nodeId("node-a");
        nodeB = TestNodes.nodeId("node-b");
        registry.join(nodeA, TestNodes.cpuNode(4), null);
        registry.join(nodeB, TestNodes.cpuNode(4), null);
    }

    @Test
    void testFreshNodesAreNotFailed() {
        clock.advance(TIMEOUT);

        assertTrue(monitor.scan().isEmpty());
        assertTrue(publisher.events().isEmpty());
    }

    @Test
    void testStaleNodeFailedExactlyOnce() {
        // Given: B keeps heartbeating, A goes silent
        clock.advance(Duration.ofSeconds(20));
        registry.updateHeartbeat(nodeB);
        clock.advance(Duration.ofSeconds(11));

        // When
        List<NodeId> first = monitor.scan();
        List<NodeId> second = monitor.scan();

        // Then
        assertEquals(List.of(nodeA), first);
        assertTrue(second.isEmpty());
        assertEquals(NodeStatus.FAILED, registry.require(nodeA).status());
        assertEquals(NodeStatus.ACTIVE, registry.require(nodeB).status());

        List<MeshEvent.NodeFailed> failures = publisher.eventsOfType(MeshEvent.NodeFailed.class);
        assertEquals(1, failures.size());
        assertEquals(nodeA, failures.get(0).node());
        assertEquals(clock.instant(), failures.get(0).time());
    }

    @Test
    void testLateHeartbeatDoesNotReviveFailedNode() {
        clock.advance(Duration.ofSeconds(31));
        monitor.scan();

        registry.updateHeartbeat(nodeA);
        clock.advance(Duration.ofSeconds(31));
        monitor.scan();

        assertEquals(NodeStatus.FAILED, registry.require(nodeA).status());
        assertEquals(
                1,
                publisher.eventsOfType(MeshEvent.NodeFailed.class).stream()
                        .filter(e -> e.node().equals(nodeA))
                        .count());
    }

    @Test
    void testNodesInMaintenanceCanStillFail() {
        registry.setStatus(nodeA, NodeStatus.MAINTENANCE);
        registry.updateHeartbeat(nodeB);
        clock.advance(Duration.ofSeconds(31));
        registry.updateHeartbeat(nodeB);

        assertEquals(List.of(nodeA), monitor.scan());
    }
}
