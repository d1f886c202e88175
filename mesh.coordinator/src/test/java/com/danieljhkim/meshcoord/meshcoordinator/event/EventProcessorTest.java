package com.danieljhkim.meshcoord.meshcoordinator.event;

import static org.junit.jupiter.api.Assertions.*;

import com.danieljhkim.meshcoord.meshcommon.exception.NetworkException;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;
import com.danieljhkim.meshcoord.meshcoordinator.support.TestNodes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventProcessorTest {

    private EventProcessor processor;
    private NodeId nodeA;
    private NodeId nodeB;

    @BeforeEach
    void setUp() {
        processor = new EventProcessor();
        nodeA = TestNodes.nodeId("node-a");
        nodeB = TestNodes.nodeId("node-b");
    }

    @AfterEach
    void tearDown() {
        processor.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void testMetricsFollowEventStream() {
        processor.publish(new MeshEvent.NodeJoined(nodeA, TestNodes.cpuNode(4), false));
        processor.publish(new MeshEvent.NodeJoined(nodeB, TestNodes.cpuNode(4), false));
        processor.publish(new MeshEvent.NodeFailed(nodeA, Instant.EPOCH));
        processor.publish(new MeshEvent.NodeJoined(nodeA, TestNodes.cpuNode(4), true));
        processor.publish(new MeshEvent.NodeLeft(nodeB, "shutdown"));
        AssetId asset = AssetId.random(ResourceType.CPU);
        processor.publish(new MeshEvent.MigrationStarted(asset, nodeA, nodeB));
        processor.publish(new MeshEvent.MigrationFailed(asset, "boom"));
        processor.publish(new MeshEvent.RebalanceRequested(asset, nodeA, nodeB));
        processor.publish(new MeshEvent.PartitionHealed("p-1"));

        assertEquals(9, processor.processPending());

        MeshMetricsSnapshot metrics = processor.getMetrics();
        assertEquals(1, metrics.totalNodes());
        assertEquals(1, metrics.healthyNodes());
        assertEquals(1, metrics.failedNodes());
        assertEquals(1, metrics.migrationsStarted());
        assertEquals(0, metrics.successfulMigrations());
        assertEquals(1, metrics.failedMigrations());
        assertEquals(1, metrics.rebalanceRequests());
        assertEquals(1, metrics.partitionsHealed());
        assertEquals(9, metrics.eventsProcessed());
    }

    @Test
    void testCountersNeverGoNegative() {
        processor.publish(new MeshEvent.NodeLeft(nodeA, "unknown"));
        processor.publish(new MeshEvent.NodeFailed(nodeB, Instant.EPOCH));
        processor.processPending();

        assertEquals(0, processor.getMetrics().totalNodes());
        assertEquals(0, processor.getMetrics().healthyNodes());
    }

    @Test
    void testReactionsRunBeforeSubscribersInPublishOrder() {
        List<String> seen = new ArrayList<>();
        processor.addReaction(e -> seen.add("reaction:" + e.type()));
        processor.subscribe(e -> seen.add("subscriber:" + e.type()));

        processor.publish(new MeshEvent.NodeJoined(nodeA, TestNodes.cpuNode(4), false));
        processor.publish(new MeshEvent.NodeLeft(nodeA, "bye"));
        processor.processPending();

        assertEquals(
                List.of(
                        "reaction:NodeJoined",
                        "subscriber:NodeJoined",
                        "reaction:NodeLeft",
                        "subscriber:NodeLeft"),
                seen);
    }

    @Test
    void testEventsPublishedByReactionsAreProcessed() {
        processor.addReaction(e -> {
            if (e instanceof MeshEvent.NodeFailed failed) {
                processor.publish(new MeshEvent.NodeLeft(failed.node(), "evicted"));
            }
        });

        processor.publish(new MeshEvent.NodeFailed(nodeA, Instant.EPOCH));

        assertEquals(2, processor.processPending());
    }

    @Test
    void testFailingSubscriberDoesNotStopOthers() {
        List<MeshEvent> received = new ArrayList<>();
        processor.subscribe(e -> {
            throw new IllegalStateException("broken subscriber");
        });
        processor.subscribe(received::add);

        processor.publish(new MeshEvent.PartitionHealed("p-1"));
        processor.processPending();

        assertEquals(1, received.size());
        assertEquals(1, processor.getMetrics().eventsProcessed());
    }

    @Test
    void testUnsubscribe() {
        Consumer<MeshEvent> subscriber = e -> {};
        processor.subscribe(subscriber);
        processor.subscribe(null);
        assertEquals(1, processor.getSubscriberCount());

        assertTrue(processor.unsubscribe(subscriber));
        assertEquals(0, processor.getSubscriberCount());
    }

    @Test
    void testConsumerThreadDrainsQueue() throws InterruptedException {
        List<MeshEvent> received = Collections.synchronizedList(new ArrayList<>());
        processor.subscribe(received::add);
        processor.start();
        assertTrue(processor.isRunning());
        assertThrows(IllegalStateException.class, () -> processor.processPending());

        for (int i = 0; i < 50; i++) {
            processor.publish(new MeshEvent.PartitionHealed("p-" + i));
        }

        assertTrue(processor.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(50, received.size());
        assertEquals(new MeshEvent.PartitionHealed("p-0"), received.get(0));
        assertEquals(new MeshEvent.PartitionHealed("p-49"), received.get(49));
    }

    @Test
    void testPublishAfterShutdownFails() {
        processor.start();
        processor.shutdown(Duration.ofSeconds(2));

        assertFalse(processor.isRunning());
        NetworkException ex = assertThrows(
                NetworkException.class, () -> processor.publish(new MeshEvent.PartitionHealed("late")));
        assertTrue(ex.getMessage().startsWith("Event channel closed"));
    }
}
