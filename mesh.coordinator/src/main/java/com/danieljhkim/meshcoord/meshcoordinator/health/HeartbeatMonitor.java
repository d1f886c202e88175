package com.danieljhkim.meshcoord.meshcoordinator.health;

import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeStatus;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Timeout-based failure detector. A node whose last heartbeat is older than the failure timeout is marked FAILED and
 * one {@link MeshEvent.NodeFailed} is published; scanning a node that is already FAILED does nothing.
 */
@Slf4j
public class HeartbeatMonitor {

    private final NodeRegistry registry;
    private final EventPublisher publisher;
    private final Duration failureTimeout;
    private final Clock clock;

    public HeartbeatMonitor(NodeRegistry registry, EventPublisher publisher, Duration failureTimeout, Clock clock) {
        this.registry = registry;
        this.publisher = publisher;
        this.failureTimeout = failureTimeout;
        this.clock = clock;
    }

    /**
     * One complete tick.
     *
     * @return nodes marked FAILED by this scan
     */
    public List<NodeId> scan() {
        Instant now = clock.instant();
        List<NodeId> failed = new ArrayList<>();
        for (NodeInfo node : registry.snapshot().nodes()) {
            if (node.status() == NodeStatus.FAILED || !isStale(node, now)) {
                continue;
            }
            // re-checked under the registry lock; a heartbeat may have arrived since the snapshot
            boolean marked = registry.transitionIf(
                    node.nodeId(), info -> info.status() != NodeStatus.FAILED && isStale(info, now), NodeStatus.FAILED);
            if (marked) {
                log.warn("Node {} missed heartbeats since {}, marking FAILED", node.nodeId(), node.lastHeartbeat());
                failed.add(node.nodeId());
                publisher.publish(new MeshEvent.NodeFailed(node.nodeId(), now));
            }
        }
        if (!failed.isEmpty()) {
            log.info("Heartbeat scan failed {} node(s)", failed.size());
        }
        return failed;
    }

    private boolean isStale(NodeInfo node, Instant now) {
        return Duration.between(node.lastHeartbeat(), now).compareTo(failureTimeout) > 0;
    }
}
