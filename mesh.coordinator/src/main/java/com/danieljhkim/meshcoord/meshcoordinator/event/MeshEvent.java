package com.danieljhkim.meshcoord.meshcoordinator.event;

import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ByzantineEvidence;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkPartition;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Membership, partition, migration and Byzantine events. All of them flow through the single {@link EventProcessor}
 * queue, which gives them a total order.
 */
public sealed interface MeshEvent
        permits MeshEvent.NodeJoined,
                MeshEvent.NodeLeft,
                MeshEvent.NodeFailed,
                MeshEvent.PartitionDetected,
                MeshEvent.PartitionHealed,
                MeshEvent.MigrationStarted,
                MeshEvent.MigrationCompleted,
                MeshEvent.MigrationFailed,
                MeshEvent.ByzantineDetected,
                MeshEvent.RebalanceRequested {

    /**
     * Returns a human-readable description of this event.
     */
    String describe();

    default String type() {
        return getClass().getSimpleName();
    }

    // ============================
    // Membership
    // ============================

    /**
     * @param rejoined true when the node was already known (for example after a failure)
     */
    record NodeJoined(NodeId node, NodeCapabilities capabilities, boolean rejoined) implements MeshEvent {
        public NodeJoined {
            Objects.requireNonNull(node, "node cannot be null");
        }

        @Override
        public String describe() {
            return "NodeJoined(node=" + node + ", rejoined=" + rejoined + ")";
        }
    }

    record NodeLeft(NodeId node, String reason) implements MeshEvent {
        public NodeLeft {
            Objects.requireNonNull(node, "node cannot be null");
        }

        @Override
        public String describe() {
            return "NodeLeft(node=" + node + ", reason=" + reason + ")";
        }
    }

    record NodeFailed(NodeId node, Instant time) implements MeshEvent {
        public NodeFailed {
            Objects.requireNonNull(node, "node cannot be null");
            Objects.requireNonNull(time, "time cannot be null");
        }

        @Override
        public String describe() {
            return "NodeFailed(node=" + node + ", time=" + time + ")";
        }
    }

    // ============================
    // Partitions
    // ============================

    record PartitionDetected(NetworkPartition partition) implements MeshEvent {
        public PartitionDetected {
            Objects.requireNonNull(partition, "partition cannot be null");
        }

        @Override
        public String describe() {
            return "PartitionDetected(id=" + partition.getPartitionId() + ", nodes=" + partition.getNodes() + ")";
        }
    }

    record PartitionHealed(String partitionId) implements MeshEvent {
        public PartitionHealed {
            Objects.requireNonNull(partitionId, "partitionId cannot be null");
        }

        @Override
        public String describe() {
            return "PartitionHealed(id=" + partitionId + ")";
        }
    }

    // ============================
    // Migrations
    // ============================

    record MigrationStarted(AssetId assetId, NodeId from, NodeId to) implements MeshEvent {
        public MigrationStarted {
            Objects.requireNonNull(assetId, "assetId cannot be null");
        }

        @Override
        public String describe() {
            return "MigrationStarted(asset=" + assetId + ", from=" + from + ", to=" + to + ")";
        }
    }

    record MigrationCompleted(AssetId assetId, NodeId newNode) implements MeshEvent {
        public MigrationCompleted {
            Objects.requireNonNull(assetId, "assetId cannot be null");
        }

        @Override
        public String describe() {
            return "MigrationCompleted(asset=" + assetId + ", newNode=" + newNode + ")";
        }
    }

    record MigrationFailed(AssetId assetId, String error) implements MeshEvent {
        public MigrationFailed {
            Objects.requireNonNull(assetId, "assetId cannot be null");
        }

        @Override
        public String describe() {
            return "MigrationFailed(asset=" + assetId + ", error=" + error + ")";
        }
    }

    /**
     * Move proposed by the load balancer; executed by the event processor's reaction.
     */
    record RebalanceRequested(AssetId assetId, NodeId from, NodeId to) implements MeshEvent {
        public RebalanceRequested {
            Objects.requireNonNull(assetId, "assetId cannot be null");
            Objects.requireNonNull(to, "to cannot be null");
        }

        @Override
        public String describe() {
            return "RebalanceRequested(asset=" + assetId + ", from=" + from + ", to=" + to + ")";
        }
    }

    // ============================
    // Byzantine
    // ============================

    record ByzantineDetected(NodeId node, List<ByzantineEvidence> evidence) implements MeshEvent {
        public ByzantineDetected {
            Objects.requireNonNull(node, "node cannot be null");
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
        }

        @Override
        public String describe() {
            return "ByzantineDetected(node=" + node + ", evidence=" + evidence.size() + ")";
        }
    }
}
