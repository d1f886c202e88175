package com.danieljhkim.meshcoord.meshcoordinator.topology;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the mesh: nodes, recorded partitions and measured link quality.
 */
public record NetworkTopology(
        Map<NodeId, NodeInfo> nodes,
        List<NetworkPartition> partitions,
        Map<NodeLink, Duration> latencyMatrix,
        Map<NodeLink, Long> bandwidthMatrix,
        Instant lastUpdated) {

    public NetworkTopology {
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        partitions = partitions == null ? List.of() : List.copyOf(partitions);
        latencyMatrix = latencyMatrix == null ? Map.of() : Map.copyOf(latencyMatrix);
        bandwidthMatrix = bandwidthMatrix == null ? Map.of() : Map.copyOf(bandwidthMatrix);
    }

    public List<NetworkPartition> openPartitions() {
        return partitions.stream().filter(p -> !p.isHealed()).toList();
    }
}
