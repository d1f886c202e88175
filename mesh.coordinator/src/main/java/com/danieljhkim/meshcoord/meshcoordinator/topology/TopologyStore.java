package com.danieljhkim.meshcoord.meshcoordinator.topology;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Partition history plus pairwise latency and bandwidth measurements. Each structure has its own lock.
 */
public class TopologyStore {

    private final List<NetworkPartition> partitions = new ArrayList<>();
    private final ReadWriteLock partitionLock = new ReentrantReadWriteLock();

    private final Map<NodeLink, Duration> latency = new HashMap<>();
    private final Map<NodeLink, Long> bandwidth = new HashMap<>();
    private final ReadWriteLock linkLock = new ReentrantReadWriteLock();

    public void addPartition(NetworkPartition partition) {
        partitionLock.writeLock().lock();
        try {
            partitions.add(partition);
        } finally {
            partitionLock.writeLock().unlock();
        }
    }

    /**
     * All partitions ever recorded, healed ones included, in detection order.
     */
    public List<NetworkPartition> getPartitions() {
        partitionLock.readLock().lock();
        try {
            return List.copyOf(partitions);
        } finally {
            partitionLock.readLock().unlock();
        }
    }

    public List<NetworkPartition> getOpenPartitions() {
        return getPartitions().stream().filter(p -> !p.isHealed()).toList();
    }

    public Optional<NetworkPartition> findPartition(String partitionId) {
        return getPartitions().stream()
                .filter(p -> p.getPartitionId().equals(partitionId))
                .findFirst();
    }

    public void recordLink(NodeId from, NodeId to, Duration latencyValue, long bandwidthMbps) {
        NodeLink link = new NodeLink(from, to);
        linkLock.writeLock().lock();
        try {
            if (latencyValue != null) {
                latency.put(link, latencyValue);
            }
            if (bandwidthMbps >= 0) {
                bandwidth.put(link, bandwidthMbps);
            }
        } finally {
            linkLock.writeLock().unlock();
        }
    }

    /**
     * Drops every measurement involving a node (called when it leaves).
     */
    public void forgetNode(NodeId node) {
        linkLock.writeLock().lock();
        try {
            latency.keySet().removeIf(l -> l.from().equals(node) || l.to().equals(node));
            bandwidth.keySet().removeIf(l -> l.from().equals(node) || l.to().equals(node));
        } finally {
            linkLock.writeLock().unlock();
        }
    }

    public Map<NodeLink, Duration> getLatencyMatrix() {
        linkLock.readLock().lock();
        try {
            return Map.copyOf(latency);
        } finally {
            linkLock.readLock().unlock();
        }
    }

    public Map<NodeLink, Long> getBandwidthMatrix() {
        linkLock.readLock().lock();
        try {
            return Map.copyOf(bandwidth);
        } finally {
            linkLock.readLock().unlock();
        }
    }
}
