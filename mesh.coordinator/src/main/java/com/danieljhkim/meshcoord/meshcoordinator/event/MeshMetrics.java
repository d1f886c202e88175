package com.danieljhkim.meshcoord.meshcoordinator.event;

/**
 * Counters derived from the event stream. Only the event consumer calls {@link #apply(MeshEvent)}; other threads read
 * through {@link #snapshot()}.
 */
public class MeshMetrics {

    private long totalNodes;
    private long healthyNodes;
    private long failedNodes;
    private long partitionsDetected;
    private long partitionsHealed;
    private long migrationsStarted;
    private long successfulMigrations;
    private long failedMigrations;
    private long byzantineNodesDetected;
    private long rebalanceRequests;
    private long eventsProcessed;

    synchronized void apply(MeshEvent event) {
        if (event instanceof MeshEvent.NodeJoined joined) {
            if (!joined.rejoined()) {
                totalNodes++;
            }
            healthyNodes++;
        } else if (event instanceof MeshEvent.NodeLeft) {
            totalNodes = decrement(totalNodes);
            healthyNodes = decrement(healthyNodes);
        } else if (event instanceof MeshEvent.NodeFailed) {
            healthyNodes = decrement(healthyNodes);
            failedNodes++;
        } else if (event instanceof MeshEvent.PartitionDetected) {
            partitionsDetected++;
        } else if (event instanceof MeshEvent.PartitionHealed) {
            partitionsHealed++;
        } else if (event instanceof MeshEvent.MigrationStarted) {
            migrationsStarted++;
        } else if (event instanceof MeshEvent.MigrationCompleted) {
            successfulMigrations++;
        } else if (event instanceof MeshEvent.MigrationFailed) {
            failedMigrations++;
        } else if (event instanceof MeshEvent.ByzantineDetected) {
            byzantineNodesDetected++;
        } else if (event instanceof MeshEvent.RebalanceRequested) {
            rebalanceRequests++;
        }
        eventsProcessed++;
    }

    public synchronized MeshMetricsSnapshot snapshot() {
        return new MeshMetricsSnapshot(
                totalNodes,
                healthyNodes,
                failedNodes,
                partitionsDetected,
                partitionsHealed,
                migrationsStarted,
                successfulMigrations,
                failedMigrations,
                byzantineNodesDetected,
                rebalanceRequests,
                eventsProcessed);
    }

    private static long decrement(long value) {
        return value > 0 ? value - 1 : 0;
    }
}
