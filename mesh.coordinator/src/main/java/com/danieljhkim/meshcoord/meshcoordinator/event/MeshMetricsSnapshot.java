package com.danieljhkim.meshcoord.meshcoordinator.event;

/**
 * Fleet-wide counters at one point in the event stream.
 */
public record MeshMetricsSnapshot(
        long totalNodes,
        long healthyNodes,
        long failedNodes,
        long partitionsDetected,
        long partitionsHealed,
        long migrationsStarted,
        long successfulMigrations,
        long failedMigrations,
        long byzantineNodesDetected,
        long rebalanceRequests,
        long eventsProcessed) {}
