package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Performance figures reported with a node's heartbeat. Utilizations and success rate are fractions in [0, 1].
 */
public record NodePerformanceMetrics(
        double cpuUtilization,
        double memoryUtilization,
        double avgResponseTimeMs,
        double successRate,
        long activeAssets,
        long dataProcessedBytes) {

    public NodePerformanceMetrics {
        if (cpuUtilization < 0 || cpuUtilization > 1 || memoryUtilization < 0 || memoryUtilization > 1) {
            throw new IllegalArgumentException("utilization must be within [0, 1]");
        }
        if (successRate < 0 || successRate > 1) {
            throw new IllegalArgumentException("successRate must be within [0, 1]");
        }
        if (avgResponseTimeMs < 0) {
            throw new IllegalArgumentException("avgResponseTimeMs cannot be negative");
        }
    }

    /**
     * Metrics assumed for a freshly joined node: idle and fully successful.
     */
    public static NodePerformanceMetrics initial() {
        return new NodePerformanceMetrics(0.0, 0.0, 0.0, 1.0, 0, 0);
    }

    /**
     * Combined load used by the load balancer.
     */
    public double combinedLoad() {
        return (cpuUtilization + memoryUtilization) / 2.0;
    }
}
