package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Capacity an allocation holds on its primary node.
 */
public record ResourceDemand(
        double cpuCores, long memoryBytes, int gpuUnits, long storageBytes, long bandwidthMbps) {

    public static final ResourceDemand NONE = new ResourceDemand(0, 0, 0, 0, 0);

    public ResourceDemand {
        if (cpuCores < 0 || memoryBytes < 0 || gpuUnits < 0 || storageBytes < 0 || bandwidthMbps < 0) {
            throw new IllegalArgumentException("demand cannot be negative");
        }
    }

    public static ResourceDemand cpu(double cores) {
        return new ResourceDemand(cores, 0, 0, 0, 0);
    }

    public boolean isEmpty() {
        return cpuCores == 0 && memoryBytes == 0 && gpuUnits == 0 && storageBytes == 0 && bandwidthMbps == 0;
    }

    /**
     * Bytes that a migration has to move for this allocation.
     */
    public long footprintBytes() {
        return memoryBytes + storageBytes;
    }
}
