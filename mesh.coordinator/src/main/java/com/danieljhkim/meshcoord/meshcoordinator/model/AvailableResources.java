package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Currently free capacity on a node. Every dimension stays within [0, capability].
 */
public record AvailableResources(
        double cpuCores, long memoryBytes, int gpuUnits, long storageBytes, long bandwidthMbps) {

    public AvailableResources {
        if (cpuCores < 0 || memoryBytes < 0 || gpuUnits < 0 || storageBytes < 0 || bandwidthMbps < 0) {
            throw new IllegalArgumentException("available resources cannot be negative");
        }
    }

    /**
     * Everything free.
     */
    public static AvailableResources full(NodeCapabilities capabilities) {
        return new AvailableResources(
                capabilities.cpuCores(),
                capabilities.memoryBytes(),
                capabilities.gpuDevices(),
                capabilities.storageBytes(),
                capabilities.bandwidthMbps());
    }

    public boolean fitsWithin(NodeCapabilities capabilities) {
        return cpuCores <= capabilities.cpuCores()
                && memoryBytes <= capabilities.memoryBytes()
                && gpuUnits <= capabilities.gpuDevices()
                && storageBytes <= capabilities.storageBytes()
                && bandwidthMbps <= capabilities.bandwidthMbps();
    }

    /**
     * Caps each dimension at the matching capability.
     */
    public AvailableResources clampTo(NodeCapabilities capabilities) {
        return new AvailableResources(
                Math.min(cpuCores, capabilities.cpuCores()),
                Math.min(memoryBytes, capabilities.memoryBytes()),
                Math.min(gpuUnits, capabilities.gpuDevices()),
                Math.min(storageBytes, capabilities.storageBytes()),
                Math.min(bandwidthMbps, capabilities.bandwidthMbps()));
    }

    public boolean canSatisfy(ResourceDemand demand) {
        return cpuCores >= demand.cpuCores()
                && memoryBytes >= demand.memoryBytes()
                && gpuUnits >= demand.gpuUnits()
                && storageBytes >= demand.storageBytes()
                && bandwidthMbps >= demand.bandwidthMbps();
    }

    /**
     * Subtracts a demand. Callers check {@link #canSatisfy} first.
     */
    public AvailableResources minus(ResourceDemand demand) {
        if (!canSatisfy(demand)) {
            throw new IllegalArgumentException("demand " + demand + " exceeds available " + this);
        }
        return new AvailableResources(
                cpuCores - demand.cpuCores(),
                memoryBytes - demand.memoryBytes(),
                gpuUnits - demand.gpuUnits(),
                storageBytes - demand.storageBytes(),
                bandwidthMbps - demand.bandwidthMbps());
    }

    /**
     * Returns a demand to the pool without exceeding capabilities.
     */
    public AvailableResources plus(ResourceDemand demand, NodeCapabilities capabilities) {
        return new AvailableResources(
                        cpuCores + demand.cpuCores(),
                        memoryBytes + demand.memoryBytes(),
                        gpuUnits + demand.gpuUnits(),
                        storageBytes + demand.storageBytes(),
                        bandwidthMbps + demand.bandwidthMbps())
                .clampTo(capabilities);
    }
}
