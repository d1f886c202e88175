package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Total capacity a node contributes to the mesh.
 */
public record NodeCapabilities(
        int cpuCores,
        long memoryBytes,
        int gpuDevices,
        long storageBytes,
        long bandwidthMbps,
        Set<ResourceType> supportedResources,
        HardwareFeatures hardwareFeatures,
        List<String> softwareCapabilities) {

    public NodeCapabilities {
        if (cpuCores < 0 || memoryBytes < 0 || gpuDevices < 0 || storageBytes < 0 || bandwidthMbps < 0) {
            throw new IllegalArgumentException("capabilities cannot be negative");
        }
        supportedResources = supportedResources == null || supportedResources.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(supportedResources));
        if (hardwareFeatures == null) {
            hardwareFeatures = HardwareFeatures.none();
        }
        softwareCapabilities = softwareCapabilities == null ? List.of() : List.copyOf(softwareCapabilities);
    }

    /**
     * Compute-only capability set; convenient for nodes that do not advertise extras.
     */
    public static NodeCapabilities of(
            int cpuCores, long memoryBytes, long storageBytes, long bandwidthMbps, Set<ResourceType> supported) {
        return new NodeCapabilities(
                cpuCores, memoryBytes, 0, storageBytes, bandwidthMbps, supported, HardwareFeatures.none(), List.of());
    }

    public boolean supports(ResourceType type) {
        return supportedResources.contains(type);
    }
}
