package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Hardware security and acceleration features advertised by a node.
 */
public record HardwareFeatures(
        boolean sgxEnabled,
        boolean sevEnabled,
        boolean tpmAvailable,
        boolean hwRng,
        boolean nvmeStorage,
        boolean rdmaCapable,
        boolean sriovEnabled) {

    public static HardwareFeatures none() {
        return new HardwareFeatures(false, false, false, false, false, false, false);
    }
}
