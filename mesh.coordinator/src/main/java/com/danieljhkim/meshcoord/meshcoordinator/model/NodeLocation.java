package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Geographic placement of a node.
 */
public record NodeLocation(
        String datacenter, String region, String country, double latitude, double longitude, String zone) {

    public static NodeLocation unknown() {
        return new NodeLocation("unknown", "unknown", "", 0.0, 0.0, "default");
    }
}
