package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Objects;

/**
 * Identity and capacity of the node this coordinator runs on.
 */
public record LocalNode(NodeId nodeId, NodeCapabilities capabilities, NodeLocation location) {

    public LocalNode {
        Objects.requireNonNull(nodeId, "nodeId cannot be null");
        Objects.requireNonNull(capabilities, "capabilities cannot be null");
        if (location == null) {
            location = NodeLocation.unknown();
        }
    }
}
