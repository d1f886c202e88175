package com.danieljhkim.meshcoord.meshcoordinator.topology;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.util.Objects;

/**
 * Directed pair of nodes used as a key in the latency and bandwidth matrices.
 */
public record NodeLink(NodeId from, NodeId to) {

    public NodeLink {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
    }
}
