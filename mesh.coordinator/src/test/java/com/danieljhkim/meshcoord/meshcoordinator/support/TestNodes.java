package com.danieljhkim.meshcoord.meshcoordinator.support;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;

import java.util.EnumSet;

/**
 * Deterministic node fixtures.
 */
public final class TestNodes {

    public static final long GIB = 1024L * 1024 * 1024;

    private TestNodes() {}

    public static NodeId nodeId(String name) {
        return NodeId.fromName(name, name + ":9400");
    }

    public static NodeId nodeId(String name, double trust) {
        return NodeId.fromName(name, name + ":9400", trust);
    }

    public static NodeCapabilities cpuNode(int cores) {
        return NodeCapabilities.of(cores, 16 * GIB, 100 * GIB, 1000, EnumSet.of(ResourceType.CPU));
    }

    public static NodeCapabilities capabilities(int cores, ResourceType first, ResourceType... rest) {
        return NodeCapabilities.of(cores, 16 * GIB, 100 * GIB, 1000, EnumSet.of(first, rest));
    }
}
