package com.danieljhkim.meshcoord.meshcoordinator.state;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;

import java.time.Instant;

/**
 * Archive entry for a node that left the mesh voluntarily.
 */
public record DepartedNode(NodeInfo lastKnown, String reason, Instant leftAt) {}
