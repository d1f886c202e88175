package com.danieljhkim.meshcoord.meshcoordinator.allocation;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;

/**
 * Selector result: the chosen node and its placement score.
 */
public record ScoredNode(NodeInfo node, double score) {}
