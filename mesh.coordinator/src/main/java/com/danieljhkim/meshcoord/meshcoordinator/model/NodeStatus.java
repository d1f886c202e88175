package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Membership status of a node. Legal moves are listed in {@link #allowedTransitions()}; a FAILED node only comes back
 * through an explicit join, which creates a fresh record.
 */
public enum NodeStatus {
    ACTIVE,
    DEGRADED,
    MAINTENANCE,
    SUSPECTED,
    FAILED,
    PARTITIONED;

    private static final Map<NodeStatus, Set<NodeStatus>> TRANSITIONS = new EnumMap<>(NodeStatus.class);

    static {
        TRANSITIONS.put(ACTIVE, EnumSet.of(DEGRADED, MAINTENANCE, SUSPECTED, FAILED, PARTITIONED));
        TRANSITIONS.put(DEGRADED, EnumSet.of(ACTIVE, MAINTENANCE, SUSPECTED, FAILED, PARTITIONED));
        TRANSITIONS.put(MAINTENANCE, EnumSet.of(ACTIVE, FAILED));
        TRANSITIONS.put(SUSPECTED, EnumSet.of(ACTIVE, FAILED));
        TRANSITIONS.put(PARTITIONED, EnumSet.of(ACTIVE, FAILED));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(NodeStatus.class));
    }

    public Set<NodeStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(NodeStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /**
     * Whether the node can be reached for coordination (scored, probed, migrated to or from).
     */
    public boolean isReachable() {
        return this == ACTIVE || this == DEGRADED;
    }
}
