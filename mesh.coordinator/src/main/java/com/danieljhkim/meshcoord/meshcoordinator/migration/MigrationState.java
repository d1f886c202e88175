package com.danieljhkim.meshcoord.meshcoordinator.migration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Migration lifecycle. The happy path is strictly linear; FAILED and CANCELLED are reachable from every non-terminal
 * state.
 */
public enum MigrationState {
    PENDING,
    PREPARING,
    TRANSFERRING,
    VERIFYING,
    SWITCHING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<MigrationState, Set<MigrationState>> TRANSITIONS = new EnumMap<>(MigrationState.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PREPARING, FAILED, CANCELLED));
        TRANSITIONS.put(PREPARING, EnumSet.of(TRANSFERRING, FAILED, CANCELLED));
        TRANSITIONS.put(TRANSFERRING, EnumSet.of(VERIFYING, FAILED, CANCELLED));
        TRANSITIONS.put(VERIFYING, EnumSet.of(SWITCHING, FAILED, CANCELLED));
        TRANSITIONS.put(SWITCHING, EnumSet.of(COMPLETED, FAILED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(MigrationState.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(MigrationState.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(MigrationState.class));
    }

    public Set<MigrationState> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(MigrationState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
