package com.danieljhkim.meshcoord.meshcoordinator.market;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum AgreementStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED,
    DISPUTED;

    private static final Map<AgreementStatus, Set<AgreementStatus>> TRANSITIONS =
            new EnumMap<>(AgreementStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ACTIVE, CANCELLED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(COMPLETED, CANCELLED, DISPUTED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(AgreementStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(AgreementStatus.class));
        TRANSITIONS.put(DISPUTED, EnumSet.noneOf(AgreementStatus.class));
    }

    public Set<AgreementStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(AgreementStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
