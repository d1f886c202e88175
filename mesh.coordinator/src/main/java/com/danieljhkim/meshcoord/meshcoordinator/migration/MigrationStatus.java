package com.danieljhkim.meshcoord.meshcoordinator.migration;

import com.danieljhkim.meshcoord.meshcommon.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of one plan. Immutable; every step produces a new status.
 *
 * @param progress percentage in [0, 100]
 * @param error    failure message, {@code null} unless FAILED
 */
public record MigrationStatus(
        MigrationPlan plan, MigrationState state, int progress, long bytesTransferred, String error, Instant updatedAt) {

    public MigrationStatus {
        Objects.requireNonNull(plan, "plan cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within [0, 100]");
        }
    }

    public static MigrationStatus pending(MigrationPlan plan) {
        return new MigrationStatus(plan, MigrationState.PENDING, 0, 0, null, plan.createdAt());
    }

    /**
     * @throws InvalidStateTransitionException if {@code next} is not reachable from the current state
     */
    public MigrationStatus advance(MigrationState next, int newProgress, Instant now) {
        requireTransition(next);
        return new MigrationStatus(plan, next, newProgress, bytesTransferred, error, now);
    }

    public MigrationStatus withBytesTransferred(long bytes, Instant now) {
        return new MigrationStatus(plan, state, progress, bytes, error, now);
    }

    public MigrationStatus fail(String message, Instant now) {
        requireTransition(MigrationState.FAILED);
        return new MigrationStatus(plan, MigrationState.FAILED, progress, bytesTransferred, message, now);
    }

    public MigrationStatus cancel(Instant now) {
        requireTransition(MigrationState.CANCELLED);
        return new MigrationStatus(plan, MigrationState.CANCELLED, progress, bytesTransferred, error, now);
    }

    private void requireTransition(MigrationState next) {
        if (!state.canTransitionTo(next)) {
            throw new InvalidStateTransitionException("migration of " + plan.assetId(), state, next);
        }
    }
}
