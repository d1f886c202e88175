package com.danieljhkim.meshcoord.meshcoordinator.migration;

import java.time.Instant;

/**
 * Archived outcome of a finished migration (COMPLETED or FAILED).
 */
public record MigrationRecord(
        MigrationPlan plan, MigrationState finalState, long bytesTransferred, String error, Instant finishedAt) {

    static MigrationRecord of(MigrationStatus status) {
        return new MigrationRecord(
                status.plan(), status.state(), status.bytesTransferred(), status.error(), status.updatedAt());
    }
}
