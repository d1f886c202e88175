package com.danieljhkim.meshcoord.meshcoordinator.migration;

public enum MigrationStrategy {
    STOP_AND_COPY,
    LIVE,
    INCREMENTAL_SYNC,
    PARALLEL
}
