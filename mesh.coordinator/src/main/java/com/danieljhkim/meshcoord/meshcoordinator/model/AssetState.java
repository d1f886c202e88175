package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * Lifecycle of an allocation as seen by one observer.
 */
public enum AssetState {
    ALLOCATED,
    RUNNING,
    SUSPENDED,
    MIGRATING,
    RELEASED
}
