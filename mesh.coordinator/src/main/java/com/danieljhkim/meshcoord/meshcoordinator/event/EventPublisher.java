package com.danieljhkim.meshcoord.meshcoordinator.event;

/**
 * Sink the detectors, balancer and migrator publish into.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * @throws com.danieljhkim.meshcoord.meshcommon.exception.NetworkException if the event channel is closed
     */
    void publish(MeshEvent event);
}
