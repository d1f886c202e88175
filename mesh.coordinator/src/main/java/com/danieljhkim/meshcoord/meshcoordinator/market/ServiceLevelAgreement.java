package com.danieljhkim.meshcoord.meshcoordinator.market;

import java.time.Duration;
import java.util.Objects;

/**
 * Performance bounds attached to an offer, or required by a request.
 *
 * @param minUptime        fraction in [0, 1]
 * @param maxResponseTime  worst acceptable response time
 * @param minBandwidthMbps guaranteed bandwidth
 */
public record ServiceLevelAgreement(double minUptime, Duration maxResponseTime, long minBandwidthMbps) {

    public static final ServiceLevelAgreement BEST_EFFORT =
            new ServiceLevelAgreement(0.0, Duration.ofDays(365), 0);

    public ServiceLevelAgreement {
        if (minUptime < 0 || minUptime > 1) {
            throw new IllegalArgumentException("minUptime must be within [0, 1]");
        }
        Objects.requireNonNull(maxResponseTime, "maxResponseTime cannot be null");
        if (minBandwidthMbps < 0) {
            throw new IllegalArgumentException("minBandwidthMbps cannot be negative");
        }
    }

    /**
     * Whether this (offered) level is at least as good as {@code required} on every bound.
     */
    public boolean satisfies(ServiceLevelAgreement required) {
        return minUptime >= required.minUptime
                && maxResponseTime.compareTo(required.maxResponseTime) <= 0
                && minBandwidthMbps >= required.minBandwidthMbps;
    }
}
