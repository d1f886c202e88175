package com.danieljhkim.meshcoord.meshcoordinator.market;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A consumer's request for capacity.
 *
 * @param maxPrice         highest acceptable rate per unit-hour
 * @param minServiceLevel  weakest acceptable service level
 */
public record ResourceRequest(
        String requestId,
        NodeId consumer,
        ResourceType resourceType,
        BigDecimal amount,
        BigDecimal maxPrice,
        Duration duration,
        ServiceLevelAgreement minServiceLevel,
        Instant validUntil) {

    public ResourceRequest {
        Objects.requireNonNull(requestId, "requestId cannot be null");
        Objects.requireNonNull(consumer, "consumer cannot be null");
        Objects.requireNonNull(resourceType, "resourceType cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
        Objects.requireNonNull(maxPrice, "maxPrice cannot be null");
        Objects.requireNonNull(duration, "duration cannot be null");
        Objects.requireNonNull(validUntil, "validUntil cannot be null");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (maxPrice.signum() < 0) {
            throw new IllegalArgumentException("maxPrice cannot be negative");
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive");
        }
        if (minServiceLevel == null) {
            minServiceLevel = ServiceLevelAgreement.BEST_EFFORT;
        }
    }

    public static ResourceRequest of(
            NodeId consumer,
            ResourceType type,
            BigDecimal amount,
            BigDecimal maxPrice,
            Duration duration,
            Instant validUntil) {
        return new ResourceRequest(
                UUID.randomUUID().toString(),
                consumer,
                type,
                amount,
                maxPrice,
                duration,
                ServiceLevelAgreement.BEST_EFFORT,
                validUntil);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(validUntil);
    }
}
