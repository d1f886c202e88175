package com.danieljhkim.meshcoord.meshcoordinator.market;

import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A provider's standing offer.
 *
 * @param amount        units still available (cores, bytes, ...)
 * @param price         quoted rate per unit-hour
 * @param minCommitment shortest duration accepted, {@code null} for no bound
 * @param maxCommitment longest duration accepted, {@code null} for no bound
 */
public record ResourceOffer(
        String offerId,
        NodeId provider,
        ResourceType resourceType,
        BigDecimal amount,
        BigDecimal price,
        PricingModel pricingModel,
        Duration minCommitment,
        Duration maxCommitment,
        ServiceLevelAgreement serviceLevel,
        Instant validUntil) {

    public ResourceOffer {
        Objects.requireNonNull(offerId, "offerId cannot be null");
        Objects.requireNonNull(provider, "provider cannot be null");
        Objects.requireNonNull(resourceType, "resourceType cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
        Objects.requireNonNull(price, "price cannot be null");
        Objects.requireNonNull(validUntil, "validUntil cannot be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be negative");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
        if (pricingModel == null) {
            pricingModel = PricingModel.FIXED;
        }
        if (serviceLevel == null) {
            serviceLevel = ServiceLevelAgreement.BEST_EFFORT;
        }
    }

    /**
     * Fixed-price offer with no commitment bounds and best-effort service.
     */
    public static ResourceOffer of(
            NodeId provider, ResourceType type, BigDecimal amount, BigDecimal price, Instant validUntil) {
        return new ResourceOffer(
                UUID.randomUUID().toString(),
                provider,
                type,
                amount,
                price,
                PricingModel.FIXED,
                null,
                null,
                ServiceLevelAgreement.BEST_EFFORT,
                validUntil);
    }

    public ResourceOffer withAmount(BigDecimal remaining) {
        return new ResourceOffer(
                offerId,
                provider,
                resourceType,
                remaining,
                price,
                pricingModel,
                minCommitment,
                maxCommitment,
                serviceLevel,
                validUntil);
    }

    public ResourceOffer withPricingModel(PricingModel model) {
        return new ResourceOffer(
                offerId,
                provider,
                resourceType,
                amount,
                price,
                model,
                minCommitment,
                maxCommitment,
                serviceLevel,
                validUntil);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(validUntil);
    }

    public boolean acceptsDuration(Duration duration) {
        return (minCommitment == null || duration.compareTo(minCommitment) >= 0)
                && (maxCommitment == null || duration.compareTo(maxCommitment) <= 0);
    }
}
