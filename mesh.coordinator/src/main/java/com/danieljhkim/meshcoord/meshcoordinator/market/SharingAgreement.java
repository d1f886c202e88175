package com.danieljhkim.meshcoord.meshcoordinator.market;

import com.danieljhkim.meshcoord.meshcommon.exception.InvalidStateTransitionException;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Binding result of a match: the offer's rate and service level applied to the request's amount and duration.
 *
 * @param price        total price for the whole duration
 * @param rate         the offer's rate per unit-hour
 * @param demandFactor demand multiplier in force when the agreement was made (1 unless DYNAMIC)
 */
public record SharingAgreement(
        String agreementId,
        String offerId,
        String requestId,
        NodeId provider,
        NodeId consumer,
        ResourceType resourceType,
        BigDecimal amount,
        BigDecimal rate,
        BigDecimal price,
        PricingModel pricingModel,
        BigDecimal demandFactor,
        ServiceLevelAgreement serviceLevel,
        Instant startTime,
        Duration duration,
        AgreementStatus status) {

    /**
     * @throws InvalidStateTransitionException if the agreement status table forbids the move
     */
    public SharingAgreement transitionTo(AgreementStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateTransitionException("agreement " + agreementId, status, next);
        }
        return new SharingAgreement(
                agreementId,
                offerId,
                requestId,
                provider,
                consumer,
                resourceType,
                amount,
                rate,
                price,
                pricingModel,
                demandFactor,
                serviceLevel,
                startTime,
                duration,
                next);
    }

    public Instant endTime() {
        return startTime.plus(duration);
    }
}
