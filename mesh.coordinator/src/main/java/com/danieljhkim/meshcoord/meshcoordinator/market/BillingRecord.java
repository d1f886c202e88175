package com.danieljhkim.meshcoord.meshcoordinator.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * One usage entry charged against an agreement.
 */
public record BillingRecord(
        String agreementId, BigDecimal usageAmount, Duration period, BigDecimal charge, Instant recordedAt) {}
