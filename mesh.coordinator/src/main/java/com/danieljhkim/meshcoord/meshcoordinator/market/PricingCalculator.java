package com.danieljhkim.meshcoord.meshcoordinator.market;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Prices agreements and usage.
 *
 * <ul>
 *   <li>FIXED: rate x amount x hours</li>
 *   <li>DYNAMIC: FIXED x demand factor, the factor being open requests over open offers for the resource type,
 *       clamped to [1, max]</li>
 *   <li>USAGE_BASED: FIXED x usage discount (0.8 by default)</li>
 * </ul>
 */
public class PricingCalculator {

    static final int PRICE_SCALE = 8;
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private final BigDecimal maxDemandFactor;
    private final BigDecimal usageDiscount;

    public PricingCalculator(double maxDemandFactor, double usageDiscount) {
        if (maxDemandFactor < 1.0) {
            throw new IllegalArgumentException("maxDemandFactor must be >= 1");
        }
        this.maxDemandFactor = BigDecimal.valueOf(maxDemandFactor);
        this.usageDiscount = BigDecimal.valueOf(usageDiscount);
    }

    public PricingCalculator() {
        this(3.0, 0.8);
    }

    public BigDecimal fixed(BigDecimal rate, BigDecimal amount, Duration duration) {
        BigDecimal hours = BigDecimal.valueOf(duration.toMillis())
                .divide(SECONDS_PER_HOUR.multiply(BigDecimal.valueOf(1000)), MathContext.DECIMAL64);
        return rate.multiply(amount).multiply(hours).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * @param demandFactor only used for {@link PricingModel#DYNAMIC}
     */
    public BigDecimal price(
            PricingModel model, BigDecimal rate, BigDecimal amount, Duration duration, BigDecimal demandFactor) {
        BigDecimal base = fixed(rate, amount, duration);
        switch (model) {
            case DYNAMIC:
                return base.multiply(demandFactor).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN);
            case USAGE_BASED:
                return base.multiply(usageDiscount).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN);
            case FIXED:
            default:
                return base;
        }
    }

    /**
     * Open requests over open offers, clamped to [1, max]. No offers at all means maximum demand.
     */
    public BigDecimal demandFactor(long openRequests, long openOffers) {
        if (openOffers <= 0) {
            return openRequests > 0 ? maxDemandFactor : BigDecimal.ONE;
        }
        BigDecimal ratio = BigDecimal.valueOf(openRequests).divide(BigDecimal.valueOf(openOffers), MathContext.DECIMAL64);
        return ratio.max(BigDecimal.ONE).min(maxDemandFactor);
    }
}
