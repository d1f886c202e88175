package com.danieljhkim.meshcoord.meshcoordinator.market;

import com.danieljhkim.meshcoord.meshcommon.exception.InvalidRequestException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Matches sharing requests against offers and keeps the resulting agreements and their billing records.
 *
 * <p>
 * An offer and a request match when the resource types are equal, the request's max price is at least the offer's
 * rate, neither has expired, the offer still holds the requested amount, the offered service level satisfies the
 * requested one and the request's duration is within the offer's commitment bounds. Requests are served in submission
 * order, each against the cheapest matching offer (earliest on equal prices). A match removes the request, deducts the
 * amount from the offer and creates an ACTIVE agreement.
 *
 * <p>
 * Lock order: requests, then offers, then agreements.
 */
@Slf4j
public class ResourceSharingMarket {

    private final PricingCalculator pricing;
    private final Clock clock;

    private final List<ResourceRequest> requests = new ArrayList<>();
    private final ReadWriteLock requestLock = new ReentrantReadWriteLock();

    private final List<ResourceOffer> offers = new ArrayList<>();
    private final ReadWriteLock offerLock = new ReentrantReadWriteLock();

    private final Map<String, SharingAgreement> agreements = new LinkedHashMap<>();
    private final List<BillingRecord> billing = new ArrayList<>();
    private final ReadWriteLock agreementLock = new ReentrantReadWriteLock();

    public ResourceSharingMarket(PricingCalculator pricing, Clock clock) {
        this.pricing = pricing;
        this.clock = clock;
    }

    // ============================
    // Submission
    // ============================

    /**
     * Queues an offer and runs matching.
     *
     * @throws InvalidRequestException if the offer is empty or already expired
     */
    public void offerResources(ResourceOffer offer) {
        if (offer.amount().signum() <= 0) {
            throw new InvalidRequestException("offer amount must be positive");
        }
        if (offer.isExpired(clock.instant())) {
            throw new InvalidRequestException("offer " + offer.offerId() + " already expired");
        }
        offerLock.writeLock().lock();
        try {
            offers.add(offer);
        } finally {
            offerLock.writeLock().unlock();
        }
        log.debug(
                "Offer {} from {}: {} {} at {}",
                offer.offerId(),
                offer.provider(),
                offer.amount(),
                offer.resourceType(),
                offer.price());
        match();
    }

    /**
     * Queues a request and runs matching.
     *
     * @return the open offers the request could be served by at submission time
     * @throws InvalidRequestException if the request is already expired
     */
    public List<ResourceOffer> requestResources(ResourceRequest request) {
        Instant now = clock.instant();
        if (request.isExpired(now)) {
            throw new InvalidRequestException("request " + request.requestId() + " already expired");
        }
        List<ResourceOffer> candidates;
        requestLock.writeLock().lock();
        try {
            offerLock.readLock().lock();
            try {
                candidates = offers.stream().filter(o -> matches(o, request, now)).toList();
            } finally {
                offerLock.readLock().unlock();
            }
            requests.add(request);
        } finally {
            requestLock.writeLock().unlock();
        }
        log.debug(
                "Request {} from {}: {} {} up to {}",
                request.requestId(),
                request.consumer(),
                request.amount(),
                request.resourceType(),
                request.maxPrice());
        match();
        return candidates;
    }

    public void cancelOffer(String offerId) {
        offerLock.writeLock().lock();
        try {
            if (!offers.removeIf(o -> o.offerId().equals(offerId))) {
                throw new NotFoundException("offer " + offerId);
            }
        } finally {
            offerLock.writeLock().unlock();
        }
    }

    public void cancelRequest(String requestId) {
        requestLock.writeLock().lock();
        try {
            if (!requests.removeIf(r -> r.requestId().equals(requestId))) {
                throw new NotFoundException("request " + requestId);
            }
        } finally {
            requestLock.writeLock().unlock();
        }
    }

    // ============================
    // Matching
    // ============================

    /**
     * One matching pass over all open requests.
     *
     * @return agreements created by this pass
     */
    public List<SharingAgreement> match() {
        Instant now = clock.instant();
        List<SharingAgreement> created = new ArrayList<>();

        requestLock.writeLock().lock();
        try {
            offerLock.writeLock().lock();
            try {
                Iterator<ResourceRequest> it = requests.iterator();
                while (it.hasNext()) {
                    ResourceRequest request = it.next();
                    if (request.isExpired(now)) {
                        continue;
                    }
                    int offerIndex = cheapestMatch(request, now);
                    if (offerIndex < 0) {
                        continue;
                    }
                    ResourceOffer offer = offers.get(offerIndex);
                    BigDecimal demandFactor = pricing.demandFactor(
                            countOpenRequests(request, now), countOpenOffers(request, now));

                    it.remove();
                    BigDecimal remaining = offer.amount().subtract(request.amount());
                    if (remaining.signum() > 0) {
                        offers.set(offerIndex, offer.withAmount(remaining));
                    } else {
                        offers.remove(offerIndex);
                    }
                    created.add(createAgreement(offer, request, demandFactor, now));
                }
            } finally {
                offerLock.writeLock().unlock();
            }
        } finally {
            requestLock.writeLock().unlock();
        }

        if (!created.isEmpty()) {
            agreementLock.writeLock().lock();
            try {
                for (SharingAgreement agreement : created) {
                    agreements.put(agreement.agreementId(), agreement);
                }
            } finally {
                agreementLock.writeLock().unlock();
            }
            log.info("Market matched {} request(s)", created.size());
        }
        return created;
    }

    private int cheapestMatch(ResourceRequest request, Instant now) {
        int best = -1;
        for (int i = 0; i < offers.size(); i++) {
            ResourceOffer offer = offers.get(i);
            if (!matches(offer, request, now)) {
                continue;
            }
            if (best < 0 || offer.price().compareTo(offers.get(best).price()) < 0) {
                best = i;
            }
        }
        return best;
    }

    static boolean matches(ResourceOffer offer, ResourceRequest request, Instant now) {
        return offer.resourceType() == request.resourceType()
                && request.maxPrice().compareTo(offer.price()) >= 0
                && !offer.isExpired(now)
                && !request.isExpired(now)
                && offer.amount().compareTo(request.amount()) >= 0
                && offer.serviceLevel().satisfies(request.minServiceLevel())
                && offer.acceptsDuration(request.duration());
    }

    private long countOpenRequests(ResourceRequest like, Instant now) {
        return requests.stream()
                .filter(r -> r.resourceType() == like.resourceType() && !r.isExpired(now))
                .count();
    }

    private long countOpenOffers(ResourceRequest like, Instant now) {
        return offers.stream()
                .filter(o -> o.resourceType() == like.resourceType() && !o.isExpired(now))
                .count();
    }

    private SharingAgreement createAgreement(
            ResourceOffer offer, ResourceRequest request, BigDecimal demandFactor, Instant now) {
        BigDecimal factor = offer.pricingModel() == PricingModel.DYNAMIC ? demandFactor : BigDecimal.ONE;
        BigDecimal price = pricing.price(
                offer.pricingModel(), offer.price(), request.amount(), request.duration(), factor);
        SharingAgreement pending = new SharingAgreement(
                UUID.randomUUID().toString(),
                offer.offerId(),
                request.requestId(),
                offer.provider(),
                request.consumer(),
                offer.resourceType(),
                request.amount(),
                offer.price(),
                price,
                offer.pricingModel(),
                factor,
                offer.serviceLevel(),
                now,
                request.duration(),
                AgreementStatus.PENDING);
        SharingAgreement agreement = pending.transitionTo(AgreementStatus.ACTIVE);
        log.info(
                "Agreement {}: {} {} from {} to {} for {} at {}",
                agreement.agreementId(),
                agreement.amount(),
                agreement.resourceType(),
                agreement.provider(),
                agreement.consumer(),
                agreement.duration(),
                price);
        return agreement;
    }

    // ============================
    // Agreements
    // ============================

    public SharingAgreement cancelAgreement(String agreementId) {
        return transition(agreementId, AgreementStatus.CANCELLED);
    }

    public SharingAgreement completeAgreement(String agreementId) {
        return transition(agreementId, AgreementStatus.COMPLETED);
    }

    public SharingAgreement disputeAgreement(String agreementId) {
        return transition(agreementId, AgreementStatus.DISPUTED);
    }

    private SharingAgreement transition(String agreementId, AgreementStatus next) {
        agreementLock.writeLock().lock();
        try {
            SharingAgreement current = agreements.get(agreementId);
            if (current == null) {
                throw new NotFoundException("agreement " + agreementId);
            }
            SharingAgreement updated = current.transitionTo(next);
            agreements.put(agreementId, updated);
            log.info("Agreement {} {} -> {}", agreementId, current.status(), next);
            return updated;
        } finally {
            agreementLock.writeLock().unlock();
        }
    }

    /**
     * Appends a billing record for usage on an ACTIVE agreement, priced like the agreement itself. The agreement is
     * not modified.
     *
     * @throws NotFoundException if the agreement is unknown
     * @throws InvalidRequestException if the agreement is not ACTIVE or the usage is not positive
     */
    public BillingRecord recordUsage(String agreementId, BigDecimal usageAmount, Duration period) {
        if (usageAmount == null || usageAmount.signum() <= 0) {
            throw new InvalidRequestException("usage amount must be positive");
        }
        if (period == null || period.isNegative() || period.isZero()) {
            throw new InvalidRequestException("usage period must be positive");
        }
        agreementLock.writeLock().lock();
        try {
            SharingAgreement agreement = agreements.get(agreementId);
            if (agreement == null) {
                throw new NotFoundException("agreement " + agreementId);
            }
            if (agreement.status() != AgreementStatus.ACTIVE) {
                throw new InvalidRequestException(
                        "agreement " + agreementId + " is " + agreement.status() + ", no further billing");
            }
            BigDecimal charge = pricing.price(
                    agreement.pricingModel(), agreement.rate(), usageAmount, period, agreement.demandFactor());
            BillingRecord record = new BillingRecord(agreementId, usageAmount, period, charge, clock.instant());
            billing.add(record);
            return record;
        } finally {
            agreementLock.writeLock().unlock();
        }
    }

    // ============================
    // Housekeeping
    // ============================

    /**
     * Drops expired offers and requests.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        requestLock.writeLock().lock();
        try {
            int before = requests.size();
            requests.removeIf(r -> r.isExpired(now));
            removed += before - requests.size();
        } finally {
            requestLock.writeLock().unlock();
        }
        offerLock.writeLock().lock();
        try {
            int before = offers.size();
            offers.removeIf(o -> o.isExpired(now));
            removed += before - offers.size();
        } finally {
            offerLock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Purged {} expired market entries", removed);
        }
        return removed;
    }

    // ============================
    // Queries
    // ============================

    public List<ResourceOffer> getOpenOffers() {
        offerLock.readLock().lock();
        try {
            return List.copyOf(offers);
        } finally {
            offerLock.readLock().unlock();
        }
    }

    public List<ResourceRequest> getOpenRequests() {
        requestLock.readLock().lock();
        try {
            return List.copyOf(requests);
        } finally {
            requestLock.readLock().unlock();
        }
    }

    public Optional<SharingAgreement> getAgreement(String agreementId) {
        agreementLock.readLock().lock();
        try {
            return Optional.ofNullable(agreements.get(agreementId));
        } finally {
            agreementLock.readLock().unlock();
        }
    }

    public List<SharingAgreement> getAgreements() {
        agreementLock.readLock().lock();
        try {
            return List.copyOf(agreements.values());
        } finally {
            agreementLock.readLock().unlock();
        }
    }

    public List<BillingRecord> getBillingRecords(String agreementId) {
        agreementLock.readLock().lock();
        try {
            return billing.stream().filter(b -> b.agreementId().equals(agreementId)).toList();
        } finally {
            agreementLock.readLock().unlock();
        }
    }
}
