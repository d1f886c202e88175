package com.danieljhkim.meshcoord.meshcoordinator.market;

import static org.junit.jupiter.api.Assertions.*;

import com.danieljhkim.meshcoord.meshcommon.exception.InvalidRequestException;
import com.danieljhkim.meshcoord.meshcommon.exception.InvalidStateTransitionException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;
import com.danieljhkim.meshcoord.meshcoordinator.support.MutableClock;
import com.danieljhkim.meshcoord.meshcoordinator.support.TestNodes;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResourceSharingMarketTest {

    private MutableClock clock;
    private ResourceSharingMarket market;
    private NodeId providerA;
    private NodeId providerB;
    private NodeId consumer;
    private Instant validUntil;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        market = new ResourceSharingMarket(new PricingCalculator(), clock);
        providerA = TestNodes.nodeId("provider-a");
        providerB = TestNodes.nodeId("provider-b");
        consumer = TestNodes.nodeId("consumer");
        validUntil = clock.instant().plus(Duration.ofHours(1));
    }

    @Test
    void testCheapestOfferWinsAndRequestMatchesOnce() {
        // Given
        ResourceOffer expensive = offer(providerA, "11", "4");
        ResourceOffer cheap = offer(providerB, "10", "4");
        market.offerResources(expensive);
        market.offerResources(cheap);

        // When
        List<ResourceOffer> candidates = market.requestResources(request("2", "12", Duration.ofHours(1)));

        // Then
        assertEquals(List.of(expensive, cheap), candidates);
        List<SharingAgreement> agreements = market.getAgreements();
        assertEquals(1, agreements.size());
        SharingAgreement agreement = agreements.get(0);
        assertEquals(providerB, agreement.provider());
        assertEquals(consumer, agreement.consumer());
        assertEquals(AgreementStatus.ACTIVE, agreement.status());
        assertEquals(0, agreement.price().compareTo(new BigDecimal("20")));
        assertEquals(clock.instant().plus(Duration.ofHours(1)), agreement.endTime());

        assertTrue(market.getOpenRequests().isEmpty());
        assertTrue(market.match().isEmpty());
        assertEquals(1, market.getAgreements().size());
    }

    @Test
    void testMatchDeductsAndRemovesExhaustedOffers() {
        ResourceOffer offer = offer(providerA, "1", "3");
        market.offerResources(offer);

        market.requestResources(request("2", "1", Duration.ofHours(1)));
        assertEquals(0, market.getOpenOffers().get(0).amount().compareTo(BigDecimal.ONE));
        assertEquals(offer.offerId(), market.getOpenOffers().get(0).offerId());

        market.requestResources(request("1", "1", Duration.ofHours(1)));
        assertTrue(market.getOpenOffers().isEmpty());
        assertEquals(2, market.getAgreements().size());
    }

    @Test
    void testPriceAboveBudgetDoesNotMatch() {
        market.offerResources(offer(providerA, "10", "4"));

        List<ResourceOffer> candidates = market.requestResources(request("1", "9.99", Duration.ofHours(1)));

        assertTrue(candidates.isEmpty());
        assertTrue(market.getAgreements().isEmpty());
        assertEquals(1, market.getOpenRequests().size());
    }

    @Test
    void testLaterOfferServesWaitingRequest() {
        market.requestResources(request("1", "5", Duration.ofHours(1)));
        assertTrue(market.getAgreements().isEmpty());

        market.offerResources(offer(providerA, "5", "1"));

        assertEquals(1, market.getAgreements().size());
        assertTrue(market.getOpenRequests().isEmpty());
        assertTrue(market.getOpenOffers().isEmpty());
    }

    @Test
    void testResourceTypeMustMatch() {
        market.offerResources(ResourceOffer.of(providerA, ResourceType.GPU, BigDecimal.TEN, BigDecimal.ONE, validUntil));

        market.requestResources(request("1", "5", Duration.ofHours(1)));

        assertTrue(market.getAgreements().isEmpty());
    }

    @Test
    void testServiceLevelAndCommitmentBoundsFilterOffers() {
        ServiceLevelAgreement strict = new ServiceLevelAgreement(0.999, Duration.ofMillis(50), 100);
        ResourceOffer bestEffort = offer(providerA, "1", "4");
        ResourceOffer shortTermOnly = new ResourceOffer(
                "short-term",
                providerB,
                ResourceType.CPU,
                new BigDecimal("4"),
                new BigDecimal("2"),
                PricingModel.FIXED,
                null,
                Duration.ofHours(1),
                strict,
                validUntil);
        market.offerResources(bestEffort);
        market.offerResources(shortTermOnly);

        ResourceRequest needsSla = new ResourceRequest(
                "needs-sla",
                consumer,
                ResourceType.CPU,
                BigDecimal.ONE,
                BigDecimal.TEN,
                Duration.ofHours(2),
                new ServiceLevelAgreement(0.99, Duration.ofMillis(100), 10),
                validUntil);
        assertTrue(market.requestResources(needsSla).isEmpty());

        market.cancelRequest("needs-sla");
        ResourceRequest withinCommitment = new ResourceRequest(
                "within",
                consumer,
                ResourceType.CPU,
                BigDecimal.ONE,
                BigDecimal.TEN,
                Duration.ofMinutes(30),
                new ServiceLevelAgreement(0.99, Duration.ofMillis(100), 10),
                validUntil);
        market.requestResources(withinCommitment);

        assertEquals("short-term", market.getAgreements().get(0).offerId());
    }

    @Test
    void testDynamicPricingUsesDemandAtMatchTime() {
        // Given: two requests waiting, then one dynamic offer
        market.requestResources(request("1", "5", Duration.ofHours(1)));
        market.requestResources(request("1", "5", Duration.ofHours(1)));

        market.offerResources(offer(providerA, "1", "10").withPricingModel(PricingModel.DYNAMIC));

        // Then: the first match saw 2 requests for 1 offer
        List<SharingAgreement> agreements = market.getAgreements();
        assertEquals(2, agreements.size());
        assertEquals(0, agreements.get(0).demandFactor().compareTo(new BigDecimal("2")));
        assertEquals(0, agreements.get(0).price().compareTo(new BigDecimal("2")));
        assertEquals(0, agreements.get(1).demandFactor().compareTo(BigDecimal.ONE));
        assertEquals(0, agreements.get(1).price().compareTo(BigDecimal.ONE));
    }

    @Test
    void testExpiredSubmissionsRejected() {
        Instant past = clock.instant();

        assertThrows(
                InvalidRequestException.class,
                () -> market.offerResources(
                        ResourceOffer.of(providerA, ResourceType.CPU, BigDecimal.ONE, BigDecimal.ONE, past)));
        assertThrows(
                InvalidRequestException.class,
                () -> market.requestResources(ResourceRequest.of(
                        consumer, ResourceType.CPU, BigDecimal.ONE, BigDecimal.ONE, Duration.ofHours(1), past)));
    }

    @Test
    void testEmptyOfferRejected() {
        assertThrows(InvalidRequestException.class, () -> market.offerResources(offer(providerA, "1", "0")));
    }

    @Test
    void testPurgeExpiredDropsStaleEntries() {
        market.offerResources(offer(providerA, "10", "4"));
        market.requestResources(request("1", "1", Duration.ofHours(1)));

        clock.advance(Duration.ofMinutes(59));
        assertEquals(0, market.purgeExpired());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(2, market.purgeExpired());
        assertTrue(market.getOpenOffers().isEmpty());
        assertTrue(market.getOpenRequests().isEmpty());
    }

    @Test
    void testExpiredOfferNoLongerMatches() {
        market.offerResources(offer(providerA, "1", "4"));
        clock.advance(Duration.ofHours(2));

        ResourceRequest late = ResourceRequest.of(
                consumer,
                ResourceType.CPU,
                BigDecimal.ONE,
                BigDecimal.TEN,
                Duration.ofHours(1),
                clock.instant().plus(Duration.ofHours(1)));

        assertTrue(market.requestResources(late).isEmpty());
        assertTrue(market.getAgreements().isEmpty());
    }

    @Test
    void testUsageBilledOnlyWhileActive() {
        market.offerResources(offer(providerA, "0.10", "8").withPricingModel(PricingModel.USAGE_BASED));
        market.requestResources(request("4", "1", Duration.ofHours(10)));
        SharingAgreement agreement = market.getAgreements().get(0);

        BillingRecord record = market.recordUsage(agreement.agreementId(), new BigDecimal("4"), Duration.ofHours(2));

        // 0.10 x 4 x 2h x 0.8
        assertEquals(0, record.charge().compareTo(new BigDecimal("0.64")));
        assertEquals(List.of(record), market.getBillingRecords(agreement.agreementId()));

        market.cancelAgreement(agreement.agreementId());
        assertThrows(
                InvalidRequestException.class,
                () -> market.recordUsage(agreement.agreementId(), BigDecimal.ONE, Duration.ofHours(1)));
        assertEquals(1, market.getBillingRecords(agreement.agreementId()).size());
    }

    @Test
    void testUsageValidation() {
        assertThrows(
                InvalidRequestException.class,
                () -> market.recordUsage("any", BigDecimal.ZERO, Duration.ofHours(1)));
        assertThrows(
                InvalidRequestException.class, () -> market.recordUsage("any", BigDecimal.ONE, Duration.ZERO));
        assertThrows(
                NotFoundException.class, () -> market.recordUsage("missing", BigDecimal.ONE, Duration.ofHours(1)));
    }

    @Test
    void testAgreementLifecycle() {
        market.offerResources(offer(providerA, "1", "4"));
        market.requestResources(request("1", "1", Duration.ofHours(1)));
        String id = market.getAgreements().get(0).agreementId();

        assertEquals(AgreementStatus.COMPLETED, market.completeAgreement(id).status());
        assertThrows(InvalidStateTransitionException.class, () -> market.disputeAgreement(id));
        assertThrows(NotFoundException.class, () -> market.cancelAgreement("missing"));
        assertEquals(AgreementStatus.COMPLETED, market.getAgreement(id).orElseThrow().status());
    }

    @Test
    void testCancelUnknownOfferOrRequest() {
        assertThrows(NotFoundException.class, () -> market.cancelOffer("missing"));
        assertThrows(NotFoundException.class, () -> market.cancelRequest("missing"));
    }

    private ResourceOffer offer(NodeId provider, String price, String amount) {
        return ResourceOffer.of(provider, ResourceType.CPU, new BigDecimal(amount), new BigDecimal(price), validUntil);
    }

    private ResourceRequest request(String amount, String maxPrice, Duration duration) {
        return ResourceRequest.of(
                consumer, ResourceType.CPU, new BigDecimal(amount), new BigDecimal(maxPrice), duration, validUntil);
    }
}
