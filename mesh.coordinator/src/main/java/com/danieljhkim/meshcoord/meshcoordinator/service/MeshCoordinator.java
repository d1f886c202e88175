package com.danieljhkim.meshcoord.meshcoordinator.service;

import com.danieljhkim.meshcoord.meshcommon.exception.AllocationFailedException;
import com.danieljhkim.meshcoord.meshcommon.exception.AssetNotFoundException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.allocation.AllocationSelector;
import com.danieljhkim.meshcoord.meshcoordinator.allocation.LoadBalancer;
import com.danieljhkim.meshcoord.meshcoordinator.allocation.ScoredNode;
import com.danieljhkim.meshcoord.meshcoordinator.config.CoordinatorConfig;
import com.danieljhkim.meshcoord.meshcoordinator.event.EventJournal;
import com.danieljhkim.meshcoord.meshcoordinator.event.EventProcessor;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshMetricsSnapshot;
import com.danieljhkim.meshcoord.meshcoordinator.health.ByzantineDetector;
import com.danieljhkim.meshcoord.meshcoordinator.health.HeartbeatMonitor;
import com.danieljhkim.meshcoord.meshcoordinator.health.PartitionDetector;
import com.danieljhkim.meshcoord.meshcoordinator.health.ReachabilityProbe;
import com.danieljhkim.meshcoord.meshcoordinator.market.PricingCalculator;
import com.danieljhkim.meshcoord.meshcoordinator.market.ResourceOffer;
import com.danieljhkim.meshcoord.meshcoordinator.market.ResourceRequest;
import com.danieljhkim.meshcoord.meshcoordinator.market.ResourceSharingMarket;
import com.danieljhkim.meshcoord.meshcoordinator.migration.AssetMigrator;
import com.danieljhkim.meshcoord.meshcoordinator.migration.InMemoryMigrationTransport;
import com.danieljhkim.meshcoord.meshcoordinator.migration.MigrationTransport;
import com.danieljhkim.meshcoord.meshcoordinator.model.AllocationDecision;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetStateReport;
import com.danieljhkim.meshcoord.meshcoordinator.model.Attestation;
import com.danieljhkim.meshcoord.meshcoordinator.model.AvailableResources;
import com.danieljhkim.meshcoord.meshcoordinator.model.ConsensusProof;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.LocalNode;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeLocation;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodePerformanceMetrics;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceDemand;
import com.danieljhkim.meshcoord.meshcoordinator.scheduler.CoordinatorScheduler;
import com.danieljhkim.meshcoord.meshcoordinator.state.AssetStateStore;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import com.danieljhkim.meshcoord.meshcoordinator.state.RegistrySnapshot;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkPartition;
import com.danieljhkim.meshcoord.meshcoordinator.topology.NetworkTopology;
import com.danieljhkim.meshcoord.meshcoordinator.topology.TopologyStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process coordination engine.
 *
 * <p>
 * Owns the registry, asset states and topology, the detectors that read them, the migrator and the market. Detectors
 * only publish events; the {@link EventProcessor} reacts to them on its own thread: failed nodes get their assets
 * re-placed (when auto-migration is on), rebalance proposals are executed and Byzantine nodes lose trust.
 */
@Slf4j
public class MeshCoordinator implements MultiNodeCoordinator {

    static final String CONSENSUS_REJECTED = "consensus proof rejected";
    private static final Duration EVENT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    @Getter
    private final CoordinatorConfig config;

    private final Clock clock;

    @Getter
    private final NodeRegistry registry;

    @Getter
    private final AssetStateStore assetStates;

    private final TopologyStore topology;

    @Getter
    private final EventProcessor eventProcessor;

    private final HeartbeatMonitor heartbeatMonitor;

    @Getter
    private final PartitionDetector partitionDetector;

    private final ByzantineDetector byzantineDetector;
    private final AllocationSelector selector;

    @Getter
    private final LoadBalancer loadBalancer;

    @Getter
    private final AssetMigrator migrator;

    @Getter
    private final ResourceSharingMarket market;

    private final CoordinatorScheduler scheduler = new CoordinatorScheduler();
    private final Map<AssetId, AllocationDecision> decisions = new ConcurrentHashMap<>();

    private volatile LocalNode localNode;

    public MeshCoordinator(
            CoordinatorConfig config,
            ReachabilityProbe probe,
            MigrationTransport transport,
            EventJournal journal,
            Clock clock) {
        this.config = config;
        this.clock = clock;
        this.registry = new NodeRegistry(clock);
        this.assetStates = new AssetStateStore();
        this.topology = new TopologyStore();
        this.eventProcessor = new EventProcessor(journal);

        this.heartbeatMonitor = new HeartbeatMonitor(registry, eventProcessor, config.getFailureTimeout(), clock);
        this.partitionDetector = new PartitionDetector(registry, topology, probe, eventProcessor, clock);
        this.byzantineDetector =
                new ByzantineDetector(registry, assetStates, eventProcessor, config.getByzantineThreshold());
        this.selector = new AllocationSelector(registry);
        this.migrator = new AssetMigrator(
                registry,
                assetStates,
                transport,
                eventProcessor,
                config.isPreferLiveMigration(),
                config.getDefaultMigrationDataBytes(),
                clock);
        this.loadBalancer = new LoadBalancer(
                registry, assetStates, eventProcessor, config.getLoadImbalanceThreshold(), migrator::isMigrating);
        this.market = new ResourceSharingMarket(
                new PricingCalculator(config.getMaxDemandFactor(), config.getUsageDiscount()), clock);

        eventProcessor.addReaction(this::react);
    }

    /**
     * Coordinator with a fully connected reachability probe, the in-memory transport and the system clock. Opens the
     * event journal when it is enabled.
     */
    public static MeshCoordinator create(CoordinatorConfig config) throws IOException {
        Clock clock = Clock.systemUTC();
        EventJournal journal = config.isJournalEnabled() ? new EventJournal(config.getJournalPath(), clock) : null;
        return new MeshCoordinator(
                config, ReachabilityProbe.fullyConnected(), new InMemoryMigrationTransport(), journal, clock);
    }

    // ============================
    // Lifecycle
    // ============================

    @Override
    public synchronized void initialize(LocalNode localNode) {
        if (this.localNode != null) {
            throw new IllegalStateException("Coordinator already initialized for " + this.localNode.nodeId());
        }
        this.localNode = localNode;
        partitionDetector.setLocalNode(localNode.nodeId());
        log.info("Coordinator initialized for local node {} ({})", localNode.nodeId(), localNode.nodeId().getAddress());
    }

    @Override
    public synchronized void joinNetwork() {
        LocalNode local = requireLocalNode();
        registerNode(local.nodeId(), local.capabilities(), local.location());
        eventProcessor.start();

        scheduler.register("heartbeat-monitor", config.getHeartbeatInterval(), this::heartbeatTick)
                .register("partition-detector", config.getPartitionCheckInterval(), partitionDetector::tick)
                .register("byzantine-detector", config.getByzantineCheckInterval(), byzantineDetector::scan)
                .register("market-matcher", config.getMarketMatchInterval(), this::marketTick);
        if (config.isLoadBalancing()) {
            scheduler.register("load-balancer", config.getLoadBalanceInterval(), loadBalancer::rebalance);
        }
        scheduler.start();
        log.info("Joined mesh as {}", local.nodeId());
    }

    @Override
    public synchronized void leaveNetwork() {
        LocalNode local = requireLocalNode();
        stopScheduler();
        deregisterNode(local.nodeId(), "local node leaving network");
        log.info("Left mesh as {}", local.nodeId());
    }

    @Override
    public void shutdown() {
        stopScheduler();
        eventProcessor.shutdown(EVENT_DRAIN_TIMEOUT);
        log.info("Coordinator shut down");
    }

    private void stopScheduler() {
        try {
            scheduler.shutdown();
        } catch (InterruptedException e) {
            log.warn("Interrupted while stopping scheduler");
            Thread.currentThread().interrupt();
        }
    }

    private LocalNode requireLocalNode() {
        LocalNode local = localNode;
        if (local == null) {
            throw new IllegalStateException("Coordinator not initialized");
        }
        return local;
    }

    void heartbeatTick() {
        LocalNode local = localNode;
        if (local != null && registry.contains(local.nodeId())) {
            registry.updateHeartbeat(local.nodeId());
        }
        heartbeatMonitor.scan();
    }

    void marketTick() {
        market.purgeExpired();
        market.match();
    }

    // ============================
    // Membership
    // ============================

    @Override
    public NodeInfo registerNode(NodeId nodeId, NodeCapabilities capabilities, NodeLocation location) {
        boolean rejoined = registry.contains(nodeId);
        NodeInfo info = registry.join(nodeId, capabilities, location);
        eventProcessor.publish(new MeshEvent.NodeJoined(nodeId, capabilities, rejoined));
        return info;
    }

    /**
     * Removes a node and, when auto-migration is on, re-places the assets it hosted. Re-placement failures are logged;
     * the node leaves regardless.
     */
    @Override
    public void deregisterNode(NodeId nodeId, String reason) {
        if (registry.leave(nodeId, reason).isEmpty()) {
            throw new NotFoundException("node " + nodeId);
        }
        topology.forgetNode(nodeId);
        eventProcessor.publish(new MeshEvent.NodeLeft(nodeId, reason));
        if (config.isAutoMigration() && !assetStates.assetsOnNode(nodeId).isEmpty()) {
            try {
                handleNodeFailure(nodeId);
            } catch (RuntimeException e) {
                log.warn("Some assets of departed node {} could not be re-placed: {}", nodeId, e.getMessage());
            }
        }
    }

    @Override
    public NodeInfo heartbeat(NodeId nodeId) {
        return registry.updateHeartbeat(nodeId);
    }

    @Override
    public NodeInfo heartbeat(NodeId nodeId, NodePerformanceMetrics metrics, AvailableResources available) {
        return registry.updateHeartbeat(nodeId, metrics, available);
    }

    @Override
    public void handleNodeFailure(NodeId nodeId) {
        List<AssetId> affected = assetStates.assetsOnNode(nodeId);
        if (affected.isEmpty()) {
            return;
        }
        log.info("Re-placing {} asset(s) from failed node {}", affected.size(), nodeId);
        RuntimeException firstError = null;
        int moved = 0;
        for (AssetId assetId : affected) {
            try {
                if (replace(assetId, nodeId)) {
                    moved++;
                }
            } catch (RuntimeException e) {
                log.warn("Could not re-place {} from {}: {}", assetId, nodeId, e.getMessage());
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        log.info("Re-placed {} of {} asset(s) from {}", moved, affected.size(), nodeId);
        if (firstError != null) {
            throw firstError;
        }
    }

    /**
     * @return false when there was nothing to do (already moved, or a move is in flight)
     */
    private boolean replace(AssetId assetId, NodeId failedNode) {
        Optional<DistributedAssetState> state = assetStates.get(assetId);
        if (state.isEmpty() || !state.get().primaryNode().equals(failedNode)) {
            return false;
        }
        if (migrator.isMigrating(assetId)) {
            log.debug("{} already has a migration in flight", assetId);
            return false;
        }
        ScoredNode target = selector.select(assetId.resourceType(), state.get().demand(), Set.of(failedNode));
        return migrator.migrateAsset(assetId, target.node().nodeId()).isPresent();
    }

    @Override
    public List<NodeId> detectByzantineNodes() {
        return byzantineDetector.scan();
    }

    @Override
    public NetworkTopology getTopology() {
        return new NetworkTopology(
                registry.snapshot().asMap(),
                topology.getOpenPartitions(),
                topology.getLatencyMatrix(),
                topology.getBandwidthMatrix(),
                clock.instant());
    }

    /**
     * Every partition ever detected, healed ones included.
     */
    public List<NetworkPartition> getPartitionHistory() {
        return topology.getPartitions();
    }

    public void recordLink(NodeId from, NodeId to, Duration latency, long bandwidthMbps) {
        topology.recordLink(from, to, latency, bandwidthMbps);
    }

    // ============================
    // Allocation
    // ============================

    @Override
    public AllocationDecision allocateAsset(AssetId assetId) {
        return allocateAsset(assetId, ResourceDemand.NONE, null);
    }

    @Override
    public AllocationDecision allocateAsset(AssetId assetId, ResourceDemand demand, ConsensusProof proof) {
        if (proof != null && !proof.verified()) {
            throw new AllocationFailedException(CONSENSUS_REJECTED);
        }
        Optional<AllocationDecision> existing = currentDecision(assetId);
        if (existing.isPresent()) {
            return existing.get();
        }
        ResourceDemand required = demand == null ? ResourceDemand.NONE : demand;

        Set<NodeId> excluded = new HashSet<>();
        while (true) {
            RegistrySnapshot snapshot = registry.snapshot();
            ScoredNode chosen = selector.select(snapshot, assetId.resourceType(), required, excluded);
            NodeId target = chosen.node().nodeId();
            try {
                registry.reserve(target, required);
            } catch (AllocationFailedException e) {
                // capacity changed since the snapshot
                excluded.add(target);
                continue;
            }
            if (!assetStates.putIfAbsent(DistributedAssetState.allocated(assetId, target, required, clock.instant()))) {
                registry.release(target, required);
                return currentDecision(assetId)
                        .orElseThrow(() -> new AllocationFailedException("concurrent allocation of " + assetId));
            }
            AllocationDecision decision = new AllocationDecision(
                    assetId, target, chosen.score(), clock.instant(), attestations(proof));
            decisions.put(assetId, decision);
            log.info("Allocated {} on {} (score {})", assetId, target, chosen.score());
            return decision;
        }
    }

    private List<Attestation> attestations(ConsensusProof proof) {
        LocalNode local = localNode;
        if (local == null) {
            return List.of();
        }
        byte[] digest = proof == null ? new byte[0] : proof.digest();
        return List.of(new Attestation(local.nodeId(), digest));
    }

    public Optional<AllocationDecision> getDecision(AssetId assetId) {
        return currentDecision(assetId);
    }

    /**
     * The recorded decision for a placed asset, re-pointed at its current primary if a migration has moved it since.
     */
    private Optional<AllocationDecision> currentDecision(AssetId assetId) {
        AllocationDecision recorded = decisions.get(assetId);
        Optional<DistributedAssetState> state = assetStates.get(assetId);
        if (recorded == null || state.isEmpty()) {
            return Optional.empty();
        }
        NodeId primary = state.get().primaryNode();
        if (recorded.targetNode().equals(primary)) {
            return Optional.of(recorded);
        }
        double score = registry.get(primary).map(AllocationSelector::score).orElse(0.0);
        AllocationDecision moved = recorded.withTarget(primary, score, clock.instant());
        decisions.replace(assetId, recorded, moved);
        log.debug("Decision for {} follows its move from {} to {}", assetId, recorded.targetNode(), primary);
        return Optional.ofNullable(decisions.get(assetId));
    }

    /**
     * Drops the allocation and returns its capacity to the primary. An in-flight migration of the asset will fail at
     * its switch step.
     */
    @Override
    public void deallocateAsset(AssetId assetId) {
        DistributedAssetState removed = assetStates.remove(assetId)
                .orElseThrow(() -> new AssetNotFoundException(assetId.toString()));
        registry.release(removed.primaryNode(), removed.demand());
        decisions.remove(assetId);
        log.info("Deallocated {} from {}", assetId, removed.primaryNode());
    }

    @Override
    public void migrateAsset(AssetId assetId, NodeId target) {
        migrator.migrateAsset(assetId, target);
    }

    @Override
    public DistributedAssetState syncAssetState(AssetId assetId) {
        return assetStates.require(assetId);
    }

    @Override
    public DistributedAssetState reportAssetState(AssetId assetId, NodeId observer, AssetStateReport report) {
        if (!registry.contains(observer)) {
            throw new NotFoundException("node " + observer);
        }
        return assetStates.update(assetId, s -> s.withReport(observer, report, clock.instant()));
    }

    // ============================
    // Market
    // ============================

    @Override
    public List<ResourceOffer> requestResources(ResourceRequest request) {
        return market.requestResources(request);
    }

    @Override
    public void offerResources(ResourceOffer offer) {
        market.offerResources(offer);
    }

    // ============================
    // Events
    // ============================

    @Override
    public void handleEvent(MeshEvent event) {
        eventProcessor.publish(event);
    }

    @Override
    public void subscribe(Consumer<MeshEvent> listener) {
        eventProcessor.subscribe(listener);
    }

    @Override
    public MeshMetricsSnapshot getMetrics() {
        return eventProcessor.getMetrics();
    }

    private void react(MeshEvent event) {
        if (event instanceof MeshEvent.NodeFailed failed) {
            if (config.isAutoMigration()) {
                handleNodeFailure(failed.node());
            }
        } else if (event instanceof MeshEvent.RebalanceRequested move) {
            migrator.migrateAsset(move.assetId(), move.to());
        } else if (event instanceof MeshEvent.ByzantineDetected flagged) {
            registry.get(flagged.node()).ifPresent(info -> {
                double trust = info.nodeId().adjustTrust(-config.getTrustPenalty());
                log.warn("Lowered trust of {} to {}", info.nodeId(), trust);
            });
        }
    }
}
