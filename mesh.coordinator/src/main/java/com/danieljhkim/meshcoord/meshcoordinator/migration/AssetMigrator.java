package com.danieljhkim.meshcoord.meshcoordinator.migration;

import com.danieljhkim.meshcoord.meshcommon.exception.MeshException;
import com.danieljhkim.meshcoord.meshcommon.exception.MigrationConflictException;
import com.danieljhkim.meshcoord.meshcommon.exception.NetworkException;
import com.danieljhkim.meshcoord.meshcommon.exception.NotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeInfo;
import com.danieljhkim.meshcoord.meshcoordinator.state.AssetStateStore;
import com.danieljhkim.meshcoord.meshcoordinator.state.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Moves allocations between nodes through the {@link MigrationState} lifecycle.
 *
 * <p>
 * At most one active plan exists per asset. Only the switch step changes placement: it reserves the demand on the
 * target, makes the target primary and releases the demand on the source, all while holding the plan's map entry, so
 * a concurrent cancel either happens before the switch or not at all. Every step checks that the executor's plan is
 * still the asset's active one; a cancelled or replaced plan stops without touching its successor. Any failure leaves
 * placement untouched, halts the plan at FAILED and archives it.
 */
@Slf4j
public class AssetMigrator {

    private static final long BITS_PER_BYTE = 8;
    private static final long BITS_PER_MEGABIT = 1_000_000;

    private final NodeRegistry registry;
    private final AssetStateStore assets;
    private final MigrationTransport transport;
    private final EventPublisher publisher;
    private final boolean preferLiveMigration;
    private final long defaultDataSizeBytes;
    private final Clock clock;

    private final Map<AssetId, MigrationStatus> active = new ConcurrentHashMap<>();
    private final List<MigrationRecord> history = Collections.synchronizedList(new ArrayList<>());

    public AssetMigrator(
            NodeRegistry registry,
            AssetStateStore assets,
            MigrationTransport transport,
            EventPublisher publisher,
            boolean preferLiveMigration,
            long defaultDataSizeBytes,
            Clock clock) {
        this.registry = registry;
        this.assets = assets;
        this.transport = transport;
        this.publisher = publisher;
        this.preferLiveMigration = preferLiveMigration;
        this.defaultDataSizeBytes = defaultDataSizeBytes;
        this.clock = clock;
    }

    // ============================
    // Planning
    // ============================

    /**
     * Creates a PENDING plan.
     *
     * @throws com.danieljhkim.meshcoord.meshcommon.exception.AssetNotFoundException if the asset is not tracked
     * @throws NetworkException if the target is unknown or not reachable
     * @throws MigrationConflictException if the asset already has an active plan
     */
    public MigrationPlan planMigration(AssetId assetId, NodeId source, NodeId target, int priority, long dataSizeBytes) {
        assets.require(assetId);
        NodeInfo targetInfo = requireReachable(target);

        MigrationPlan plan = new MigrationPlan(
                assetId,
                source,
                target,
                preferLiveMigration ? MigrationStrategy.LIVE : MigrationStrategy.STOP_AND_COPY,
                estimateDuration(dataSizeBytes, targetInfo.capabilities().bandwidthMbps()),
                dataSizeBytes,
                priority,
                clock.instant());
        if (active.putIfAbsent(assetId, MigrationStatus.pending(plan)) != null) {
            throw new MigrationConflictException(assetId.toString());
        }
        log.info("Planned {} migration of {} from {} to {}", plan.strategy(), assetId, source, target);
        return plan;
    }

    static Duration estimateDuration(long dataSizeBytes, long bandwidthMbps) {
        long bitsPerSecond = Math.max(1, bandwidthMbps) * BITS_PER_MEGABIT;
        long seconds = (dataSizeBytes * BITS_PER_BYTE) / bitsPerSecond;
        return Duration.ofSeconds(Math.max(1, seconds));
    }

    // ============================
    // Execution
    // ============================

    /**
     * Runs a planned migration to completion.
     *
     * @return the final status: COMPLETED, or CANCELLED if the plan was cancelled between steps
     * @throws NotFoundException if the asset has no active plan
     * @throws MigrationConflictException if the plan is already being executed
     * @throws MeshException the failure that halted the plan; the plan is archived as FAILED first
     */
    public MigrationStatus executeMigration(AssetId assetId) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        MigrationStatus preparing = active.computeIfPresent(assetId, (k, s) -> {
            if (s.state() != MigrationState.PENDING) {
                return s;
            }
            claimed.set(true);
            return s.advance(MigrationState.PREPARING, 0, clock.instant());
        });
        if (preparing == null) {
            throw new NotFoundException("migration for " + assetId);
        }
        if (!claimed.get()) {
            // another caller is already executing this plan
            throw new MigrationConflictException(assetId.toString());
        }
        MigrationPlan plan = preparing.plan();

        MigrationStatus completed;
        try {
            publisher.publish(new MeshEvent.MigrationStarted(assetId, plan.source(), plan.target()));
            transport.prepare(plan);

            if (advance(plan, MigrationState.TRANSFERRING, 50) == null) {
                return cancelled(preparing);
            }
            long bytes = transport.transfer(plan);
            if (step(plan, s -> s.withBytesTransferred(bytes, clock.instant())) == null) {
                return cancelled(preparing);
            }

            if (advance(plan, MigrationState.VERIFYING, 75) == null) {
                return cancelled(preparing);
            }
            transport.verify(plan);

            if (advance(plan, MigrationState.SWITCHING, 90) == null) {
                return cancelled(preparing);
            }
            completed = step(plan, s -> {
                switchPlacement(plan);
                return s.advance(MigrationState.COMPLETED, 100, clock.instant());
            });
            if (completed == null) {
                return cancelled(preparing);
            }
        } catch (RuntimeException e) {
            fail(plan, e);
            if (e instanceof MeshException) {
                throw e;
            }
            throw new NetworkException("Migration of " + assetId + " failed: " + e.getMessage(), e);
        }

        active.remove(assetId, completed);
        history.add(MigrationRecord.of(completed));
        try {
            transport.activate(plan);
        } catch (RuntimeException e) {
            log.warn("Placement of {} moved to {} but activation failed: {}", assetId, plan.target(), e.getMessage());
        }
        log.info(
                "Migrated {} from {} to {} ({} bytes)",
                assetId,
                plan.source(),
                plan.target(),
                completed.bytesTransferred());
        publisher.publish(new MeshEvent.MigrationCompleted(assetId, plan.target()));
        return completed;
    }

    /**
     * Plans and executes a move of the asset to {@code target}. A no-op when the target already hosts it.
     *
     * @return the final status, empty when nothing had to move
     */
    public Optional<MigrationStatus> migrateAsset(AssetId assetId, NodeId target) {
        DistributedAssetState state = assets.require(assetId);
        if (state.primaryNode().equals(target)) {
            log.debug("{} already on {}, nothing to migrate", assetId, target);
            return Optional.empty();
        }
        long footprint = state.demand().footprintBytes();
        planMigration(assetId, state.primaryNode(), target, 0, footprint > 0 ? footprint : defaultDataSizeBytes);
        return Optional.of(executeMigration(assetId));
    }

    /**
     * Removes an active plan without archiving it. Data already copied to the target is left for the caller to
     * dispose of.
     *
     * @throws NotFoundException if the asset has no active plan
     */
    public MigrationStatus cancelMigration(AssetId assetId) {
        MigrationStatus removed = active.remove(assetId);
        if (removed == null || removed.state().isTerminal()) {
            throw new NotFoundException("active migration for " + assetId);
        }
        log.info("Cancelled migration of {} in state {}", assetId, removed.state());
        return removed.cancel(clock.instant());
    }

    private MigrationStatus advance(MigrationPlan plan, MigrationState next, int progress) {
        MigrationStatus status = step(plan, s -> s.advance(next, progress, clock.instant()));
        if (status != null) {
            log.debug("Migration of {} now {} ({}%)", plan.assetId(), next, progress);
        }
        return status;
    }

    /**
     * Applies {@code change} to the active status of {@code plan}.
     *
     * @return the new status, or {@code null} when {@code plan} is no longer the asset's active plan
     */
    private MigrationStatus step(MigrationPlan plan, UnaryOperator<MigrationStatus> change) {
        AtomicBoolean applied = new AtomicBoolean(false);
        MigrationStatus status = active.computeIfPresent(plan.assetId(), (k, s) -> {
            if (s.plan() != plan) {
                return s;
            }
            applied.set(true);
            return change.apply(s);
        });
        return applied.get() ? status : null;
    }

    private void switchPlacement(MigrationPlan plan) {
        requireReachable(plan.target());
        assets.update(plan.assetId(), state -> {
            registry.reserve(plan.target(), state.demand());
            registry.release(state.primaryNode(), state.demand());
            return state.withPrimary(plan.target(), clock.instant());
        });
    }

    private NodeInfo requireReachable(NodeId target) {
        NodeInfo info = registry.get(target)
                .orElseThrow(() -> new NetworkException("target node unreachable: " + target));
        if (!info.isActive()) {
            throw new NetworkException("target node unreachable: " + target + " is " + info.status());
        }
        return info;
    }

    private MigrationStatus cancelled(MigrationStatus initial) {
        log.info("Migration of {} stopped by cancellation", initial.plan().assetId());
        return new MigrationStatus(initial.plan(), MigrationState.CANCELLED, 0, 0, null, clock.instant());
    }

    private void fail(MigrationPlan plan, RuntimeException cause) {
        AssetId assetId = plan.assetId();
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        MigrationStatus failed = step(plan, s -> s.state().isTerminal() ? s : s.fail(message, clock.instant()));
        if (failed == null) {
            // cancelled or superseded; the newer plan is not ours to fail
            return;
        }
        active.remove(assetId, failed);
        history.add(MigrationRecord.of(failed));
        log.warn("Migration of {} to {} failed: {}", assetId, plan.target(), message);
        try {
            publisher.publish(new MeshEvent.MigrationFailed(assetId, message));
        } catch (NetworkException e) {
            log.warn("Could not announce failed migration of {}: {}", assetId, e.getMessage());
        }
    }

    // ============================
    // Queries
    // ============================

    public Optional<MigrationStatus> getStatus(AssetId assetId) {
        return Optional.ofNullable(active.get(assetId));
    }

    public boolean isMigrating(AssetId assetId) {
        return active.containsKey(assetId);
    }

    public List<MigrationStatus> getActiveMigrations() {
        return List.copyOf(active.values());
    }

    public List<MigrationRecord> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
