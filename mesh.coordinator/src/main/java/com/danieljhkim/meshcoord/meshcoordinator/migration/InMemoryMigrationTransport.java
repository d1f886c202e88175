package com.danieljhkim.meshcoord.meshcoordinator.migration;

import com.danieljhkim.meshcoord.meshcommon.exception.NetworkException;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport for a single-process mesh: nothing actually moves, but staging is tracked so verify fails when a step was
 * skipped.
 */
public class InMemoryMigrationTransport implements MigrationTransport {

    private final Map<AssetId, NodeId> staged = new ConcurrentHashMap<>();
    private final Map<AssetId, Long> transferred = new ConcurrentHashMap<>();
    private final Map<AssetId, NodeId> live = new ConcurrentHashMap<>();

    @Override
    public void prepare(MigrationPlan plan) {
        staged.put(plan.assetId(), plan.target());
        transferred.remove(plan.assetId());
    }

    @Override
    public long transfer(MigrationPlan plan) {
        if (!plan.target().equals(staged.get(plan.assetId()))) {
            throw new NetworkException("target " + plan.target() + " was not prepared for " + plan.assetId());
        }
        transferred.put(plan.assetId(), plan.dataSizeBytes());
        return plan.dataSizeBytes();
    }

    @Override
    public void verify(MigrationPlan plan) {
        Long bytes = transferred.get(plan.assetId());
        if (bytes == null || bytes != plan.dataSizeBytes()) {
            throw new NetworkException("incomplete copy of " + plan.assetId() + " on " + plan.target());
        }
    }

    @Override
    public void activate(MigrationPlan plan) {
        staged.remove(plan.assetId());
        transferred.remove(plan.assetId());
        live.put(plan.assetId(), plan.target());
    }

    public Optional<NodeId> liveLocation(AssetId assetId) {
        return Optional.ofNullable(live.get(assetId));
    }
}
