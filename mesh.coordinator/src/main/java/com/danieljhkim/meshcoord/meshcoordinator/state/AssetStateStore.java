package com.danieljhkim.meshcoord.meshcoordinator.state;

import com.danieljhkim.meshcoord.meshcommon.exception.AssetNotFoundException;
import com.danieljhkim.meshcoord.meshcoordinator.model.AssetId;
import com.danieljhkim.meshcoord.meshcoordinator.model.DistributedAssetState;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Per-allocation replicated state, keyed by asset id in allocation order.
 *
 * <p>
 * Lock order: callers that touch the {@link NodeRegistry} inside {@link #update} take this lock first. Nothing takes
 * it while holding the registry lock.
 */
public class AssetStateStore {

    private final Map<AssetId, DistributedAssetState> states = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Stores a new allocation.
     *
     * @return false if the asset is already tracked
     */
    public boolean putIfAbsent(DistributedAssetState state) {
        lock.writeLock().lock();
        try {
            return states.putIfAbsent(state.assetId(), state) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<DistributedAssetState> get(AssetId assetId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(states.get(assetId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public DistributedAssetState require(AssetId assetId) {
        return get(assetId).orElseThrow(() -> new AssetNotFoundException(assetId.toString()));
    }

    /**
     * Applies {@code change} to the asset's state while holding the write lock.
     *
     * @throws AssetNotFoundException if the asset is not tracked
     */
    public DistributedAssetState update(AssetId assetId, UnaryOperator<DistributedAssetState> change) {
        lock.writeLock().lock();
        try {
            DistributedAssetState current = states.get(assetId);
            if (current == null) {
                throw new AssetNotFoundException(assetId.toString());
            }
            DistributedAssetState updated = change.apply(current);
            states.put(assetId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<DistributedAssetState> remove(AssetId assetId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(states.remove(assetId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Assets whose primary is {@code nodeId}, in allocation order.
     */
    public List<AssetId> assetsOnNode(NodeId nodeId) {
        lock.readLock().lock();
        try {
            return states.values().stream()
                    .filter(s -> s.primaryNode().equals(nodeId))
                    .map(DistributedAssetState::assetId)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DistributedAssetState> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(states.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
