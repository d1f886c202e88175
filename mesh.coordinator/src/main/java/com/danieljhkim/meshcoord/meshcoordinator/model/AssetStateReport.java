package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.Objects;

/**
 * What an observing node claims about an allocation. Two reports agree only when all three fields are equal.
 *
 * @param state       lifecycle state
 * @param fingerprint content hash of the allocation's state as computed by the observer
 * @param version     monotonically increasing state version
 */
public record AssetStateReport(AssetState state, String fingerprint, long version) {

    public AssetStateReport {
        Objects.requireNonNull(state, "state cannot be null");
        if (fingerprint == null) {
            fingerprint = "";
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
    }

    public static AssetStateReport of(AssetState state) {
        return new AssetStateReport(state, "", 0);
    }
}
