package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of placing an allocation.
 *
 * @param score        placement score of the chosen node (see the allocation selector)
 * @param attestations participating nodes and their signatures
 */
public record AllocationDecision(
        AssetId assetId, NodeId targetNode, double score, Instant decidedAt, List<Attestation> attestations) {

    public AllocationDecision {
        Objects.requireNonNull(assetId, "assetId cannot be null");
        Objects.requireNonNull(targetNode, "targetNode cannot be null");
        Objects.requireNonNull(decidedAt, "decidedAt cannot be null");
        attestations = attestations == null ? List.of() : List.copyOf(attestations);
    }

    /**
     * The same decision re-pointed at the node now hosting the allocation, keeping its attestations.
     */
    public AllocationDecision withTarget(NodeId node, double newScore, Instant now) {
        return new AllocationDecision(assetId, node, newScore, now, attestations);
    }
}
