package com.danieljhkim.meshcoord.meshcoordinator.model;

/**
 * One suspicious observation about a node.
 *
 * @param assetId   allocation the disagreement was seen on, {@code null} for node-level findings
 * @param reported  what the node reported (or a description of the node-level finding)
 * @param majority  what the strict majority of other observers reported, {@code null} for node-level findings
 */
public record ByzantineEvidence(AssetId assetId, String reported, String majority) {

    public static ByzantineEvidence disagreement(AssetId assetId, AssetStateReport reported, AssetStateReport majority) {
        return new ByzantineEvidence(assetId, reported.toString(), majority.toString());
    }

    public static ByzantineEvidence lowSuccessRate(double successRate) {
        return new ByzantineEvidence(null, "success rate " + successRate, null);
    }
}
