package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of a mesh node: a 32-byte opaque id, its network address and public key. The id, address and key never
 * change; the trust score moves within [0, 1] over the node's lifetime. Equality uses the id bytes only.
 */
public final class NodeId {

    public static final int ID_LENGTH = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] id;
    private final String address;
    private final byte[] publicKey;
    private volatile double trustScore;

    public NodeId(byte[] id, String address, byte[] publicKey, double trustScore) {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.length != ID_LENGTH) {
            throw new IllegalArgumentException("node id must be " + ID_LENGTH + " bytes, got " + id.length);
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address cannot be null or blank");
        }
        this.id = id.clone();
        this.address = address;
        this.publicKey = publicKey == null ? new byte[0] : publicKey.clone();
        this.trustScore = clamp(trustScore);
    }

    /**
     * Creates a node with a random id and full trust.
     */
    public static NodeId random(String address) {
        byte[] id = new byte[ID_LENGTH];
        RANDOM.nextBytes(id);
        return new NodeId(id, address, new byte[0], 1.0);
    }

    /**
     * Derives a stable id from a node name (SHA-256 of its UTF-8 bytes).
     */
    public static NodeId fromName(String name, String address) {
        return fromName(name, address, 1.0);
    }

    public static NodeId fromName(String name, String address, double trustScore) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
            return new NodeId(digest, address, new byte[0], trustScore);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public byte[] getId() {
        return id.clone();
    }

    public String getAddress() {
        return address;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public double getTrustScore() {
        return trustScore;
    }

    public void setTrustScore(double trustScore) {
        this.trustScore = clamp(trustScore);
    }

    /**
     * Adds {@code delta} to the trust score, clamped to [0, 1].
     *
     * @return the new trust score
     */
    public synchronized double adjustTrust(double delta) {
        this.trustScore = clamp(trustScore + delta);
        return trustScore;
    }

    /**
     * Full id as lowercase hex.
     */
    public String toHex() {
        return HexFormat.of().formatHex(id);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeId)) {
            return false;
        }
        return Arrays.equals(id, ((NodeId) o).id);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(id);
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(id, 0, 8);
    }
}
