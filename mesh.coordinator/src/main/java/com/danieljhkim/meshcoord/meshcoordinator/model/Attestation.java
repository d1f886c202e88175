package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.util.HexFormat;
import java.util.Objects;

/**
 * A node's signature over an allocation decision, kept for audit.
 */
public record Attestation(NodeId node, byte[] signature) {

    public Attestation {
        Objects.requireNonNull(node, "node cannot be null");
        signature = signature == null ? new byte[0] : signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    @Override
    public String toString() {
        return "Attestation{node=" + node + ", signature=" + HexFormat.of().formatHex(signature) + '}';
    }
}
