package com.danieljhkim.meshcoord.meshcoordinator.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Four-part proof produced and checked by the consensus subsystem. The coordinator only reads the verdict and keeps a
 * digest of the proof parts for audit.
 *
 * @param verified verdict of the consensus subsystem
 */
public record ConsensusProof(
        byte[] spaceProof, byte[] stakeProof, byte[] workProof, byte[] timeProof, boolean verified) {

    public ConsensusProof {
        spaceProof = copy(spaceProof);
        stakeProof = copy(stakeProof);
        workProof = copy(workProof);
        timeProof = copy(timeProof);
    }

    public static ConsensusProof verdictOnly(boolean verified) {
        return new ConsensusProof(null, null, null, null, verified);
    }

    /**
     * SHA-256 over space, stake, work and time proof bytes, in that order.
     */
    public byte[] digest() {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(spaceProof);
            sha.update(stakeProof);
            sha.update(workProof);
            sha.update(timeProof);
            return sha.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] copy(byte[] bytes) {
        return bytes == null ? new byte[0] : bytes.clone();
    }
}
