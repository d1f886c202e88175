package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown when no node can host an allocation: either nothing eligible is active, or the eligible nodes lack
 * remaining capacity. Maps to gRPC RESOURCE_EXHAUSTED.
 */
public class AllocationFailedException extends MeshException {

	public static final String NO_ELIGIBLE_NODES = "No eligible nodes available";
	public static final String INSUFFICIENT_RESOURCES = "Insufficient resources";

	private final String reason;

	public AllocationFailedException(String reason) {
		super("Allocation failed: " + reason);
		this.reason = reason;
	}

	public AllocationFailedException(String reason, Throwable cause) {
		super("Allocation failed: " + reason, cause);
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.RESOURCE_EXHAUSTED;
	}
}
