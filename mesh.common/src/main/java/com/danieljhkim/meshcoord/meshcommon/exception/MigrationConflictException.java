package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown when a migration is planned for an asset that already has an active plan.
 * Maps to gRPC ALREADY_EXISTS.
 */
public class MigrationConflictException extends MeshException {

	private final String assetId;

	public MigrationConflictException(String assetId) {
		super("Migration already in progress for asset: " + assetId);
		this.assetId = assetId;
	}

	public String getAssetId() {
		return assetId;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.ALREADY_EXISTS;
	}
}
