package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown when an operation references an allocation that has no distributed state.
 * Maps to gRPC NOT_FOUND.
 */
public class AssetNotFoundException extends MeshException {

	private final String assetId;

	public AssetNotFoundException(String assetId) {
		super("Asset not found: " + assetId);
		this.assetId = assetId;
	}

	public String getAssetId() {
		return assetId;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.NOT_FOUND;
	}
}
