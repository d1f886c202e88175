package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown on a lookup miss for a market entry, agreement, node or migration.
 * Maps to gRPC NOT_FOUND.
 */
public class NotFoundException extends MeshException {

	private final String resource;

	public NotFoundException(String resource) {
		super("Not found: " + resource);
		this.resource = resource;
	}

	public String getResource() {
		return resource;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.NOT_FOUND;
	}
}
