package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the event channel rejects a message or a node is unreachable during migration.
 * Maps to gRPC UNAVAILABLE.
 */
public class NetworkException extends MeshException {

	public NetworkException(String message) {
		super(message);
	}

	public NetworkException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNAVAILABLE;
	}
}
