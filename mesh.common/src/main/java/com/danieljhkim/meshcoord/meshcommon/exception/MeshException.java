package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Base exception for all mesh coordination failures.
 * Each subclass maps to a specific gRPC status code.
 */
public abstract class MeshException extends RuntimeException {

	protected MeshException(String message) {
		super(message);
	}

	protected MeshException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Returns the gRPC status code for this exception.
	 */
	public abstract Status.Code getGrpcStatusCode();

	/**
	 * Builds the gRPC Status for this exception.
	 */
	public Status toGrpcStatus() {
		return Status.fromCode(getGrpcStatusCode())
				.withDescription(getMessage())
				.withCause(getCause());
	}
}
