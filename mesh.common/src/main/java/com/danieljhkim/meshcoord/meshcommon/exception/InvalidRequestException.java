package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Exception thrown when a request is invalid (e.g., negative amount, unknown resource type).
 * Maps to gRPC INVALID_ARGUMENT.
 */
public class InvalidRequestException extends MeshException {

	public InvalidRequestException(String message) {
		super(message);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.INVALID_ARGUMENT;
	}
}
