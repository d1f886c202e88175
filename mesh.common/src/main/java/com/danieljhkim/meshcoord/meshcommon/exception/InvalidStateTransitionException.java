package com.danieljhkim.meshcoord.meshcommon.exception;

import io.grpc.Status;

/**
 * Thrown when a status change is not allowed by the owning transition table.
 * Maps to gRPC FAILED_PRECONDITION.
 */
public class InvalidStateTransitionException extends MeshException {

	private final String from;
	private final String to;

	public InvalidStateTransitionException(String subject, Enum<?> from, Enum<?> to) {
		super("Illegal transition for " + subject + ": " + from + " -> " + to);
		this.from = from.name();
		this.to = to.name();
	}

	public String getFrom() {
		return from;
	}

	public String getTo() {
		return to;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.FAILED_PRECONDITION;
	}
}
