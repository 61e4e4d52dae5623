package com.relay.exception;

/**
 * Failure that ends the session it happened in. Never shared across sessions.
 */
public abstract class RelayException extends RuntimeException {

	protected RelayException(String message) {
		super(message);
	}

	protected RelayException(String message, Throwable cause) {
		super(message, cause);
	}
}
