package com.relay.exception;

/**
 * Frame that is not a JSON object, lacks {@code type}, or is a registration without an {@code id}.
 */
public class ProtocolViolationException extends RelayException {

	public ProtocolViolationException(String message) {
		super(message);
	}

	public ProtocolViolationException(String message, Throwable cause) {
		super(message, cause);
	}
}
