package com.relay.exception;

/**
 * Recipient was found in the registry but writing to its connection failed.
 */
public class StaleRecipientException extends RelayException {

	public StaleRecipientException(String recipientId, Throwable cause) {
		super("Relay to client " + recipientId + " failed: " + cause.getMessage(), cause);
	}
}
