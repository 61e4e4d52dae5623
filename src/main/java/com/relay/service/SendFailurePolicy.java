package com.relay.service;

/**
 * Who pays when a relay write to a looked-up recipient fails.
 */
public enum SendFailurePolicy {

	/**
	 * The sending session is terminated; the recipient's entry is left to its own session's teardown.
	 */
	FAIL_SENDER,

	/**
	 * The frame is dropped as if the recipient were unknown and the dead recipient is unregistered.
	 */
	DROP_RECIPIENT
}
