package com.relay.registry;

public enum ConflictResolution {

	/**
	 * Replace the current holder. It stays open but no longer receives relayed frames.
	 */
	OVERWRITE,

	/**
	 * Keep the current holder and refuse the new registration.
	 */
	REJECT,

	/**
	 * Replace the current holder and close its connection.
	 */
	EVICT
}
