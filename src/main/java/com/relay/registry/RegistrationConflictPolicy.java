package com.relay.registry;

import com.relay.connection.RelayConnection;

/**
 * Decides what a registration does when its client id is already held by another connection.
 * <p>
 * Called while the registry holds the entry for {@code clientId}, so implementations must be
 * quick and must not touch the registry or do I/O.
 */
@FunctionalInterface
public interface RegistrationConflictPolicy {

	ConflictResolution resolve(String clientId, RelayConnection holder, RelayConnection challenger);

	static RegistrationConflictPolicy always(ConflictResolution resolution) {
		return (clientId, holder, challenger) -> resolution;
	}
}
