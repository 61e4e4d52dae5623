package com.relay.registry;

import com.relay.connection.RelayConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client id to live connection. The only state shared between sessions.
 * <p>
 * Every operation is atomic for its key. Lookup is not atomic with a subsequent send:
 * the connection returned may close before the caller writes to it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

	private final Map<String, RelayConnection> connections = new ConcurrentHashMap<>();
	private final RegistrationConflictPolicy conflictPolicy;

	public RegistrationResult register(String clientId, RelayConnection connection) {
		Objects.requireNonNull(clientId, "clientId");
		Objects.requireNonNull(connection, "connection");

		AtomicReference<RegistrationResult> result = new AtomicReference<>();
		connections.compute(clientId, (id, holder) -> {
			if (holder == null) {
				result.set(new RegistrationResult(RegistrationResult.Outcome.CREATED, null));
				return connection;
			}
			if (holder == connection) {
				result.set(new RegistrationResult(RegistrationResult.Outcome.UNCHANGED, holder));
				return holder;
			}
			switch (conflictPolicy.resolve(id, holder, connection)) {
				case REJECT:
					result.set(new RegistrationResult(RegistrationResult.Outcome.REJECTED, holder));
					return holder;
				case EVICT:
					result.set(new RegistrationResult(RegistrationResult.Outcome.EVICTED, holder));
					return connection;
				default:
					result.set(new RegistrationResult(RegistrationResult.Outcome.OVERWRITTEN, holder));
					return connection;
			}
		});

		RegistrationResult registration = result.get();
		switch (registration.getOutcome()) {
			case REJECTED:
				log.warn("Client {} already held by connection {}, registration from {} rejected",
						clientId, registration.getPreviousHolder().getId(), connection.getId());
				break;
			case OVERWRITTEN:
			case EVICTED:
				log.info("Client {} registered on connection {}, taking over from {} ({})",
						clientId, connection.getId(), registration.getPreviousHolder().getId(), registration.getOutcome());
				break;
			default:
				log.info("Client {} registered on connection {}", clientId, connection.getId());
		}
		return registration;
	}

	/**
	 * Removes the entry for {@code clientId} whoever holds it. No-op when absent.
	 */
	public void unregister(String clientId) {
		RelayConnection removed = connections.remove(clientId);
		if (removed != null) {
			log.info("Client {} unregistered (connection {})", clientId, removed.getId());
		}
	}

	/**
	 * Removes the entry only while it still maps to {@code connection}.
	 *
	 * @return true if an entry was removed
	 */
	public boolean unregister(String clientId, RelayConnection connection) {
		boolean removed = connections.remove(clientId, connection);
		if (removed) {
			log.info("Client {} unregistered (connection {})", clientId, connection.getId());
		} else {
			log.debug("Client {} no longer held by connection {}, nothing to unregister", clientId, connection.getId());
		}
		return removed;
	}

	public Optional<RelayConnection> lookup(String clientId) {
		if (clientId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(connections.get(clientId));
	}

	public boolean isRegistered(String clientId) {
		return clientId != null && connections.containsKey(clientId);
	}

	public Set<String> registeredIds() {
		return Set.copyOf(connections.keySet());
	}

	public int size() {
		return connections.size();
	}
}
