package com.relay.session;

import com.relay.connection.RelayConnection;
import com.relay.exception.ProtocolViolationException;
import com.relay.exception.RelayException;
import com.relay.registry.ConnectionRegistry;
import com.relay.service.DispatchResult;
import com.relay.service.MessageDispatcher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one connection from accept to close.
 * <p>
 * {@code UNIDENTIFIED -> IDENTIFIED(id) -> TERMINATED}. {@link #receive} is called with one frame
 * at a time in arrival order. {@link #terminate} may race with it from another thread (peer close,
 * eviction) and runs its cleanup exactly once whichever path gets there first.
 */
@Slf4j
public class RelaySession {

	@Getter
	private final RelayConnection connection;
	private final MessageDispatcher dispatcher;
	private final ConnectionRegistry registry;

	private final AtomicBoolean terminated = new AtomicBoolean();
	private volatile String clientId;

	public RelaySession(RelayConnection connection, MessageDispatcher dispatcher, ConnectionRegistry registry) {
		this.connection = connection;
		this.dispatcher = dispatcher;
		this.registry = registry;
	}

	public SessionState getState() {
		if (terminated.get()) {
			return SessionState.TERMINATED;
		}
		return clientId == null ? SessionState.UNIDENTIFIED : SessionState.IDENTIFIED;
	}

	public Optional<String> getClientId() {
		return Optional.ofNullable(clientId);
	}

	public void receive(String frame) {
		if (terminated.get()) {
			log.debug("Frame on terminated connection {} ignored", connection.getId());
			return;
		}

		DispatchResult result;
		try {
			result = dispatcher.dispatch(this, frame);
		} catch (RuntimeException e) {
			log.error("Unexpected error dispatching frame on connection {}", connection.getId(), e);
			terminate(CloseStatus.SERVER_ERROR);
			return;
		}

		if (result.getClientId() != null) {
			identify(result.getClientId());
		}
		result.getFailure().ifPresent(failure -> terminate(closeStatusFor(failure)));
	}

	private void identify(String newId) {
		String previous = clientId;
		clientId = newId;
		if (previous != null && !previous.equals(newId)) {
			registry.unregister(previous, connection);
		}
		// terminate() may have run between register and here and missed the new id
		if (terminated.get()) {
			registry.unregister(newId, connection);
		}
	}

	/**
	 * Ends the session: releases its client id if it ever had one, then closes the connection.
	 * Later calls are no-ops.
	 */
	public void terminate(CloseStatus status) {
		if (!terminated.compareAndSet(false, true)) {
			return;
		}
		String id = clientId;
		log.info("Session on connection {} terminating (client={}, status={})", connection.getId(), id, status);

		if (id != null) {
			try {
				registry.unregister(id, connection);
			} catch (RuntimeException e) {
				log.warn("Cleanup for client {} failed on connection {}", id, connection.getId(), e);
			}
		}

		if (connection.isOpen()) {
			try {
				connection.close(status);
			} catch (IOException | RuntimeException e) {
				log.warn("Connection {} already torn down: {}", connection.getId(), e.getMessage());
			}
		}
	}

	private static CloseStatus closeStatusFor(RelayException failure) {
		if (failure instanceof ProtocolViolationException) {
			return CloseStatus.BAD_DATA;
		}
		return CloseStatus.SERVER_ERROR;
	}
}
