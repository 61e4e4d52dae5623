package com.relay.service;

import com.relay.config.RelayProperties;
import com.relay.connection.RelayConnection;
import com.relay.dto.InboundMessage;
import com.relay.exception.ProtocolViolationException;
import com.relay.exception.StaleRecipientException;
import com.relay.metrics.RelayMetricsTracker;
import com.relay.registry.ConnectionRegistry;
import com.relay.registry.RegistrationResult;
import com.relay.session.RelaySession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.Optional;

/**
 * Turns one inbound frame into a registration, a relay, or nothing.
 * <p>
 * Never throws for protocol or delivery problems: they come back as a fatal {@link DispatchResult}
 * and the calling session decides how to end.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageDispatcher {

	static final CloseStatus EVICTED = new CloseStatus(4000, "Client id taken over by another connection");

	private final MessageParser messageParser;
	private final ConnectionRegistry connectionRegistry;
	private final RelayProperties relayProperties;
	private final RelayMetricsTracker metricsTracker;

	public DispatchResult dispatch(RelaySession session, String frame) {
		DispatchResult result = route(session, frame);
		metricsTracker.record(result.getOutcome());
		return result;
	}

	private DispatchResult route(RelaySession session, String frame) {
		InboundMessage message;
		try {
			message = messageParser.parse(frame);
		} catch (ProtocolViolationException e) {
			log.warn("Protocol violation on connection {}: {}", session.getConnection().getId(), e.getMessage());
			return DispatchResult.failed(DispatchOutcome.PROTOCOL_VIOLATION, e);
		}

		if (message.isRegistration()) {
			return register(session, message.getClientId());
		}

		Optional<String> sender = session.getClientId();
		if (sender.isPresent() && message.hasTarget()) {
			return relay(session, sender.get(), message);
		}

		log.debug("Dropped frame on connection {} (identified={}, to={})",
				session.getConnection().getId(), sender.isPresent(), message.getTarget());
		return DispatchResult.of(DispatchOutcome.DROPPED);
	}

	private DispatchResult register(RelaySession session, String clientId) {
		RegistrationResult registration = connectionRegistry.register(clientId, session.getConnection());
		if (!registration.isAccepted()) {
			return DispatchResult.of(DispatchOutcome.REGISTRATION_REJECTED);
		}
		registration.getEvicted().ifPresent(evicted -> evict(clientId, evicted));
		return DispatchResult.registered(clientId);
	}

	private void evict(String clientId, RelayConnection evicted) {
		try {
			evicted.close(EVICTED);
			log.info("Closed connection {} previously holding client {}", evicted.getId(), clientId);
		} catch (IOException e) {
			log.warn("Failed to close evicted connection {} for client {}: {}", evicted.getId(), clientId, e.getMessage());
		}
	}

	private DispatchResult relay(RelaySession session, String senderId, InboundMessage message) {
		String targetId = message.getTarget();
		Optional<RelayConnection> target = connectionRegistry.lookup(targetId);
		if (target.isEmpty()) {
			log.info("Client {} not found, frame from {} dropped", targetId, senderId);
			return DispatchResult.of(DispatchOutcome.UNKNOWN_RECIPIENT);
		}

		RelayConnection recipient = target.get();
		if (recipient == session.getConnection()) {
			log.debug("Client {} addressed itself, frame dropped", senderId);
			return DispatchResult.of(DispatchOutcome.DROPPED);
		}

		try {
			recipient.send(message.getRawFrame());
		} catch (IOException e) {
			return sendFailed(senderId, targetId, recipient, e);
		}
		log.info("Message relayed from {} to {}", senderId, targetId);
		return DispatchResult.of(DispatchOutcome.RELAYED);
	}

	private DispatchResult sendFailed(String senderId, String targetId, RelayConnection recipient, IOException cause) {
		if (relayProperties.getOnSendFailure() == SendFailurePolicy.DROP_RECIPIENT) {
			log.warn("Relay from {} to {} failed, dropping stale recipient: {}", senderId, targetId, cause.getMessage());
			connectionRegistry.unregister(targetId, recipient);
			return DispatchResult.of(DispatchOutcome.STALE_RECIPIENT);
		}
		log.warn("Relay from {} to {} failed, terminating sender: {}", senderId, targetId, cause.getMessage());
		return DispatchResult.failed(DispatchOutcome.STALE_RECIPIENT, new StaleRecipientException(targetId, cause));
	}
}
