package com.relay.handler;

import com.relay.connection.WebSocketRelayConnection;
import com.relay.registry.ConnectionRegistry;
import com.relay.service.MessageDispatcher;
import com.relay.session.RelaySession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds container WebSocket callbacks to one {@link RelaySession} per connection.
 * Binary frames are refused by {@link TextWebSocketHandler} with close code 1003.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayWebSocketHandler extends TextWebSocketHandler {

	private final MessageDispatcher messageDispatcher;
	private final ConnectionRegistry connectionRegistry;

	private final Map<String, RelaySession> sessions = new ConcurrentHashMap<>();

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		RelaySession relaySession = new RelaySession(
				new WebSocketRelayConnection(session), messageDispatcher, connectionRegistry);
		sessions.put(session.getId(), relaySession);
		log.info("WebSocket session connected: {} from {} ({} active)",
				session.getId(), session.getRemoteAddress(), sessions.size());
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		RelaySession relaySession = sessions.get(session.getId());
		if (relaySession == null) {
			log.warn("Frame for unknown session {} ignored", session.getId());
			return;
		}
		relaySession.receive(message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
		RelaySession relaySession = sessions.get(session.getId());
		if (relaySession != null) {
			relaySession.terminate(CloseStatus.SERVER_ERROR);
		}
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		RelaySession relaySession = sessions.remove(session.getId());
		if (relaySession != null) {
			relaySession.terminate(status);
		}
		log.info("WebSocket session disconnected: {} ({}, {} active)", session.getId(), status, sessions.size());
	}
}
