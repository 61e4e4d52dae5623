package com.relay.connection;

import lombok.RequiredArgsConstructor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

@RequiredArgsConstructor
public class WebSocketRelayConnection implements RelayConnection {

	private final WebSocketSession session;

	@Override
	public String getId() {
		return session.getId();
	}

	@Override
	public void send(String frame) throws IOException {
		// The container rejects concurrent writes on one session; senders queue here
		synchronized (session) {
			if (!session.isOpen()) {
				throw new IOException("Connection " + session.getId() + " is closed");
			}
			try {
				session.sendMessage(new TextMessage(frame));
			} catch (IllegalStateException e) {
				throw new IOException("Connection " + session.getId() + " is not writable: " + e.getMessage(), e);
			}
		}
	}

	@Override
	public boolean isOpen() {
		return session.isOpen();
	}

	@Override
	public void close(CloseStatus status) throws IOException {
		session.close(status);
	}

	@Override
	public String toString() {
		return "WebSocketRelayConnection[" + session.getId() + ", " + session.getRemoteAddress() + "]";
	}
}
