package com.relay.connection;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * One accepted bidirectional channel, as seen by the registry and the dispatcher.
 */
public interface RelayConnection {

	String getId();

	/**
	 * Sends one text frame, blocking until it is written.
	 *
	 * @throws IOException if the connection is closed or the write fails
	 */
	void send(String frame) throws IOException;

	boolean isOpen();

	void close(CloseStatus status) throws IOException;
}
