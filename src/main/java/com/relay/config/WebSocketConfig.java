package com.relay.config;

import com.relay.handler.RelayWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

	private final RelayWebSocketHandler relayWebSocketHandler;
	private final RelayProperties relayProperties;

	@Value("${server.address:0.0.0.0}")
	private String bindAddress;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		// Plain WebSocket, no STOMP/SockJS: frames must reach the recipient byte-for-byte
		registry.addHandler(relayWebSocketHandler, relayProperties.getPath())
				.setAllowedOriginPatterns(relayProperties.getAllowedOriginPatterns().toArray(new String[0]));
		log.info("Relay endpoint registered on path {}", relayProperties.getPath());
	}

	/**
	 * Servlet container WebSocket limits.
	 * <p>
	 * Idle timeout is 0 (infinite): a registered but silent client is held until it disconnects.
	 * Without raising the text buffer the container rejects frames above its 8KB default.
	 */
	@Bean
	public ServletServerContainerFactoryBean createWebSocketContainer() {
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxTextMessageBufferSize(relayProperties.getMaxTextMessageSize());
		container.setMaxSessionIdleTimeout(0L);
		log.info("ServletServerContainerFactoryBean configured: maxTextMessageBufferSize={}B, idleTimeout=none",
				relayProperties.getMaxTextMessageSize());
		return container;
	}

	@EventListener
	public void onWebServerReady(WebServerInitializedEvent event) {
		log.info("Relay server started on ws://{}:{}", bindAddress, event.getWebServer().getPort());
	}

}
