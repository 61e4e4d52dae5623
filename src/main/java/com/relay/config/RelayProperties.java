package com.relay.config;

import com.relay.registry.ConflictResolution;
import com.relay.service.SendFailurePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

	/**
	 * WebSocket endpoint path pattern. The default accepts upgrades on any path.
	 */
	@NotBlank(message = "Endpoint path is required")
	private String path = "/**";

	@NotEmpty(message = "At least one allowed origin pattern is required")
	private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

	/**
	 * What happens when a client registers an id another connection already holds.
	 */
	@NotNull(message = "Conflict resolution is required")
	private ConflictResolution onConflict = ConflictResolution.OVERWRITE;

	/**
	 * What happens when forwarding to a looked-up recipient fails.
	 */
	@NotNull(message = "Send failure policy is required")
	private SendFailurePolicy onSendFailure = SendFailurePolicy.FAIL_SENDER;

	@Min(value = 1024, message = "Max text message size must be at least 1KB")
	private int maxTextMessageSize = 1024 * 1024;

	@Min(value = 1000, message = "Stats interval must be at least 1000ms")
	private long statsIntervalMs = 30_000L;

}
