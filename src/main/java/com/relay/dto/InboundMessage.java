package com.relay.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Parsed view of one inbound frame. {@link #getRawFrame()} is what gets relayed.
 */
@Getter
@Builder
@ToString(exclude = "rawFrame")
public class InboundMessage {

	public static final String REGISTER_TYPE = "register";

	private final String type;

	private final boolean registration;

	/**
	 * Claimed client id, set for registrations only.
	 */
	private final String clientId;

	/**
	 * Relay target, null when the frame has no string {@code to} field.
	 */
	private final String target;

	private final String rawFrame;

	public boolean hasTarget() {
		return target != null;
	}
}
