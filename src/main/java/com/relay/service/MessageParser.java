package com.relay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.relay.dto.InboundMessage;
import com.relay.exception.ProtocolViolationException;
import org.springframework.stereotype.Component;

/**
 * Reads a text frame as a JSON object. Only {@code type}, {@code id} and {@code to} are
 * interpreted; the rest of the frame is left alone.
 */
@Component
public class MessageParser {

	private final ObjectMapper objectMapper = JsonMapper.builder()
			.enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.build();

	public InboundMessage parse(String frame) {
		JsonNode root;
		try {
			root = objectMapper.readTree(frame);
		} catch (JsonProcessingException e) {
			throw new ProtocolViolationException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new ProtocolViolationException("Frame is not a JSON object");
		}

		JsonNode type = root.get("type");
		if (type == null) {
			throw new ProtocolViolationException("Frame has no 'type' field");
		}
		boolean registration = type.isTextual() && InboundMessage.REGISTER_TYPE.equals(type.textValue());

		String clientId = null;
		if (registration) {
			JsonNode id = root.get("id");
			if (id == null || !id.isTextual()) {
				throw new ProtocolViolationException("Registration frame needs a string 'id'");
			}
			clientId = id.textValue();
		}

		JsonNode to = root.get("to");
		return InboundMessage.builder()
				.type(type.isTextual() ? type.textValue() : type.toString())
				.registration(registration)
				.clientId(clientId)
				.target(to != null && to.isTextual() ? to.textValue() : null)
				.rawFrame(frame)
				.build();
	}
}
