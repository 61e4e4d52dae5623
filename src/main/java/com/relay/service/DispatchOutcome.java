package com.relay.service;

public enum DispatchOutcome {
	REGISTERED,
	REGISTRATION_REJECTED,
	RELAYED,
	UNKNOWN_RECIPIENT,
	STALE_RECIPIENT,
	DROPPED,
	PROTOCOL_VIOLATION
}
