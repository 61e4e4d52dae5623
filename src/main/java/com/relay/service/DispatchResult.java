package com.relay.service;

import com.relay.exception.RelayException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of dispatching one frame. A result carrying a failure ends the sending session.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchResult {

	private final DispatchOutcome outcome;

	/**
	 * Id the session now holds; set for {@link DispatchOutcome#REGISTERED} only.
	 */
	private final String clientId;

	private final RelayException failure;

	public static DispatchResult of(DispatchOutcome outcome) {
		return new DispatchResult(outcome, null, null);
	}

	public static DispatchResult registered(String clientId) {
		return new DispatchResult(DispatchOutcome.REGISTERED, clientId, null);
	}

	public static DispatchResult failed(DispatchOutcome outcome, RelayException failure) {
		return new DispatchResult(outcome, null, failure);
	}

	public boolean isFatal() {
		return failure != null;
	}

	public Optional<RelayException> getFailure() {
		return Optional.ofNullable(failure);
	}
}
