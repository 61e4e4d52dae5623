package com.relay.registry;

import com.relay.connection.RelayConnection;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@RequiredArgsConstructor
public class RegistrationResult {

	public enum Outcome {
		CREATED,
		UNCHANGED,
		OVERWRITTEN,
		EVICTED,
		REJECTED
	}

	private final Outcome outcome;
	private final RelayConnection previousHolder;

	public boolean isAccepted() {
		return outcome != Outcome.REJECTED;
	}

	/**
	 * Connection that must be closed by the caller, present only for {@link Outcome#EVICTED}.
	 */
	public Optional<RelayConnection> getEvicted() {
		return outcome == Outcome.EVICTED ? Optional.of(previousHolder) : Optional.empty();
	}
}
