package com.relay.service;

import com.relay.config.RelayProperties;
import com.relay.connection.RecordingConnection;
import com.relay.exception.ProtocolViolationException;
import com.relay.exception.StaleRecipientException;
import com.relay.metrics.RelayMetricsTracker;
import com.relay.registry.ConflictResolution;
import com.relay.registry.ConnectionRegistry;
import com.relay.registry.RegistrationConflictPolicy;
import com.relay.session.RelaySession;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageDispatcherTest {

	private static final String CHAT_TO_ALICE = "{\"type\":\"chat\",\"to\":\"alice\",\"text\":\"hi\"}";

	private final RelayProperties properties = new RelayProperties();
	private ConnectionRegistry registry = registry(ConflictResolution.OVERWRITE);
	private RelayMetricsTracker metrics = new RelayMetricsTracker(registry);
	private MessageDispatcher dispatcher = new MessageDispatcher(new MessageParser(), registry, properties, metrics);

	private ConnectionRegistry registry(ConflictResolution resolution) {
		return new ConnectionRegistry(RegistrationConflictPolicy.always(resolution));
	}

	private void useConflictResolution(ConflictResolution resolution) {
		registry = registry(resolution);
		metrics = new RelayMetricsTracker(registry);
		dispatcher = new MessageDispatcher(new MessageParser(), registry, properties, metrics);
	}

	private RelaySession session(RecordingConnection connection) {
		return new RelaySession(connection, dispatcher, registry);
	}

	private RelaySession registered(String clientId, RecordingConnection connection) {
		RelaySession session = session(connection);
		session.receive("{\"type\":\"register\",\"id\":\"" + clientId + "\"}");
		return session;
	}

	@Test
	void registrationAddsEntryAndSendsNothingBack() {
		RecordingConnection a = new RecordingConnection("A");

		DispatchResult result = dispatcher.dispatch(session(a), "{\"type\":\"register\",\"id\":\"alice\"}");

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.REGISTERED);
		assertThat(result.getClientId()).isEqualTo("alice");
		assertThat(result.isFatal()).isFalse();
		assertThat(registry.lookup("alice")).containsSame(a);
		assertThat(a.getSent()).isEmpty();
		assertThat(metrics.count(DispatchOutcome.REGISTERED)).isEqualTo(1);
	}

	@Test
	void relaysRawFrameToRegisteredTarget() {
		RecordingConnection a = new RecordingConnection("A");
		RecordingConnection b = new RecordingConnection("B");
		registered("alice", a);
		RelaySession bob = registered("bob", b);

		DispatchResult result = dispatcher.dispatch(bob, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.RELAYED);
		assertThat(a.getSent()).containsExactly(CHAT_TO_ALICE);
		assertThat(b.getSent()).isEmpty();
	}

	@Test
	void anyTypeWithTargetIsRelayed() {
		RecordingConnection a = new RecordingConnection("A");
		registered("alice", a);
		RelaySession bob = registered("bob", new RecordingConnection("B"));
		String frame = "{\"type\":\"offer\",\"to\":\"alice\",\"sdp\":{\"v\":0}}";

		dispatcher.dispatch(bob, frame);

		assertThat(a.getSent()).containsExactly(frame);
	}

	@Test
	void unknownRecipientIsDroppedWithoutFailure() {
		RelaySession bob = registered("bob", new RecordingConnection("B"));

		DispatchResult result = dispatcher.dispatch(bob, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.UNKNOWN_RECIPIENT);
		assertThat(result.isFatal()).isFalse();
	}

	@Test
	void unidentifiedSenderIsDropped() {
		RecordingConnection a = new RecordingConnection("A");
		registered("alice", a);
		RelaySession stranger = session(new RecordingConnection("C"));

		DispatchResult result = dispatcher.dispatch(stranger, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.DROPPED);
		assertThat(a.getSent()).isEmpty();
	}

	@Test
	void frameWithoutTargetIsDropped() {
		RelaySession bob = registered("bob", new RecordingConnection("B"));

		DispatchResult result = dispatcher.dispatch(bob, "{\"type\":\"ping\"}");

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.DROPPED);
	}

	@Test
	void frameAddressedToSenderIsNotEchoed() {
		RecordingConnection a = new RecordingConnection("A");
		RelaySession alice = registered("alice", a);

		DispatchResult result = dispatcher.dispatch(alice, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.DROPPED);
		assertThat(a.getSent()).isEmpty();
	}

	@Test
	void malformedFrameIsFatalProtocolViolation() {
		DispatchResult result = dispatcher.dispatch(session(new RecordingConnection("D")), "not-json");

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.PROTOCOL_VIOLATION);
		assertThat(result.isFatal()).isTrue();
		assertThat(result.getFailure()).get().isInstanceOf(ProtocolViolationException.class);
		assertThat(metrics.count(DispatchOutcome.PROTOCOL_VIOLATION)).isEqualTo(1);
	}

	@Test
	void brokenRecipientFailsTheSenderByDefault() {
		RecordingConnection a = new RecordingConnection("A");
		registered("alice", a);
		RelaySession bob = registered("bob", new RecordingConnection("B"));
		a.breakTransport();

		DispatchResult result = dispatcher.dispatch(bob, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.STALE_RECIPIENT);
		assertThat(result.getFailure()).get().isInstanceOf(StaleRecipientException.class);
		assertThat(registry.lookup("alice")).containsSame(a);
	}

	@Test
	void dropRecipientPolicyUnregistersDeadTarget() {
		properties.setOnSendFailure(SendFailurePolicy.DROP_RECIPIENT);
		RecordingConnection a = new RecordingConnection("A");
		registered("alice", a);
		RelaySession bob = registered("bob", new RecordingConnection("B"));
		a.breakTransport();

		DispatchResult result = dispatcher.dispatch(bob, CHAT_TO_ALICE);

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.STALE_RECIPIENT);
		assertThat(result.isFatal()).isFalse();
		assertThat(registry.isRegistered("alice")).isFalse();
	}

	@Test
	void rejectedRegistrationLeavesSessionUnidentified() {
		useConflictResolution(ConflictResolution.REJECT);
		RecordingConnection a = new RecordingConnection("A");
		registered("alice", a);
		RelaySession impostor = session(new RecordingConnection("X"));

		DispatchResult result = dispatcher.dispatch(impostor, "{\"type\":\"register\",\"id\":\"alice\"}");

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.REGISTRATION_REJECTED);
		assertThat(result.getClientId()).isNull();
		assertThat(registry.lookup("alice")).containsSame(a);
	}

	@Test
	void evictionClosesPreviousHolder() {
		useConflictResolution(ConflictResolution.EVICT);
		RecordingConnection first = new RecordingConnection("A1");
		RecordingConnection second = new RecordingConnection("A2");
		registered("alice", first);

		DispatchResult result = dispatcher.dispatch(session(second), "{\"type\":\"register\",\"id\":\"alice\"}");

		assertThat(result.getOutcome()).isEqualTo(DispatchOutcome.REGISTERED);
		assertThat(first.isOpen()).isFalse();
		assertThat(first.getCloseStatus()).isEqualTo(MessageDispatcher.EVICTED);
		assertThat(registry.lookup("alice")).containsSame(second);
	}
}
