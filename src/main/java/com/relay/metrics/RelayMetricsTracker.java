package com.relay.metrics;

import com.relay.registry.ConnectionRegistry;
import com.relay.service.DispatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts dispatch outcomes so relay traffic can be followed without a log line per frame.
 * Logs a summary per window, only when there was activity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayMetricsTracker {

	private final ConnectionRegistry connectionRegistry;

	private final Map<DispatchOutcome, LongAdder> counters = newCounters();
	private final AtomicLong lastLogTime = new AtomicLong(System.currentTimeMillis());

	private static Map<DispatchOutcome, LongAdder> newCounters() {
		Map<DispatchOutcome, LongAdder> counters = new EnumMap<>(DispatchOutcome.class);
		for (DispatchOutcome outcome : DispatchOutcome.values()) {
			counters.put(outcome, new LongAdder());
		}
		return counters;
	}

	public void record(DispatchOutcome outcome) {
		counters.get(outcome).increment();
	}

	public long count(DispatchOutcome outcome) {
		return counters.get(outcome).sum();
	}

	@Scheduled(fixedRateString = "${relay.stats-interval-ms:30000}")
	public void logRelayStats() {
		Map<DispatchOutcome, Long> window = new EnumMap<>(DispatchOutcome.class);
		long frames = 0;
		for (Map.Entry<DispatchOutcome, LongAdder> entry : counters.entrySet()) {
			long value = entry.getValue().sumThenReset();
			window.put(entry.getKey(), value);
			frames += value;
		}
		long now = System.currentTimeMillis();
		long windowMs = now - lastLogTime.getAndSet(now);

		if (frames == 0 || windowMs <= 0) {
			return;
		}

		log.info("Relay server stats: frames={}, relayed={}, unknownRecipient={}, staleRecipient={}, dropped={}, registered={}, rejected={}, protocolViolations={}, registeredClients={}, window={}ms",
				frames,
				window.get(DispatchOutcome.RELAYED),
				window.get(DispatchOutcome.UNKNOWN_RECIPIENT),
				window.get(DispatchOutcome.STALE_RECIPIENT),
				window.get(DispatchOutcome.DROPPED),
				window.get(DispatchOutcome.REGISTERED),
				window.get(DispatchOutcome.REGISTRATION_REJECTED),
				window.get(DispatchOutcome.PROTOCOL_VIOLATION),
				connectionRegistry.size(),
				windowMs);
	}
}
