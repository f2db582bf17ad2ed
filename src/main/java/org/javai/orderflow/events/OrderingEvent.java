package org.javai.orderflow.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured event produced by the orchestration core for an external log sink.
 *
 * @param timestamp when the event happened
 * @param sessionId session the event belongs to
 * @param type event category
 * @param payload event-specific fields, in insertion order; values must be JSON-serializable
 */
public record OrderingEvent(Instant timestamp, String sessionId, EventType type, Map<String, Object> payload) {

	public enum EventType {
		STAGE_TRANSITION,
		TOOL_CALL,
		TRUNCATION,
		SESSION_CLOSED
	}

	public OrderingEvent {
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(type, "type must not be null");
		// LinkedHashMap keeps field order stable in the rendered line and tolerates null values
		payload = payload != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
				: Map.of();
	}
}
