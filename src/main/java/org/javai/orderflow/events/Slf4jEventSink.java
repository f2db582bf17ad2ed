package org.javai.orderflow.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON line to the {@code orderflow.events} logger.
 *
 * <p>With redaction on, payload values under customer-identifying keys are replaced by
 * {@code ***} before rendering.</p>
 */
public class Slf4jEventSink implements EventSink {

	public static final String LOGGER_NAME = "orderflow.events";
	static final Set<String> REDACTED_KEYS = Set.of("phone", "address", "street", "building");
	static final String REDACTION = "***";

	private static final Logger events = LoggerFactory.getLogger(LOGGER_NAME);
	private static final Logger logger = LoggerFactory.getLogger(Slf4jEventSink.class);

	private final ObjectMapper objectMapper;
	private final boolean redact;

	public Slf4jEventSink(ObjectMapper objectMapper, boolean redact) {
		this.objectMapper = objectMapper;
		this.redact = redact;
	}

	@Override
	public void emit(OrderingEvent event) {
		events.info(render(event));
	}

	String render(OrderingEvent event) {
		ObjectNode node = objectMapper.createObjectNode();
		node.put("timestamp", event.timestamp().toString());
		node.put("session_id", event.sessionId());
		node.put("event_type", event.type().name().toLowerCase(Locale.ROOT));
		node.set("payload", objectMapper.valueToTree(redact ? redacted(event.payload()) : event.payload()));
		try {
			return objectMapper.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			logger.warn("Could not render {} event for session {}", event.type(), event.sessionId(), e);
			return event.toString();
		}
	}

	private static Map<String, Object> redacted(Map<String, Object> payload) {
		Map<String, Object> copy = new LinkedHashMap<>();
		payload.forEach((key, value) -> copy.put(key, REDACTED_KEYS.contains(key) && value != null ? REDACTION : value));
		return copy;
	}
}
