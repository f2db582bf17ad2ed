package org.javai.orderflow.context;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.events.EventSink;
import org.javai.orderflow.events.OrderingEvent;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a stage's input under its token ceiling.
 *
 * <p>Input at or under the ceiling is returned as is. Over the ceiling, the first message (the
 * state block or handoff summary) and the last {@code keepLast} messages are kept and everything
 * in between is dropped, and a {@code TRUNCATION} event records the counts. When there is
 * nothing in between to drop the input is returned unchanged with a warning. The current user
 * utterance is always the last message and so always survives.</p>
 */
public class ContextBudgeter {

	private static final Logger logger = LoggerFactory.getLogger(ContextBudgeter.class);

	private final TokenEstimator estimator;
	private final Map<Stage, Integer> ceilings;
	private final int defaultCeiling;
	private final int keepLast;
	private final EventSink eventSink;
	private final Clock clock;

	public ContextBudgeter(TokenEstimator estimator, Map<Stage, Integer> ceilings, int defaultCeiling,
			int keepLast, EventSink eventSink, Clock clock) {
		this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
		this.ceilings = ceilings.isEmpty() ? Map.of() : new EnumMap<>(ceilings);
		if (defaultCeiling < 1) {
			throw new IllegalArgumentException("defaultCeiling must be >= 1");
		}
		if (keepLast < 1) {
			throw new IllegalArgumentException("keepLast must be >= 1");
		}
		this.defaultCeiling = defaultCeiling;
		this.keepLast = keepLast;
		this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public int ceilingFor(Stage stage) {
		return ceilings.getOrDefault(stage, defaultCeiling);
	}

	public int count(AssembledInput input) {
		int total = estimator.count(input.instructions());
		for (ConversationMessage message : input.messages()) {
			total += estimator.count(message.text());
		}
		return total;
	}

	public AssembledInput budget(String sessionId, AssembledInput input) {
		int ceiling = ceilingFor(input.stage());
		int before = count(input);
		if (before <= ceiling) {
			return input;
		}
		List<ConversationMessage> messages = input.messages();
		if (messages.size() <= keepLast + 1) {
			logger.warn("Session {} input for {} is {} tokens (ceiling {}) but has only {} messages; nothing to drop",
					sessionId, input.stage(), before, ceiling, messages.size());
			return input;
		}
		List<ConversationMessage> kept = new ArrayList<>(keepLast + 1);
		kept.add(messages.get(0));
		kept.addAll(messages.subList(messages.size() - keepLast, messages.size()));
		AssembledInput truncated = new AssembledInput(input.stage(), input.instructions(), kept);
		int after = count(truncated);
		int dropped = messages.size() - kept.size();
		logger.info("Session {} truncated {} input: {} -> {} tokens, dropped {} message(s)",
				sessionId, input.stage(), before, after, dropped);

		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("stage", input.stage().wireName());
		payload.put("ceiling", ceiling);
		payload.put("tokens_before", before);
		payload.put("tokens_after", after);
		payload.put("dropped_messages", dropped);
		eventSink.emit(new OrderingEvent(clock.instant(), sessionId, OrderingEvent.EventType.TRUNCATION, payload));
		return truncated;
	}
}
