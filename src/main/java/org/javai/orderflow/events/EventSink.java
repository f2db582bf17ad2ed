package org.javai.orderflow.events;

/**
 * Receives ordering events. Formatting and storage belong to the implementation.
 */
@FunctionalInterface
public interface EventSink {

	void emit(OrderingEvent event);

	static EventSink noop() {
		return event -> {
		};
	}
}
