package org.javai.orderflow.session;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded history of raw user and assistant turns for same-stage continuity.
 * The oldest message is evicted once the capacity is reached.
 */
public class ConversationBuffer {

	public static final int DEFAULT_CAPACITY = 20;

	private final int capacity;
	private final Deque<ConversationMessage> messages = new ArrayDeque<>();

	public ConversationBuffer() {
		this(DEFAULT_CAPACITY);
	}

	public ConversationBuffer(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1");
		}
		this.capacity = capacity;
	}

	public void append(ConversationMessage message) {
		messages.addLast(message);
		while (messages.size() > capacity) {
			messages.removeFirst();
		}
	}

	public List<ConversationMessage> messages() {
		return List.copyOf(messages);
	}

	public Optional<String> lastUserText() {
		var iterator = messages.descendingIterator();
		while (iterator.hasNext()) {
			ConversationMessage message = iterator.next();
			if (message.role() == ConversationMessage.Role.USER) {
				return Optional.of(message.text());
			}
		}
		return Optional.empty();
	}

	public void clear() {
		messages.clear();
	}

	public int size() {
		return messages.size();
	}

	public int capacity() {
		return capacity;
	}
}
