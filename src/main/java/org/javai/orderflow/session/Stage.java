package org.javai.orderflow.session;

import java.util.Locale;

/**
 * Conversational phases. Each stage has its own instructions and tool surface.
 *
 * <p>{@link #CLOSED} is the terminal no-op stage for sessions that are no longer active.</p>
 */
public enum Stage {

	GREETING,
	LOCATION,
	ORDERING,
	CHECKOUT,
	CLOSED;

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isTerminal() {
		return this == CLOSED;
	}
}
