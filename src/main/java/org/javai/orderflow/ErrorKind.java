package org.javai.orderflow;

import java.util.Locale;

/**
 * Classifies every failure a tool handler or the orchestrator can report.
 *
 * <p>Recoverable kinds are returned to the active stage as structured tool results so the
 * conversation can continue. Terminal kinds end the current turn with a fixed message.</p>
 */
public enum ErrorKind {

	INVALID_QUANTITY(false),
	ITEM_NOT_FOUND(false),
	ITEM_UNAVAILABLE(false),
	INVALID_SIZE(false),
	DISTRICT_NOT_COVERED(false),
	DISTRICT_NOT_CONFIRMED(false),
	ADDRESS_INCOMPLETE(false),
	MISSING_CUSTOMER_INFO(false),
	EMPTY_ORDER(false),
	INVALID_ARGUMENT(false),
	TOOL_NOT_AVAILABLE(false),
	SESSION_CLOSED(true),
	INFERENCE_UNAVAILABLE(true);

	private final boolean terminal;

	ErrorKind(boolean terminal) {
		this.terminal = terminal;
	}

	/**
	 * @return true if this kind ends the turn instead of being reported back to the model
	 */
	public boolean isTerminal() {
		return terminal;
	}

	/**
	 * Wire form used in tool results, e.g. {@code item_not_found}.
	 */
	public String code() {
		return name().toLowerCase(Locale.ROOT);
	}
}
