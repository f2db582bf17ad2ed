package org.javai.orderflow;

import java.util.Map;
import java.util.Objects;

/**
 * Raised by ledger, catalog, location and checkout operations when a request cannot be honoured.
 *
 * <p>The {@link ErrorKind} decides how the orchestrator treats the failure; {@code details}
 * carries structured hints (suggestions, missing fields) that are forwarded to the model.</p>
 */
public class OrderingException extends RuntimeException {

	private final ErrorKind kind;
	private final Map<String, Object> details;

	public OrderingException(ErrorKind kind, String message) {
		this(kind, message, Map.of(), null);
	}

	public OrderingException(ErrorKind kind, String message, Map<String, Object> details) {
		this(kind, message, details, null);
	}

	public OrderingException(ErrorKind kind, String message, Throwable cause) {
		this(kind, message, Map.of(), cause);
	}

	public OrderingException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.details = details != null ? Map.copyOf(details) : Map.of();
	}

	public ErrorKind kind() {
		return kind;
	}

	public Map<String, Object> details() {
		return details;
	}

	public boolean isTerminal() {
		return kind.isTerminal();
	}

	public static OrderingException sessionClosed(String sessionId) {
		return new OrderingException(ErrorKind.SESSION_CLOSED, "Session " + sessionId + " is closed");
	}
}
