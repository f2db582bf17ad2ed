package org.javai.orderflow.tools;

import java.util.Map;

/**
 * What a handler returns on success; the dispatcher turns it into a {@link ToolResult}.
 */
record ToolOutcome(String message, Map<String, Object> data) {

	static ToolOutcome of(String message, Map<String, Object> data) {
		return new ToolOutcome(message, data);
	}

	static ToolOutcome of(String message) {
		return new ToolOutcome(message, Map.of());
	}
}
