package org.javai.orderflow.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;

/**
 * Structured outcome of a tool call, returned to the model as JSON.
 *
 * @param callId id of the tool call this answers
 * @param tool wire name of the tool
 * @param success whether the call succeeded
 * @param error failure kind, null on success
 * @param message short human-readable outcome
 * @param data result fields or failure details
 */
public record ToolResult(
		String callId,
		String tool,
		boolean success,
		ErrorKind error,
		String message,
		Map<String, Object> data
) {

	public ToolResult {
		data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
		message = message != null ? message : "";
	}

	public static ToolResult success(ToolCall call, String message, Map<String, Object> data) {
		return new ToolResult(call.id(), call.name(), true, null, message, data);
	}

	public static ToolResult failure(ToolCall call, OrderingException e) {
		return new ToolResult(call.id(), call.name(), false, e.kind(), e.getMessage(), e.details());
	}

	public boolean isError() {
		return !success;
	}
}
