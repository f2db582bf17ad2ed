package org.javai.orderflow.tools;

import java.util.Objects;

/**
 * A tool invocation requested by the model.
 *
 * @param id correlation id assigned by the model provider
 * @param name tool name as sent by the model
 * @param arguments raw JSON arguments
 */
public record ToolCall(String id, String name, String arguments) {

	public ToolCall {
		Objects.requireNonNull(name, "name must not be null");
		id = id != null ? id : "";
		arguments = arguments == null || arguments.isBlank() ? "{}" : arguments;
	}
}
