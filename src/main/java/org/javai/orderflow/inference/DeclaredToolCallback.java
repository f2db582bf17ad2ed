package org.javai.orderflow.inference;

import java.util.Objects;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Exposes a tool definition to the model without executing it. Tool calls are returned to the
 * orchestrator, which applies them under the session lock.
 */
final class DeclaredToolCallback implements ToolCallback {

	private final ToolDefinition definition;

	DeclaredToolCallback(ToolDefinition definition) {
		this.definition = Objects.requireNonNull(definition, "definition must not be null");
	}

	@Override
	public ToolDefinition getToolDefinition() {
		return definition;
	}

	@Override
	public String call(String toolInput) {
		throw new IllegalStateException("Tool '" + definition.name() + "' is applied by the orchestrator, not the model client");
	}
}
