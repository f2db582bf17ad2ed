package org.javai.orderflow.inference;

import java.util.List;
import java.util.Objects;
import org.javai.orderflow.tools.ToolCall;

/**
 * What the model returned for one round.
 *
 * @param text assistant text, empty when the model only issued tool calls
 * @param toolCalls requested tool calls in the order the model issued them
 */
public record InferenceResponse(String text, List<ToolCall> toolCalls) {

	public InferenceResponse {
		text = text == null ? "" : text;
		toolCalls = List.copyOf(Objects.requireNonNull(toolCalls, "toolCalls must not be null"));
	}

	public static InferenceResponse text(String text) {
		return new InferenceResponse(text, List.of());
	}

	public static InferenceResponse calls(ToolCall... calls) {
		return new InferenceResponse("", List.of(calls));
	}

	public boolean hasToolCalls() {
		return !toolCalls.isEmpty();
	}
}
