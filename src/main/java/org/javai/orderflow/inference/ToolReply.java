package org.javai.orderflow.inference;

import java.util.Objects;

/**
 * Serialized result of one tool call, returned to the model.
 *
 * @param callId id of the call this answers
 * @param toolName wire name of the tool
 * @param content JSON payload
 */
public record ToolReply(String callId, String toolName, String content) {

	public ToolReply {
		Objects.requireNonNull(callId, "callId must not be null");
		Objects.requireNonNull(toolName, "toolName must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}
}
