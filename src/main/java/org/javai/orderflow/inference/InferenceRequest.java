package org.javai.orderflow.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.orderflow.context.AssembledInput;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Everything one model round needs.
 *
 * @param sessionId session the round belongs to, for logging
 * @param stage stage whose model and tools apply
 * @param instructions stage instructions
 * @param messages conversation input after budgeting
 * @param tools tools the stage may call
 * @param rounds tool rounds already completed in this turn
 */
public record InferenceRequest(
		String sessionId,
		Stage stage,
		String instructions,
		List<ConversationMessage> messages,
		List<ToolDefinition> tools,
		List<ToolRound> rounds) {

	public InferenceRequest {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(stage, "stage must not be null");
		Objects.requireNonNull(instructions, "instructions must not be null");
		messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
		tools = List.copyOf(Objects.requireNonNull(tools, "tools must not be null"));
		rounds = List.copyOf(Objects.requireNonNull(rounds, "rounds must not be null"));
	}

	public static InferenceRequest of(String sessionId, AssembledInput input, List<ToolDefinition> tools) {
		return new InferenceRequest(sessionId, input.stage(), input.instructions(), input.messages(), tools, List.of());
	}

	/**
	 * Same request with one more completed tool round.
	 */
	public InferenceRequest withRound(ToolRound round) {
		List<ToolRound> next = new ArrayList<>(rounds);
		next.add(Objects.requireNonNull(round, "round must not be null"));
		return new InferenceRequest(sessionId, stage, instructions, messages, tools, next);
	}
}
