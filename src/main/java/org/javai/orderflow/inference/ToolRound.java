package org.javai.orderflow.inference;

import java.util.List;
import java.util.Objects;
import org.javai.orderflow.tools.ToolCall;

/**
 * One completed tool round inside a turn: what the model asked for and what it got back.
 *
 * @param assistantText text the model sent alongside the calls, possibly empty
 * @param calls the calls the model issued
 * @param replies results in the order they were applied
 */
public record ToolRound(String assistantText, List<ToolCall> calls, List<ToolReply> replies) {

	public ToolRound {
		assistantText = assistantText == null ? "" : assistantText;
		calls = List.copyOf(Objects.requireNonNull(calls, "calls must not be null"));
		replies = List.copyOf(Objects.requireNonNull(replies, "replies must not be null"));
	}
}
