package org.javai.orderflow.context;

import java.util.List;
import java.util.Objects;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;

/**
 * Everything a stage sees for one inference call.
 *
 * @param stage stage that will handle the turn
 * @param instructions stage instructions, constraints included
 * @param messages state block or handoff summary first, current user utterance last
 */
public record AssembledInput(Stage stage, String instructions, List<ConversationMessage> messages) {

	public AssembledInput {
		Objects.requireNonNull(stage, "stage must not be null");
		instructions = instructions != null ? instructions : "";
		messages = List.copyOf(messages);
		if (messages.isEmpty()) {
			throw new IllegalArgumentException("messages must not be empty");
		}
	}

	public ConversationMessage first() {
		return messages.get(0);
	}

	public ConversationMessage last() {
		return messages.get(messages.size() - 1);
	}
}
