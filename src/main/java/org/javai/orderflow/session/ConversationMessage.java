package org.javai.orderflow.session;

import java.util.Objects;

/**
 * One message of the assembled stage input.
 *
 * @param role who produced the text
 * @param text message text
 */
public record ConversationMessage(Role role, String text) {

	public enum Role {
		/** Synthesized state block or handoff summary. */
		CONTEXT,
		USER,
		ASSISTANT
	}

	public ConversationMessage {
		Objects.requireNonNull(role, "role must not be null");
		text = text != null ? text : "";
	}

	public static ConversationMessage user(String text) {
		return new ConversationMessage(Role.USER, text);
	}

	public static ConversationMessage assistant(String text) {
		return new ConversationMessage(Role.ASSISTANT, text);
	}

	public static ConversationMessage context(String text) {
		return new ConversationMessage(Role.CONTEXT, text);
	}
}
