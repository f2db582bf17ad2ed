package org.javai.orderflow.orchestration;

import java.util.List;
import java.util.Objects;
import org.javai.orderflow.session.SessionStatus;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.tools.ToolResult;

/**
 * Outcome of one inbound message.
 *
 * @param sessionId session that handled the message
 * @param text reply for the customer
 * @param stage active stage after the turn
 * @param status session status after the turn
 * @param toolResults every tool call applied during the turn, in order
 */
public record TurnResult(String sessionId, String text, Stage stage, SessionStatus status, List<ToolResult> toolResults) {

	public TurnResult {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(stage, "stage must not be null");
		Objects.requireNonNull(status, "status must not be null");
		text = text == null ? "" : text;
		toolResults = List.copyOf(Objects.requireNonNull(toolResults, "toolResults must not be null"));
	}

	public boolean isClosed() {
		return status != SessionStatus.ACTIVE;
	}
}
