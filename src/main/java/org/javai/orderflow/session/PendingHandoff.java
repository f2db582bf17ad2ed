package org.javai.orderflow.session;

import java.util.Objects;

/**
 * A stage change decided at the end of one turn, rendered into context at the start of the next.
 *
 * @param from stage that handled the previous turn, null for a cold start
 * @param to stage that will handle the next turn
 * @param lastUserUtterance most recent customer message before the change
 */
public record PendingHandoff(Stage from, Stage to, String lastUserUtterance) {

	public PendingHandoff {
		Objects.requireNonNull(to, "to must not be null");
		lastUserUtterance = lastUserUtterance != null ? lastUserUtterance : "";
	}
}
