package org.javai.orderflow.context;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.orderflow.session.PendingItem;
import org.javai.orderflow.session.Stage;

/**
 * One-line task directives given to a stage when it takes over a conversation.
 */
final class TaskDirectives {

	private TaskDirectives() {
	}

	static String directive(Stage from, Stage to, List<PendingItem> pendingItems) {
		if (to == Stage.ORDERING && !pendingItems.isEmpty()) {
			String requested = pendingItems.stream()
					.map(item -> item.quantity() > 1 ? item.quantity() + " x " + item.text() : item.text())
					.collect(Collectors.joining(", "));
			return "Task: the customer already asked for \"" + requested
					+ "\". Search for these items and add them to the order first; do not ask again what they want.";
		}
		if (from == null) {
			return "Task: continue the conversation as the " + to.wireName() + " stage.";
		}
		return switch (from) {
			case GREETING -> switch (to) {
				case LOCATION -> "Task: the customer wants delivery. Validate the delivery district, then collect street and building.";
				case ORDERING -> "Task: help the customer with their order.";
				case CHECKOUT -> "Task: present the order summary and ask for final confirmation.";
				default -> generic(to);
			};
			case LOCATION -> switch (to) {
				case ORDERING -> "Task: the location is settled. Help the customer with their order.";
				case CHECKOUT -> "Task: the delivery location is confirmed. Present the order summary and ask for final confirmation.";
				default -> generic(to);
			};
			case ORDERING -> switch (to) {
				case LOCATION -> "Task: the customer wants delivery. Ask for the delivery district and validate it.";
				case CHECKOUT -> "Task: present the order summary and confirm it with the customer.";
				default -> generic(to);
			};
			case CHECKOUT -> switch (to) {
				case ORDERING -> "Task: the customer wants to change the order. Help with the change, then continue to confirmation.";
				case LOCATION -> "Task: the customer wants delivery. Validate the district; if it is not covered, offer pickup or another district.";
				default -> generic(to);
			};
			default -> generic(to);
		};
	}

	private static String generic(Stage to) {
		return "Task: continue the conversation as the " + to.wireName() + " stage.";
	}
}
