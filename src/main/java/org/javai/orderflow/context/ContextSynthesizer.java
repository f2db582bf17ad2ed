package org.javai.orderflow.context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.orderflow.ledger.LineItem;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.PendingHandoff;
import org.javai.orderflow.session.PendingItem;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.Stage;

/**
 * Builds the context a stage sees from the session record.
 *
 * <p>Two artifacts are produced:</p>
 * <ul>
 *   <li>the <b>state block</b>, a deterministic snapshot of the session regenerated every turn
 *   and placed first in the stage input;</li>
 *   <li>the <b>handoff summary</b>, used only on the first turn after a stage change. It carries
 *   the state block, a task directive and the last customer utterance. Nothing of the outgoing
 *   stage's instructions or tool history is forwarded.</li>
 * </ul>
 *
 * <pre>{@code
 * <SESSION_STATE>
 * customer name: سارة
 * phone: not set
 * mode: delivery
 * district: النرجس (fee 15, eta 30-45 دقيقة)
 * order:
 * - 2 x برجر لحم وسط = 44
 * subtotal: 44
 * </SESSION_STATE>
 * }</pre>
 */
public class ContextSynthesizer {

	static final String NOT_SET = "not set";

	public String stateBlock(SessionRecord session) {
		List<String> lines = new ArrayList<>();
		lines.add("<SESSION_STATE>");
		lines.add("customer name: " + session.customerName().orElse(NOT_SET));
		lines.add("phone: " + session.phoneNumber().orElse(NOT_SET));
		if (!session.modeSelected()) {
			lines.add("mode: not chosen");
		}
		else {
			lines.add("mode: " + session.mode().wireName());
			if (session.mode() == FulfilmentMode.DELIVERY) {
				if (session.locationConfirmed()) {
					lines.add("district: " + session.district().orElse(NOT_SET)
							+ " (fee " + session.deliveryFee().map(fee -> fee.toPlainString()).orElse("0")
							+ ", eta " + session.estimatedTime().orElse(NOT_SET) + ")");
					lines.add("address: " + (session.addressComplete() ? session.fullAddress() : "incomplete"));
				}
				else {
					lines.add("location: not confirmed");
				}
			}
		}
		List<LineItem> items = session.ledger().lines();
		if (items.isEmpty()) {
			lines.add("order: empty");
		}
		else {
			lines.add("order:");
			items.forEach(item -> lines.add("- " + item.describe()));
			lines.add("subtotal: " + session.ledger().total().toPlainString());
		}
		List<PendingItem> pending = session.pendingItems();
		if (!pending.isEmpty()) {
			lines.add("pending request: \"" + pending.stream().map(PendingItem::text).collect(Collectors.joining(", ")) + "\"");
		}
		List<String> constraints = session.constraints();
		if (!constraints.isEmpty()) {
			lines.add("constraints:");
			constraints.forEach(constraint -> lines.add("- " + constraint));
		}
		session.orderId().ifPresent(orderId -> lines.add("order id: " + orderId));
		lines.add("</SESSION_STATE>");
		return String.join("\n", lines);
	}

	/**
	 * Renders the handoff summary. A handoff into ordering consumes the pending-items buffer:
	 * the items move into the directive and the buffer is cleared.
	 */
	public String handoffSummary(SessionRecord session, PendingHandoff handoff) {
		Objects.requireNonNull(handoff, "handoff must not be null");
		List<PendingItem> pending = handoff.to() == Stage.ORDERING ? session.drainPendingItems() : List.of();
		StringBuilder sb = new StringBuilder(stateBlock(session));
		sb.append("\n\n").append(TaskDirectives.directive(handoff.from(), handoff.to(), pending));
		if (!handoff.lastUserUtterance().isBlank()) {
			sb.append("\n\nlast customer message: ").append(handoff.lastUserUtterance());
		}
		return sb.toString();
	}

	/**
	 * Assembles the stage input for a turn.
	 *
	 * @param handoff the handoff to render, or null for a same-stage turn
	 */
	public AssembledInput assemble(SessionRecord session, Stage stage, String instructions,
			String userText, PendingHandoff handoff) {
		List<ConversationMessage> messages = new ArrayList<>();
		if (handoff != null) {
			messages.add(ConversationMessage.context(handoffSummary(session, handoff)));
		}
		else {
			messages.add(ConversationMessage.context(stateBlock(session)));
			messages.addAll(session.buffer().messages());
		}
		if (userText != null && !userText.isBlank()) {
			messages.add(ConversationMessage.user(userText));
		}
		return new AssembledInput(stage, instructions, messages);
	}
}
