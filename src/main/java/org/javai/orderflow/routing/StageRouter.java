package org.javai.orderflow.routing;

import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.Stage;

/**
 * Decides which stage owns the next turn of a session.
 *
 * <p>The decision is a pure function of the session's fields: the same field values always
 * route to the same stage. The previously active stage drives continuity, and the continuity
 * rules are checked before the cold-start rule so a returning session is never bounced back to
 * greeting.</p>
 *
 * <h2>Rules (first match wins)</h2>
 * <ol>
 *   <li>not active → {@link Stage#CLOSED}</li>
 *   <li>location, switched to pickup → ordering if the ledger is empty, else checkout</li>
 *   <li>location, district unconfirmed or address incomplete → location; otherwise checkout
 *   with items, ordering without</li>
 *   <li>checkout → checkout while the ledger has items, else ordering</li>
 *   <li>ordering, delivery with unconfirmed district → location; otherwise ordering</li>
 *   <li>greeting → stays until a mode is chosen, then as for a cold start</li>
 *   <li>cold start → location for unconfirmed delivery, checkout with items, else greeting</li>
 * </ol>
 */
public final class StageRouter {

	public Stage route(SessionRecord session) {
		if (!session.isActive()) {
			return Stage.CLOSED;
		}
		Stage previous = session.activeStage().orElse(null);
		boolean ledgerEmpty = session.ledger().isEmpty();
		boolean pickup = session.mode() == FulfilmentMode.PICKUP;
		boolean deliveryUnconfirmed = session.mode() == FulfilmentMode.DELIVERY && !session.locationConfirmed();

		if (previous == null) {
			return coldStart(session, ledgerEmpty);
		}
		return switch (previous) {
			case LOCATION -> {
				if (pickup) {
					yield ledgerEmpty ? Stage.ORDERING : Stage.CHECKOUT;
				}
				if (!session.locationConfirmed() || !session.addressComplete()) {
					yield Stage.LOCATION;
				}
				yield ledgerEmpty ? Stage.ORDERING : Stage.CHECKOUT;
			}
			case CHECKOUT -> ledgerEmpty ? Stage.ORDERING : Stage.CHECKOUT;
			case ORDERING -> deliveryUnconfirmed ? Stage.LOCATION : Stage.ORDERING;
			case GREETING -> {
				if (!session.modeSelected()) {
					yield Stage.GREETING;
				}
				if (deliveryUnconfirmed) {
					yield Stage.LOCATION;
				}
				yield ledgerEmpty ? Stage.ORDERING : Stage.CHECKOUT;
			}
			case CLOSED -> Stage.CLOSED;
		};
	}

	private static Stage coldStart(SessionRecord session, boolean ledgerEmpty) {
		if (session.modeSelected() && session.mode() == FulfilmentMode.DELIVERY && !session.locationConfirmed()) {
			return Stage.LOCATION;
		}
		if (!ledgerEmpty) {
			return Stage.CHECKOUT;
		}
		return Stage.GREETING;
	}
}
