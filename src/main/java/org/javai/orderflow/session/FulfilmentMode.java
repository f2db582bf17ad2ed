package org.javai.orderflow.session;

import java.util.Locale;
import java.util.Optional;

/**
 * How the customer receives the order.
 */
public enum FulfilmentMode {

	DELIVERY,
	PICKUP;

	/**
	 * Parses {@code delivery}/{@code pickup} and their Arabic forms (توصيل, استلام).
	 */
	public static Optional<FulfilmentMode> parse(String value) {
		if (value == null) {
			return Optional.empty();
		}
		String v = value.trim().toLowerCase(Locale.ROOT);
		return switch (v) {
			case "delivery", "توصيل" -> Optional.of(DELIVERY);
			case "pickup", "استلام" -> Optional.of(PICKUP);
			default -> Optional.empty();
		};
	}

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
