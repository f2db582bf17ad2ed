package org.javai.orderflow.session;

import java.util.Objects;

/**
 * Free-text order hint captured before the ordering stage, e.g. "اثنين كبسة لحم".
 */
public record PendingItem(String text, int quantity) {

	public PendingItem {
		Objects.requireNonNull(text, "text must not be null");
		if (text.isBlank()) {
			throw new IllegalArgumentException("text must not be blank");
		}
		if (quantity < 1) {
			throw new IllegalArgumentException("quantity must be >= 1");
		}
	}
}
