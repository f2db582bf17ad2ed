package org.javai.orderflow.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of an order.
 *
 * @param catalogId catalog identifier of the item
 * @param displayName name shown to the customer
 * @param quantity number of units, 1 to 10
 * @param unitPrice price per unit for the chosen size
 * @param size chosen size, null for unsized items
 * @param notes customer notes for this line, null if none
 */
public record LineItem(
		String catalogId,
		String displayName,
		int quantity,
		BigDecimal unitPrice,
		String size,
		String notes
) {

	public LineItem {
		Objects.requireNonNull(catalogId, "catalogId must not be null");
		Objects.requireNonNull(displayName, "displayName must not be null");
		Objects.requireNonNull(unitPrice, "unitPrice must not be null");
		if (quantity < OrderLedger.MIN_QUANTITY || quantity > OrderLedger.MAX_QUANTITY) {
			throw new IllegalArgumentException("quantity must be between 1 and 10");
		}
		size = blankToNull(size);
		notes = blankToNull(notes);
	}

	public BigDecimal lineTotal() {
		return unitPrice.multiply(BigDecimal.valueOf(quantity));
	}

	boolean sameChoice(LineItem other) {
		return catalogId.equals(other.catalogId)
				&& Objects.equals(size, other.size)
				&& Objects.equals(notes, other.notes);
	}

	/**
	 * Renders as {@code 2 x برجر لحم كبير = 54}.
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		sb.append(quantity).append(" x ").append(displayName);
		if (size != null) {
			sb.append(' ').append(size);
		}
		if (notes != null) {
			sb.append(" (").append(notes).append(')');
		}
		sb.append(" = ").append(lineTotal().toPlainString());
		return sb.toString();
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}
}
