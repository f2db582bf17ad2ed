package org.javai.orderflow.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.catalog.CatalogIndex;
import org.javai.orderflow.catalog.CatalogItem;
import org.javai.orderflow.catalog.NameSelector;
import org.javai.orderflow.catalog.TextNormalizer;

/**
 * The mutable cart of a session.
 *
 * <p>Every operation validates its whole request before touching the lines, so a failed call
 * leaves the ledger exactly as it was. The total is always computed from the current lines.</p>
 *
 * <h2>Selectors</h2>
 * <p>{@link #modify} and {@link #remove} address a line by a selector string: either a 1-based
 * position ("2", "٢") or a loose name ("البرجر"). Name selectors match by normalized containment
 * in either direction, then by any selector word longer than two characters. A selector must
 * resolve to exactly one line; anything else fails with {@link ErrorKind#ITEM_NOT_FOUND}. Lines
 * that are indistinguishable (same item, size and notes) count as one match, and the most
 * recently added of them is chosen.</p>
 *
 * <p>Once {@link #close() closed} the ledger rejects every change with
 * {@link ErrorKind#SESSION_CLOSED}.</p>
 *
 * <p>Not thread-safe; a ledger is owned by one session and guarded by the session lock.</p>
 */
public class OrderLedger {

	public static final int MIN_QUANTITY = 1;
	public static final int MAX_QUANTITY = 10;

	private final CatalogIndex catalog;
	private final List<LineItem> lines = new ArrayList<>();
	private boolean closed;

	public OrderLedger(CatalogIndex catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
	}

	/**
	 * Appends a line for the item. Repeated adds of the same choice give separate lines.
	 *
	 * @return the new line
	 */
	public LineItem add(String catalogId, int quantity, String size, String notes) {
		ensureOpen();
		checkQuantity(quantity);
		CatalogItem item = catalog.getById(catalogId);
		if (!item.available()) {
			throw new OrderingException(ErrorKind.ITEM_UNAVAILABLE,
					"'" + item.name() + "' is currently unavailable",
					Map.of("itemId", item.id(), "name", item.name()));
		}
		String resolvedSize = resolveSize(item, size);
		LineItem line = new LineItem(item.id(), item.name(), quantity, item.priceFor(resolvedSize), resolvedSize, notes);
		lines.add(line);
		return line;
	}

	/**
	 * Changes quantity, size or notes of one line. Null arguments leave that field unchanged.
	 *
	 * @return the updated line
	 */
	public LineItem modify(String selector, Integer quantity, String size, String notes) {
		ensureOpen();
		int position = resolve(selector);
		boolean hasSize = size != null && !size.isBlank();
		boolean hasNotes = notes != null && !notes.isBlank();
		if (quantity == null && !hasSize && !hasNotes) {
			throw new OrderingException(ErrorKind.INVALID_ARGUMENT, "Nothing to change on '" + selector + "'");
		}
		LineItem current = lines.get(position);
		int newQuantity = quantity != null ? quantity : current.quantity();
		checkQuantity(newQuantity);

		String newSize = current.size();
		BigDecimal newPrice = current.unitPrice();
		if (hasSize) {
			CatalogItem item = catalog.getById(current.catalogId());
			newSize = resolveSize(item, size);
			newPrice = item.priceFor(newSize);
		}
		String newNotes = hasNotes ? notes : current.notes();
		LineItem updated = new LineItem(current.catalogId(), current.displayName(), newQuantity, newPrice, newSize, newNotes);
		lines.set(position, updated);
		return updated;
	}

	/**
	 * Removes one line.
	 *
	 * @return the removed line
	 */
	public LineItem remove(String selector) {
		ensureOpen();
		return lines.remove(resolve(selector));
	}

	/**
	 * Freezes the lines. Reads keep working.
	 */
	public void close() {
		closed = true;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * Σ quantity × unitPrice over the current lines.
	 */
	public BigDecimal total() {
		return lines.stream().map(LineItem::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	public List<LineItem> lines() {
		return Collections.unmodifiableList(new ArrayList<>(lines));
	}

	public boolean isEmpty() {
		return lines.isEmpty();
	}

	public int size() {
		return lines.size();
	}

	/**
	 * Numbered lines followed by the subtotal, or a single "empty" line.
	 */
	public String summary() {
		if (lines.isEmpty()) {
			return "order: empty";
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < lines.size(); i++) {
			sb.append(i + 1).append(". ").append(lines.get(i).describe()).append('\n');
		}
		sb.append("subtotal: ").append(total().toPlainString());
		return sb.toString();
	}

	private int resolve(String selector) {
		if (lines.isEmpty()) {
			throw new OrderingException(ErrorKind.EMPTY_ORDER, "The order has no items");
		}
		if (selector == null || selector.isBlank()) {
			throw new OrderingException(ErrorKind.ITEM_NOT_FOUND, "No item specified");
		}
		Optional<Integer> position = NameSelector.position(selector);
		if (position.isPresent()) {
			int index = position.get() - 1;
			if (index < 0 || index >= lines.size()) {
				throw new OrderingException(ErrorKind.ITEM_NOT_FOUND,
						"Position " + position.get() + " is out of range 1.." + lines.size());
			}
			return index;
		}
		String wanted = TextNormalizer.normalize(selector);
		if (wanted.isEmpty()) {
			throw new OrderingException(ErrorKind.ITEM_NOT_FOUND, "No item specified");
		}
		List<Integer> matches = NameSelector.matchAll(selector, lines, LineItem::displayName);
		if (matches.size() > 1 && allSameChoice(matches)) {
			return matches.get(matches.size() - 1);
		}
		if (matches.size() != 1) {
			String reason = matches.isEmpty() ? "matches no item" : "matches " + matches.size() + " items";
			throw new OrderingException(ErrorKind.ITEM_NOT_FOUND,
					"'" + selector + "' " + reason + " in the order",
					Map.of("currentItems", lines.stream().map(LineItem::displayName).toList()));
		}
		return matches.get(0);
	}

	private boolean allSameChoice(List<Integer> positions) {
		LineItem first = lines.get(positions.get(0));
		return positions.stream().allMatch(p -> lines.get(p).sameChoice(first));
	}

	private static String resolveSize(CatalogItem item, String requested) {
		if (!item.hasSizes()) {
			if (requested != null && !requested.isBlank()) {
				throw new OrderingException(ErrorKind.INVALID_SIZE,
						"'" + item.name() + "' has no size options",
						Map.of("itemId", item.id()));
			}
			return null;
		}
		return item.resolveSize(requested).orElseThrow(() -> new OrderingException(ErrorKind.INVALID_SIZE,
				"'" + requested + "' is not a size of '" + item.name() + "'",
				Map.of("itemId", item.id(), "availableSizes", List.copyOf(item.sizePrices().keySet()))));
	}

	private void ensureOpen() {
		if (closed) {
			throw new OrderingException(ErrorKind.SESSION_CLOSED, "The order is closed and can no longer change");
		}
	}

	private static void checkQuantity(int quantity) {
		if (quantity < MIN_QUANTITY || quantity > MAX_QUANTITY) {
			throw new OrderingException(ErrorKind.INVALID_QUANTITY,
					"Quantity must be between " + MIN_QUANTITY + " and " + MAX_QUANTITY + ", got " + quantity,
					Map.of("quantity", quantity));
		}
	}
}
