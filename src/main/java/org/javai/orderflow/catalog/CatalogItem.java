package org.javai.orderflow.catalog;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A menu entry.
 *
 * @param id stable catalog identifier
 * @param name display name (Arabic)
 * @param price base price; for sized items this is the default size's price
 * @param category menu category
 * @param description free-text description, may be empty
 * @param available whether the item can currently be ordered
 * @param sizePrices size name to price, in menu order; empty for unsized items
 */
public record CatalogItem(
		String id,
		String name,
		BigDecimal price,
		String category,
		String description,
		boolean available,
		Map<String, BigDecimal> sizePrices
) {

	/**
	 * Size picked when a sized item is ordered without naming a size.
	 */
	public static final String DEFAULT_SIZE = "وسط";

	public CatalogItem {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(price, "price must not be null");
		if (price.signum() < 0) {
			throw new IllegalArgumentException("price must not be negative");
		}
		category = category != null ? category : "";
		description = description != null ? description : "";
		// LinkedHashMap keeps menu order, Map.copyOf would not
		sizePrices = sizePrices != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(sizePrices))
				: Map.of();
	}

	public static CatalogItem of(String id, String name, BigDecimal price, String category) {
		return new CatalogItem(id, name, price, category, "", true, Map.of());
	}

	public boolean hasSizes() {
		return !sizePrices.isEmpty();
	}

	/**
	 * Resolves the size actually charged for a request.
	 *
	 * @param requested requested size, or null
	 * @return the size to record on the line, empty for unsized items, or empty
	 * if the request names a size this item does not offer
	 */
	public Optional<String> resolveSize(String requested) {
		if (!hasSizes()) {
			return Optional.empty();
		}
		if (requested == null || requested.isBlank()) {
			if (sizePrices.containsKey(DEFAULT_SIZE)) {
				return Optional.of(DEFAULT_SIZE);
			}
			return Optional.of(sizePrices.keySet().iterator().next());
		}
		String wanted = TextNormalizer.normalize(requested);
		return sizePrices.keySet().stream()
				.filter(size -> TextNormalizer.normalize(size).equals(wanted))
				.findFirst();
	}

	/**
	 * Unit price for a resolved size; base price when the item is unsized.
	 */
	public BigDecimal priceFor(String size) {
		if (size == null || !hasSizes()) {
			return price;
		}
		BigDecimal sized = sizePrices.get(size);
		return sized != null ? sized : price;
	}
}
