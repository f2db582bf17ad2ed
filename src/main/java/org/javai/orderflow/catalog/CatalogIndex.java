package org.javai.orderflow.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;

/**
 * Immutable, ordered collection of catalog items with their normalized search keys.
 *
 * <p>Built once at startup and shared read-only by every session, so it carries no locking.
 * Catalog order is preserved and is the tie-break for every search stage.</p>
 */
public final class CatalogIndex {

	private final List<CatalogItem> items;
	private final Map<String, CatalogItem> byId;
	private final List<String> normalizedNames;
	private final List<String> phoneticNames;
	private final List<String> normalizedText;

	public CatalogIndex(List<CatalogItem> items) {
		Objects.requireNonNull(items, "items must not be null");
		this.items = List.copyOf(items);
		Map<String, CatalogItem> ids = new LinkedHashMap<>();
		List<String> names = new ArrayList<>();
		List<String> phonetic = new ArrayList<>();
		List<String> text = new ArrayList<>();
		for (CatalogItem item : this.items) {
			if (ids.putIfAbsent(item.id(), item) != null) {
				throw new IllegalArgumentException("Duplicate catalog id: " + item.id());
			}
			names.add(TextNormalizer.normalize(item.name()));
			phonetic.add(TextNormalizer.phonetic(item.name()));
			text.add(TextNormalizer.normalize(item.name() + " " + item.description() + " " + item.category()));
		}
		this.byId = Map.copyOf(ids);
		this.normalizedNames = List.copyOf(names);
		this.phoneticNames = List.copyOf(phonetic);
		this.normalizedText = List.copyOf(text);
	}

	public static CatalogIndex empty() {
		return new CatalogIndex(List.of());
	}

	public List<CatalogItem> items() {
		return items;
	}

	public int size() {
		return items.size();
	}

	public Optional<CatalogItem> findById(String id) {
		return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
	}

	/**
	 * Direct lookup used by ledger operations.
	 *
	 * @throws OrderingException with {@link ErrorKind#ITEM_NOT_FOUND} if no item has this id
	 */
	public CatalogItem getById(String id) {
		return findById(id).orElseThrow(() -> new OrderingException(
				ErrorKind.ITEM_NOT_FOUND, "No catalog item with id '" + id + "'"));
	}

	/**
	 * Distinct categories in first-seen order.
	 */
	public List<String> categories() {
		LinkedHashSet<String> categories = new LinkedHashSet<>();
		items.stream()
				.map(CatalogItem::category)
				.filter(category -> !category.isBlank())
				.forEach(categories::add);
		return List.copyOf(categories);
	}

	String normalizedName(int position) {
		return normalizedNames.get(position);
	}

	String phoneticName(int position) {
		return phoneticNames.get(position);
	}

	String normalizedText(int position) {
		return normalizedText.get(position);
	}
}
