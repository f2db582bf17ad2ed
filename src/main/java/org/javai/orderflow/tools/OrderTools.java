package org.javai.orderflow.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.catalog.CatalogItem;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.catalog.NameSelector;
import org.javai.orderflow.catalog.SearchResult;
import org.javai.orderflow.ledger.LineItem;
import org.javai.orderflow.session.PendingItem;
import org.javai.orderflow.session.SessionRecord;

/**
 * Menu search and ledger handlers.
 */
class OrderTools {

	private final CatalogResolver resolver;

	OrderTools(CatalogResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	ToolOutcome searchMenu(SessionRecord session, ToolArguments.SearchMenu args) {
		String query = required(args.query(), "query");
		SearchResult result = resolver.search(query);
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("match", result.stage().name().toLowerCase(Locale.ROOT));
		data.put("confidence", result.confidence());
		data.put("low_confidence", result.lowConfidence());
		data.put("items", result.items().stream().map(ToolViews::item).toList());
		if (!result.found()) {
			data.put("available_categories", result.suggestions());
			return ToolOutcome.of("No menu item matches '" + query + "'", data);
		}
		session.setOfferedItems(result.items());
		String message;
		if (result.isUnambiguous()) {
			message = "Found " + result.items().get(0).name();
		}
		else if (result.lowConfidence()) {
			message = "Possible matches found; confirm with the customer before adding";
		}
		else {
			message = result.items().size() + " matching items; ask the customer which one";
		}
		return ToolOutcome.of(message, data);
	}

	ToolOutcome itemDetails(ToolArguments.ItemDetails args) {
		CatalogItem item = resolver.getById(required(args.itemId(), "item_id"));
		return ToolOutcome.of(item.name(), ToolViews.itemDetails(item));
	}

	ToolOutcome addItem(SessionRecord session, ToolArguments.AddItem args) {
		int quantity = args.quantity() != null ? args.quantity() : 1;
		LineItem line = session.addItem(required(args.itemId(), "item_id"), quantity, args.size(), args.notes());
		return ledgerOutcome(session, "Added " + line.displayName(), line);
	}

	ToolOutcome modifyItem(SessionRecord session, ToolArguments.ModifyItem args) {
		LineItem line = session.modifyItem(args.selector(), args.quantity(), args.size(), args.notes());
		return ledgerOutcome(session, "Updated " + line.displayName(), line);
	}

	ToolOutcome removeItem(SessionRecord session, ToolArguments.RemoveItem args) {
		LineItem line = session.removeItem(args.selector());
		return ledgerOutcome(session, "Removed " + line.displayName(), line);
	}

	ToolOutcome currentOrder(SessionRecord session) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("items", session.ledger().lines().stream().map(ToolViews::line).toList());
		data.put("subtotal", session.ledger().total());
		data.put("summary", session.ledger().summary());
		return ToolOutcome.of(session.ledger().isEmpty() ? "The order is empty" : "Current order", data);
	}

	/**
	 * Resolves a reply like "the chicken one" or "2" against the items the last search offered.
	 */
	ToolOutcome selectOffered(SessionRecord session, ToolArguments.SelectOffered args) {
		List<CatalogItem> offered = session.offeredItems();
		if (offered.isEmpty()) {
			throw new OrderingException(ErrorKind.ITEM_NOT_FOUND, "No items have been offered yet; search the menu first");
		}
		String hint = required(args.hint(), "hint");
		CatalogItem chosen = pickOffered(offered, hint);
		int quantity = args.quantity() != null ? args.quantity() : 1;
		LineItem line = session.addItem(chosen.id(), quantity, null, null);
		return ledgerOutcome(session, "Added " + line.displayName(), line);
	}

	ToolOutcome addPendingItem(SessionRecord session, ToolArguments.PendingRequest args) {
		int quantity = args.quantity() != null && args.quantity() > 0 ? args.quantity() : 1;
		session.addPendingItem(new PendingItem(required(args.text(), "text"), quantity));
		return ToolOutcome.of("Noted for when ordering starts",
				Map.of("pending_count", session.pendingItems().size()));
	}

	private static CatalogItem pickOffered(List<CatalogItem> offered, String hint) {
		Optional<Integer> position = NameSelector.position(hint);
		if (position.isPresent() && position.get() >= 1 && position.get() <= offered.size()) {
			return offered.get(position.get() - 1);
		}
		List<Integer> matches = NameSelector.matchAll(hint, offered, CatalogItem::name);
		if (matches.size() != 1) {
			throw new OrderingException(ErrorKind.ITEM_NOT_FOUND,
					"'" + hint + "' does not identify exactly one offered item",
					Map.of("offered", offered.stream().map(CatalogItem::name).toList()));
		}
		return offered.get(matches.get(0));
	}

	private static ToolOutcome ledgerOutcome(SessionRecord session, String message, LineItem line) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("line", ToolViews.line(line));
		data.put("item_count", session.ledger().size());
		data.put("subtotal", session.ledger().total());
		return ToolOutcome.of(message, data);
	}

	static String required(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new OrderingException(ErrorKind.INVALID_ARGUMENT, "'" + field + "' is required");
		}
		return value.trim();
	}
}
