package org.javai.orderflow.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.orderflow.catalog.CatalogItem;
import org.javai.orderflow.ledger.LineItem;

/**
 * JSON-friendly views of domain objects for tool results.
 */
final class ToolViews {

	private ToolViews() {
	}

	static Map<String, Object> item(CatalogItem item) {
		Map<String, Object> view = new LinkedHashMap<>();
		view.put("id", item.id());
		view.put("name", item.name());
		view.put("price", item.price());
		view.put("category", item.category());
		view.put("has_sizes", item.hasSizes());
		if (item.hasSizes()) {
			view.put("sizes", item.sizePrices());
		}
		return view;
	}

	static Map<String, Object> itemDetails(CatalogItem item) {
		Map<String, Object> view = item(item);
		view.put("description", item.description());
		view.put("available", item.available());
		return view;
	}

	static Map<String, Object> line(LineItem line) {
		Map<String, Object> view = new LinkedHashMap<>();
		view.put("item_id", line.catalogId());
		view.put("name", line.displayName());
		view.put("quantity", line.quantity());
		view.put("unit_price", line.unitPrice());
		if (line.size() != null) {
			view.put("size", line.size());
		}
		if (line.notes() != null) {
			view.put("notes", line.notes());
		}
		view.put("line_total", line.lineTotal());
		return view;
	}
}
