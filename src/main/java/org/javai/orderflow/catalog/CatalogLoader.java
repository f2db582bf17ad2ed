package org.javai.orderflow.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads menu JSON into a {@link CatalogIndex}.
 *
 * <p>Accepts either a bare array or an object with an {@code items} array. Each item has
 * {@code id}, {@code name} (or {@code name_ar}), {@code price}, {@code category},
 * {@code description} and {@code available}. {@code price} is either a number or an object
 * mapping size names to prices:</p>
 * <pre>{@code
 * {"id": "burger_beef", "name": "برجر لحم", "price": {"صغير": 18, "وسط": 22, "كبير": 27}, ...}
 * }</pre>
 */
public final class CatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

	private final ObjectMapper objectMapper;

	public CatalogLoader() {
		this(new ObjectMapper());
	}

	public CatalogLoader(ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	public CatalogIndex load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read catalog from " + path, e);
		}
	}

	public CatalogIndex loadResource(String resource) {
		InputStream in = CatalogLoader.class.getResourceAsStream(resource);
		if (in == null) {
			throw new IllegalArgumentException("Catalog resource not found: " + resource);
		}
		try (in) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read catalog resource " + resource, e);
		}
	}

	public CatalogIndex load(InputStream in) throws IOException {
		JsonNode root = objectMapper.readTree(in);
		JsonNode array = root.isArray() ? root : root.path("items");
		if (!array.isArray()) {
			throw new IllegalArgumentException("Catalog JSON must be an array or contain an 'items' array");
		}
		List<CatalogItem> items = new ArrayList<>();
		for (JsonNode node : array) {
			items.add(toItem(node));
		}
		logger.info("Loaded {} catalog items", items.size());
		return new CatalogIndex(items);
	}

	private CatalogItem toItem(JsonNode node) {
		String id = requiredText(node, "id");
		String name = node.hasNonNull("name") ? node.get("name").asText() : requiredText(node, "name_ar");
		JsonNode priceNode = node.path("price");
		Map<String, BigDecimal> sizePrices = new LinkedHashMap<>();
		BigDecimal basePrice;
		if (priceNode.isObject()) {
			Iterator<Map.Entry<String, JsonNode>> fields = priceNode.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				sizePrices.put(field.getKey(), field.getValue().decimalValue());
			}
			if (sizePrices.isEmpty()) {
				throw new IllegalArgumentException("Item " + id + " has an empty size price map");
			}
			basePrice = sizePrices.getOrDefault(CatalogItem.DEFAULT_SIZE, sizePrices.values().iterator().next());
		}
		else if (priceNode.isNumber()) {
			basePrice = priceNode.decimalValue();
		}
		else {
			throw new IllegalArgumentException("Item " + id + " has no numeric price");
		}
		return new CatalogItem(
				id,
				name,
				basePrice,
				node.path("category").asText(""),
				node.path("description").asText(""),
				node.path("available").asBoolean(true),
				sizePrices);
	}

	private static String requiredText(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull() || value.asText().isBlank()) {
			throw new IllegalArgumentException("Catalog item is missing '" + field + "': " + node);
		}
		return value.asText();
	}
}
