package org.javai.orderflow.coverage;

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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads coverage JSON of the form
 * {@code {"النرجس": {"delivery_fee": 15, "estimated_time": "30-45 دقيقة"}, ...}}.
 */
public final class CoverageLoader {

	private static final Logger logger = LoggerFactory.getLogger(CoverageLoader.class);

	private final ObjectMapper objectMapper;

	public CoverageLoader() {
		this(new ObjectMapper());
	}

	public CoverageLoader(ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	public CoverageMap load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read coverage data from " + path, e);
		}
	}

	public CoverageMap loadResource(String resource) {
		InputStream in = CoverageLoader.class.getResourceAsStream(resource);
		if (in == null) {
			throw new IllegalArgumentException("Coverage resource not found: " + resource);
		}
		try (in) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read coverage resource " + resource, e);
		}
	}

	public CoverageMap load(InputStream in) throws IOException {
		JsonNode root = objectMapper.readTree(in);
		if (!root.isObject()) {
			throw new IllegalArgumentException("Coverage JSON must be an object keyed by district");
		}
		List<CoverageZone> zones = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			JsonNode zone = field.getValue();
			if (!zone.path("delivery_fee").isNumber()) {
				throw new IllegalArgumentException("District " + field.getKey() + " has no numeric delivery_fee");
			}
			BigDecimal fee = zone.get("delivery_fee").decimalValue();
			zones.add(new CoverageZone(field.getKey(), fee, zone.path("estimated_time").asText("")));
		}
		logger.info("Loaded {} coverage zones", zones.size());
		return new CoverageMap(zones);
	}
}
