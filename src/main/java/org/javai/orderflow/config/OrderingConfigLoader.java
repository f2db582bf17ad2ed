package org.javai.orderflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.session.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link OrderingConfig} from YAML. Keys that are absent keep their default values.
 *
 * <pre>{@code
 * restaurant_name: البيت العربي
 * contact_number: "920001234"
 * session:
 *   timeout_minutes: 10
 *   sweep_interval_seconds: 60
 *   buffer_capacity: 20
 * context:
 *   keep_last: 6
 *   default_ceiling: 8000
 *   ceilings: { greeting: 4000, location: 6000, ordering: 12000, checkout: 8000 }
 * models: { greeting: gpt-4o-mini, ordering: gpt-4o }
 * orchestration: { max_tool_rounds: 20, max_chained_handoffs: 3 }
 * retry: { max_attempts: 3, base_delay_ms: 500, max_delay_ms: 8000 }
 * search: { top_k: 5, min_score: 0.30, not_found_threshold: 0.55, high_threshold: 0.75 }
 * messages: { closing: ..., apology: ..., too_complex: ... }
 * eta: { pickup: 15-20 دقيقة, delivery_default: 30-45 دقيقة }
 * events: { redact: true }
 * }</pre>
 */
public class OrderingConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(OrderingConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "/orderflow.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
	 */
	public OrderingConfig loadDefault() {
		InputStream in = OrderingConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.info("No {} on the classpath, using default configuration", DEFAULT_RESOURCE);
			return OrderingConfig.defaults();
		}
		try (in) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public OrderingConfig load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read configuration from " + path, e);
		}
	}

	public OrderingConfig load(InputStream in) {
		Object loaded;
		try {
			loaded = yaml.load(in);
		}
		catch (YAMLException e) {
			throw new IllegalArgumentException("Configuration is not valid YAML", e);
		}
		return build(root(loaded));
	}

	public OrderingConfig parseString(String content) {
		Object loaded;
		try {
			loaded = yaml.load(content);
		}
		catch (YAMLException e) {
			throw new IllegalArgumentException("Configuration is not valid YAML", e);
		}
		return build(root(loaded));
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> root(Object loaded) {
		if (loaded == null) {
			return Map.of();
		}
		if (!(loaded instanceof Map)) {
			throw new IllegalArgumentException("Configuration must be a YAML mapping");
		}
		return (Map<String, Object>) loaded;
	}

	private OrderingConfig build(Map<String, Object> data) {
		OrderingConfig defaults = OrderingConfig.defaults();
		OrderingConfig.Builder builder = OrderingConfig.builder();

		ifPresent(data, "restaurant_name", value -> builder.restaurantName(value.toString()));
		ifPresent(data, "contact_number", value -> builder.contactNumber(value.toString()));

		Map<String, Object> session = section(data, "session");
		ifPresent(session, "timeout_minutes", value -> builder.sessionTimeout(Duration.ofMinutes(asLong(value, "session.timeout_minutes"))));
		ifPresent(session, "sweep_interval_seconds", value -> builder.sweepInterval(Duration.ofSeconds(asLong(value, "session.sweep_interval_seconds"))));
		ifPresent(session, "buffer_capacity", value -> builder.bufferCapacity(asInt(value, "session.buffer_capacity")));

		Map<String, Object> context = section(data, "context");
		ifPresent(context, "keep_last", value -> builder.keepLast(asInt(value, "context.keep_last")));
		ifPresent(context, "default_ceiling", value -> builder.defaultCeiling(asInt(value, "context.default_ceiling")));
		section(context, "ceilings").forEach((stage, value) ->
				builder.stageCeiling(stage(stage), asInt(value, "context.ceilings." + stage)));

		section(data, "models").forEach((stage, value) -> builder.stageModel(stage(stage), value.toString()));

		Map<String, Object> orchestration = section(data, "orchestration");
		ifPresent(orchestration, "max_tool_rounds", value -> builder.maxToolRounds(asInt(value, "orchestration.max_tool_rounds")));
		ifPresent(orchestration, "max_chained_handoffs", value -> builder.maxChainedHandoffs(asInt(value, "orchestration.max_chained_handoffs")));

		Map<String, Object> retry = section(data, "retry");
		if (!retry.isEmpty()) {
			OrderingConfig.Retry base = defaults.retry();
			builder.retry(new OrderingConfig.Retry(
					retry.containsKey("max_attempts") ? asInt(retry.get("max_attempts"), "retry.max_attempts") : base.maxAttempts(),
					retry.containsKey("base_delay_ms") ? Duration.ofMillis(asLong(retry.get("base_delay_ms"), "retry.base_delay_ms")) : base.baseDelay(),
					retry.containsKey("max_delay_ms") ? Duration.ofMillis(asLong(retry.get("max_delay_ms"), "retry.max_delay_ms")) : base.maxDelay()));
		}

		Map<String, Object> search = section(data, "search");
		if (!search.isEmpty()) {
			CatalogResolver.Options base = defaults.search();
			builder.search(new CatalogResolver.Options(
					search.containsKey("top_k") ? asInt(search.get("top_k"), "search.top_k") : base.topK(),
					search.containsKey("min_score") ? asDouble(search.get("min_score"), "search.min_score") : base.minScore(),
					search.containsKey("not_found_threshold") ? asDouble(search.get("not_found_threshold"), "search.not_found_threshold") : base.notFoundThreshold(),
					search.containsKey("high_threshold") ? asDouble(search.get("high_threshold"), "search.high_threshold") : base.highThreshold()));
		}

		Map<String, Object> messages = section(data, "messages");
		if (!messages.isEmpty()) {
			OrderingConfig.Messages base = defaults.messages();
			builder.messages(new OrderingConfig.Messages(
					text(messages, "closing", base.closing()),
					text(messages, "apology", base.apology()),
					text(messages, "too_complex", base.tooComplex())));
		}

		Map<String, Object> eta = section(data, "eta");
		ifPresent(eta, "pickup", value -> builder.pickupEta(value.toString()));
		ifPresent(eta, "delivery_default", value -> builder.defaultDeliveryEta(value.toString()));

		ifPresent(section(data, "events"), "redact", value -> builder.redactEvents(Boolean.parseBoolean(value.toString())));

		OrderingConfig config = builder.build();
		logger.debug("Loaded configuration: timeout {}, max tool rounds {}, models {}",
				config.sessionTimeout(), config.maxToolRounds(), config.stageModels());
		return config;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Configuration key '" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static void ifPresent(Map<String, Object> data, String key, Consumer<Object> action) {
		Object value = data.get(key);
		if (value != null) {
			action.accept(value);
		}
	}

	private static String text(Map<String, Object> data, String key, String fallback) {
		Object value = data.get(key);
		return value == null ? fallback : value.toString();
	}

	private static Stage stage(String name) {
		try {
			return Stage.valueOf(name.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown stage in configuration: " + name, e);
		}
	}

	private static int asInt(Object value, String key) {
		return Math.toIntExact(asLong(value, key));
	}

	private static long asLong(Object value, String key) {
		if (value instanceof Number number) {
			return number.longValue();
		}
		try {
			return Long.parseLong(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration key '" + key + "' must be a whole number, got '" + value + "'", e);
		}
	}

	private static double asDouble(Object value, String key) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration key '" + key + "' must be a number, got '" + value + "'", e);
		}
	}
}
