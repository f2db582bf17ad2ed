package org.javai.orderflow.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.session.Stage;

/**
 * Runtime settings for the ordering core.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * OrderingConfig config = OrderingConfig.defaults();
 *
 * // Custom configuration
 * OrderingConfig config = OrderingConfig.builder()
 *         .sessionTimeout(Duration.ofMinutes(5))
 *         .stageModel(Stage.ORDERING, "gpt-4o-mini")
 *         .build();
 * }</pre>
 *
 * @param restaurantName name used in stage instructions
 * @param stageCeilings token ceiling per stage
 * @param defaultCeiling ceiling for stages without an entry
 * @param stageModels model id per stage
 * @param sessionTimeout inactivity before a session is evicted
 * @param sweepInterval how often the sweeper looks for idle sessions
 * @param bufferCapacity conversation buffer size
 * @param keepLast trailing messages kept when truncating
 * @param maxToolRounds model rounds allowed per stage run
 * @param maxChainedHandoffs stage runs chained in one turn when a handoff yields no text
 * @param retry model retry policy
 * @param search catalog search thresholds
 * @param messages fixed customer-facing messages
 * @param contactNumber number customers can call
 * @param pickupEta quoted pickup time
 * @param defaultDeliveryEta quoted delivery time when the zone has none
 * @param redactEvents whether personal fields are masked in event logs
 */
public record OrderingConfig(
		String restaurantName,
		Map<Stage, Integer> stageCeilings,
		int defaultCeiling,
		Map<Stage, String> stageModels,
		Duration sessionTimeout,
		Duration sweepInterval,
		int bufferCapacity,
		int keepLast,
		int maxToolRounds,
		int maxChainedHandoffs,
		Retry retry,
		CatalogResolver.Options search,
		Messages messages,
		String contactNumber,
		String pickupEta,
		String defaultDeliveryEta,
		boolean redactEvents) {

	public static final String DEFAULT_RESTAURANT_NAME = "البيت العربي";
	public static final int DEFAULT_CEILING = 8000;
	public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(10);
	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);
	public static final int DEFAULT_BUFFER_CAPACITY = 20;
	public static final int DEFAULT_KEEP_LAST = 6;
	public static final int DEFAULT_MAX_TOOL_ROUNDS = 20;
	public static final int DEFAULT_MAX_CHAINED_HANDOFFS = 3;
	public static final String DEFAULT_CONTACT_NUMBER = "920001234";
	public static final String DEFAULT_PICKUP_ETA = "15-20 دقيقة";
	public static final String DEFAULT_DELIVERY_ETA = "30-45 دقيقة";

	/**
	 * Model retry policy.
	 *
	 * @param maxAttempts attempts per model round, at least 1
	 * @param baseDelay delay after the first failure
	 * @param maxDelay upper bound on any delay
	 */
	public record Retry(int maxAttempts, Duration baseDelay, Duration maxDelay) {

		public Retry {
			if (maxAttempts < 1) {
				throw new IllegalArgumentException("maxAttempts must be >= 1");
			}
			Objects.requireNonNull(baseDelay, "baseDelay must not be null");
			Objects.requireNonNull(maxDelay, "maxDelay must not be null");
		}

		public static Retry defaults() {
			return new Retry(3, Duration.ofMillis(500), Duration.ofSeconds(8));
		}
	}

	/**
	 * Fixed messages used when a turn cannot be answered by the model.
	 *
	 * @param closing reply once the session is closed
	 * @param apology reply when the model is unavailable; {@code {contact}} is replaced with the contact number
	 * @param tooComplex reply when a turn runs out of tool rounds
	 */
	public record Messages(String closing, String apology, String tooComplex) {

		public Messages {
			Objects.requireNonNull(closing, "closing must not be null");
			Objects.requireNonNull(apology, "apology must not be null");
			Objects.requireNonNull(tooComplex, "tooComplex must not be null");
		}

		public static Messages defaults() {
			return new Messages(
					"تم إغلاق هذه المحادثة. لطلب جديد ابدأ محادثة جديدة.",
					"عذراً، عندنا مشكلة تقنية حالياً. حاول مرة ثانية بعد شوي أو اتصل على {contact}.",
					"الطلب صار طويل شوي، ممكن تبسطه وتطلب الأصناف واحد واحد؟");
		}

		public String apologyWith(String contactNumber) {
			return apology.replace("{contact}", contactNumber);
		}
	}

	public OrderingConfig {
		Objects.requireNonNull(restaurantName, "restaurantName must not be null");
		stageCeilings = copy(Objects.requireNonNull(stageCeilings, "stageCeilings must not be null"));
		stageModels = copy(Objects.requireNonNull(stageModels, "stageModels must not be null"));
		Objects.requireNonNull(sessionTimeout, "sessionTimeout must not be null");
		Objects.requireNonNull(sweepInterval, "sweepInterval must not be null");
		Objects.requireNonNull(retry, "retry must not be null");
		Objects.requireNonNull(search, "search must not be null");
		Objects.requireNonNull(messages, "messages must not be null");
		Objects.requireNonNull(contactNumber, "contactNumber must not be null");
		Objects.requireNonNull(pickupEta, "pickupEta must not be null");
		Objects.requireNonNull(defaultDeliveryEta, "defaultDeliveryEta must not be null");
		if (defaultCeiling < 1) {
			throw new IllegalArgumentException("defaultCeiling must be >= 1");
		}
		if (sessionTimeout.isNegative() || sessionTimeout.isZero()) {
			throw new IllegalArgumentException("sessionTimeout must be positive");
		}
		if (sweepInterval.isNegative() || sweepInterval.isZero()) {
			throw new IllegalArgumentException("sweepInterval must be positive");
		}
		if (bufferCapacity < 1) {
			throw new IllegalArgumentException("bufferCapacity must be >= 1");
		}
		if (keepLast < 1) {
			throw new IllegalArgumentException("keepLast must be >= 1");
		}
		if (maxToolRounds < 1) {
			throw new IllegalArgumentException("maxToolRounds must be >= 1");
		}
		if (maxChainedHandoffs < 0) {
			throw new IllegalArgumentException("maxChainedHandoffs must be non-negative");
		}
	}

	public static OrderingConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int ceilingFor(Stage stage) {
		return stageCeilings.getOrDefault(stage, defaultCeiling);
	}

	public String apologyMessage() {
		return messages.apologyWith(contactNumber);
	}

	static Map<Stage, Integer> defaultCeilings() {
		Map<Stage, Integer> ceilings = new EnumMap<>(Stage.class);
		ceilings.put(Stage.GREETING, 4000);
		ceilings.put(Stage.LOCATION, 6000);
		ceilings.put(Stage.ORDERING, 12000);
		ceilings.put(Stage.CHECKOUT, 8000);
		return ceilings;
	}

	static Map<Stage, String> defaultModels() {
		Map<Stage, String> models = new EnumMap<>(Stage.class);
		models.put(Stage.GREETING, "gpt-4o-mini");
		models.put(Stage.LOCATION, "gpt-4o-mini");
		models.put(Stage.ORDERING, "gpt-4o");
		models.put(Stage.CHECKOUT, "gpt-4o");
		return models;
	}

	private static <V> Map<Stage, V> copy(Map<Stage, V> source) {
		return source.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(source));
	}

	/**
	 * Builder for {@link OrderingConfig}. Starts from the defaults.
	 */
	public static class Builder {
		private String restaurantName = DEFAULT_RESTAURANT_NAME;
		private final Map<Stage, Integer> stageCeilings = defaultCeilings();
		private int defaultCeiling = DEFAULT_CEILING;
		private final Map<Stage, String> stageModels = defaultModels();
		private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
		private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
		private int bufferCapacity = DEFAULT_BUFFER_CAPACITY;
		private int keepLast = DEFAULT_KEEP_LAST;
		private int maxToolRounds = DEFAULT_MAX_TOOL_ROUNDS;
		private int maxChainedHandoffs = DEFAULT_MAX_CHAINED_HANDOFFS;
		private Retry retry = Retry.defaults();
		private CatalogResolver.Options search = CatalogResolver.Options.defaults();
		private Messages messages = Messages.defaults();
		private String contactNumber = DEFAULT_CONTACT_NUMBER;
		private String pickupEta = DEFAULT_PICKUP_ETA;
		private String defaultDeliveryEta = DEFAULT_DELIVERY_ETA;
		private boolean redactEvents;

		private Builder() {}

		public Builder restaurantName(String restaurantName) {
			this.restaurantName = restaurantName;
			return this;
		}

		public Builder stageCeiling(Stage stage, int ceiling) {
			this.stageCeilings.put(stage, ceiling);
			return this;
		}

		public Builder defaultCeiling(int defaultCeiling) {
			this.defaultCeiling = defaultCeiling;
			return this;
		}

		public Builder stageModel(Stage stage, String model) {
			this.stageModels.put(stage, model);
			return this;
		}

		public Builder sessionTimeout(Duration sessionTimeout) {
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder bufferCapacity(int bufferCapacity) {
			this.bufferCapacity = bufferCapacity;
			return this;
		}

		/**
		 * Sets how many trailing messages survive truncation, besides the first.
		 */
		public Builder keepLast(int keepLast) {
			this.keepLast = keepLast;
			return this;
		}

		public Builder maxToolRounds(int maxToolRounds) {
			this.maxToolRounds = maxToolRounds;
			return this;
		}

		public Builder maxChainedHandoffs(int maxChainedHandoffs) {
			this.maxChainedHandoffs = maxChainedHandoffs;
			return this;
		}

		public Builder retry(Retry retry) {
			this.retry = retry;
			return this;
		}

		public Builder search(CatalogResolver.Options search) {
			this.search = search;
			return this;
		}

		public Builder messages(Messages messages) {
			this.messages = messages;
			return this;
		}

		public Builder contactNumber(String contactNumber) {
			this.contactNumber = contactNumber;
			return this;
		}

		public Builder pickupEta(String pickupEta) {
			this.pickupEta = pickupEta;
			return this;
		}

		public Builder defaultDeliveryEta(String defaultDeliveryEta) {
			this.defaultDeliveryEta = defaultDeliveryEta;
			return this;
		}

		public Builder redactEvents(boolean redactEvents) {
			this.redactEvents = redactEvents;
			return this;
		}

		public OrderingConfig build() {
			return new OrderingConfig(restaurantName, stageCeilings, defaultCeiling, stageModels, sessionTimeout,
					sweepInterval, bufferCapacity, keepLast, maxToolRounds, maxChainedHandoffs, retry, search, messages,
					contactNumber, pickupEta, defaultDeliveryEta, redactEvents);
		}
	}
}
