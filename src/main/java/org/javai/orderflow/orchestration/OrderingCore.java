package org.javai.orderflow.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.catalog.CatalogIndex;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.catalog.EmbeddingSimilarityIndex;
import org.javai.orderflow.catalog.SimilarityIndex;
import org.javai.orderflow.config.OrderingConfig;
import org.javai.orderflow.context.ClasspathStageInstructions;
import org.javai.orderflow.context.ContextBudgeter;
import org.javai.orderflow.context.ContextSynthesizer;
import org.javai.orderflow.context.JtokkitTokenEstimator;
import org.javai.orderflow.context.StageInstructions;
import org.javai.orderflow.context.TokenEstimator;
import org.javai.orderflow.coverage.CoverageMap;
import org.javai.orderflow.events.EventSink;
import org.javai.orderflow.events.Slf4jEventSink;
import org.javai.orderflow.inference.ExponentialBackoff;
import org.javai.orderflow.inference.InferenceClient;
import org.javai.orderflow.inference.RetryingInferenceClient;
import org.javai.orderflow.inference.SpringAiInferenceClient;
import org.javai.orderflow.routing.StageRouter;
import org.javai.orderflow.session.InMemorySessionStore;
import org.javai.orderflow.session.SessionStore;
import org.javai.orderflow.tools.ToolCatalog;
import org.javai.orderflow.tools.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Wires the ordering core from configuration, menu and coverage data, and a model client.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OrderingCore core = OrderingCore.builder()
 *         .config(new OrderingConfigLoader().loadDefault())
 *         .catalog(new CatalogLoader().loadResource("/menu.json"))
 *         .coverage(new CoverageLoader().loadResource("/coverage_zones.json"))
 *         .chatClient(ChatClient.create(chatModel))
 *         .embeddingModel(embeddingModel)
 *         .build();
 * core.startSweeper();
 * TurnResult reply = core.orchestrator().handle("customer-42", "السلام عليكم");
 * }</pre>
 */
public final class OrderingCore implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(OrderingCore.class);

	private final TurnOrchestrator orchestrator;
	private final SessionStore store;
	private final SessionSweeper sweeper;

	private OrderingCore(TurnOrchestrator orchestrator, SessionStore store, SessionSweeper sweeper) {
		this.orchestrator = orchestrator;
		this.store = store;
		this.sweeper = sweeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	public TurnOrchestrator orchestrator() {
		return orchestrator;
	}

	public SessionStore store() {
		return store;
	}

	public SessionSweeper sweeper() {
		return sweeper;
	}

	public void startSweeper() {
		sweeper.start();
	}

	@Override
	public void close() {
		sweeper.close();
	}

	/**
	 * Builder for {@link OrderingCore}. A model client is required: an {@link InferenceClient},
	 * a Spring AI {@link ChatClient}, or an OpenAI API key.
	 */
	public static class Builder {
		private OrderingConfig config = OrderingConfig.defaults();
		private CatalogIndex catalog;
		private CoverageMap coverage;
		private InferenceClient inferenceClient;
		private ChatClient chatClient;
		private String openAiApiKey;
		private EmbeddingModel embeddingModel;
		private SimilarityIndex similarityIndex;
		private StageInstructions instructions;
		private TokenEstimator tokenEstimator;
		private EventSink eventSink;
		private ObjectMapper objectMapper = new ObjectMapper();
		private Clock clock = Clock.systemUTC();

		private Builder() {}

		public Builder config(OrderingConfig config) {
			this.config = config;
			return this;
		}

		public Builder catalog(CatalogIndex catalog) {
			this.catalog = catalog;
			return this;
		}

		public Builder coverage(CoverageMap coverage) {
			this.coverage = coverage;
			return this;
		}

		/**
		 * Uses the client as given, without retries. Takes precedence over {@link #chatClient}.
		 */
		public Builder inferenceClient(InferenceClient inferenceClient) {
			this.inferenceClient = inferenceClient;
			return this;
		}

		/**
		 * Uses a Spring AI chat client wrapped in the configured retry policy.
		 */
		public Builder chatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		/**
		 * Talks to OpenAI directly with the given key, using the per-stage models from the
		 * configuration. Ignored when a chat client or inference client is supplied.
		 */
		public Builder openAi(String apiKey) {
			this.openAiApiKey = apiKey;
			return this;
		}

		/**
		 * Enables the similarity stage of menu search.
		 */
		public Builder embeddingModel(EmbeddingModel embeddingModel) {
			this.embeddingModel = embeddingModel;
			return this;
		}

		public Builder similarityIndex(SimilarityIndex similarityIndex) {
			this.similarityIndex = similarityIndex;
			return this;
		}

		public Builder instructions(StageInstructions instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder tokenEstimator(TokenEstimator tokenEstimator) {
			this.tokenEstimator = tokenEstimator;
			return this;
		}

		public Builder eventSink(EventSink eventSink) {
			this.eventSink = eventSink;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public OrderingCore build() {
			Objects.requireNonNull(config, "config must not be null");
			Objects.requireNonNull(catalog, "catalog must not be null");
			Objects.requireNonNull(coverage, "coverage must not be null");
			Objects.requireNonNull(objectMapper, "objectMapper must not be null");
			Objects.requireNonNull(clock, "clock must not be null");

			EventSink sink = eventSink != null ? eventSink : new Slf4jEventSink(objectMapper, config.redactEvents());
			SimilarityIndex similarity = similarityIndex;
			if (similarity == null && embeddingModel != null) {
				similarity = new EmbeddingSimilarityIndex(embeddingModel, catalog);
			}
			CatalogResolver resolver = new CatalogResolver(catalog, similarity, config.search());
			ContextSynthesizer synthesizer = new ContextSynthesizer();
			ContextBudgeter budgeter = new ContextBudgeter(
					tokenEstimator != null ? tokenEstimator : new JtokkitTokenEstimator(),
					config.stageCeilings(), config.defaultCeiling(), config.keepLast(), sink, clock);
			StageInstructions stageInstructions = instructions != null
					? instructions
					: new ClasspathStageInstructions(promptVariables(config, coverage));
			ToolDispatcher dispatcher = new ToolDispatcher(resolver, coverage, synthesizer,
					new ToolDispatcher.CheckoutSettings(config.pickupEta(), config.defaultDeliveryEta(), config.contactNumber()),
					clock, objectMapper);
			SessionStore store = new InMemorySessionStore(catalog, clock, config.sessionTimeout(), config.bufferCapacity());

			TurnOrchestrator orchestrator = new TurnOrchestrator(store, new StageRouter(), synthesizer, budgeter,
					stageInstructions, new ToolCatalog(), dispatcher, resolveInference(), sink, config, clock);
			SessionSweeper sweeper = new SessionSweeper(store, sink, clock, config.sweepInterval());
			logger.info("Ordering core ready: {} menu items, {} delivery districts, similarity search {}",
					catalog.size(), coverage.zones().size(), similarity != null ? "on" : "off");
			return new OrderingCore(orchestrator, store, sweeper);
		}

		private InferenceClient resolveInference() {
			if (inferenceClient != null) {
				return inferenceClient;
			}
			ChatClient client = chatClient != null ? chatClient : openAiClient();
			OrderingConfig.Retry retry = config.retry();
			return new RetryingInferenceClient(
					new SpringAiInferenceClient(client, config.stageModels()),
					retry.maxAttempts(),
					new ExponentialBackoff(retry.baseDelay(), retry.maxDelay()));
		}

		private ChatClient openAiClient() {
			if (openAiApiKey == null) {
				throw new IllegalStateException("Either an inferenceClient, a chatClient or an OpenAI key must be supplied");
			}
			if (openAiApiKey.isBlank()) {
				throw new IllegalArgumentException("OpenAI API key must not be blank");
			}
			OpenAiApi openAiApi = OpenAiApi.builder().apiKey(openAiApiKey).build();
			OpenAiChatModel chatModel = OpenAiChatModel.builder()
					.openAiApi(openAiApi)
					.build();
			logger.info("Using OpenAI chat model directly");
			return ChatClient.create(chatModel);
		}

		static Map<String, String> promptVariables(OrderingConfig config, CoverageMap coverage) {
			Map<String, String> variables = new LinkedHashMap<>();
			variables.put("restaurant", config.restaurantName());
			variables.put("contact", config.contactNumber());
			variables.put("pickup_eta", config.pickupEta());
			variables.put("districts", String.join("، ", coverage.suggestions(coverage.zones().size())));
			return variables;
		}
	}
}
