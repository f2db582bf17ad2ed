package org.javai.orderflow.orchestration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.config.OrderingConfig;
import org.javai.orderflow.context.AssembledInput;
import org.javai.orderflow.context.ContextBudgeter;
import org.javai.orderflow.context.ContextSynthesizer;
import org.javai.orderflow.context.StageInstructions;
import org.javai.orderflow.events.EventSink;
import org.javai.orderflow.events.OrderingEvent;
import org.javai.orderflow.events.OrderingEvent.EventType;
import org.javai.orderflow.inference.InferenceClient;
import org.javai.orderflow.inference.InferenceRequest;
import org.javai.orderflow.inference.InferenceResponse;
import org.javai.orderflow.inference.ToolReply;
import org.javai.orderflow.inference.ToolRound;
import org.javai.orderflow.routing.StageRouter;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.PendingHandoff;
import org.javai.orderflow.session.PendingItem;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.SessionStore;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.tools.ToolCall;
import org.javai.orderflow.tools.ToolCatalog;
import org.javai.orderflow.tools.ToolDispatcher;
import org.javai.orderflow.tools.ToolName;
import org.javai.orderflow.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one inbound message through routing, context synthesis, budgeting and the model/tool
 * loop.
 *
 * <p>The whole turn runs under the session's lock, so tool side effects of one message are
 * never interleaved with another message for the same session. A stage change found at the end
 * of a turn is recorded as a pending handoff and rendered at the start of the next turn, unless
 * the stage produced no text, in which case the new stage runs straight away.</p>
 */
public class TurnOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(TurnOrchestrator.class);

	private final SessionStore store;
	private final StageRouter router;
	private final ContextSynthesizer synthesizer;
	private final ContextBudgeter budgeter;
	private final StageInstructions instructions;
	private final ToolCatalog toolCatalog;
	private final ToolDispatcher dispatcher;
	private final InferenceClient inferenceClient;
	private final EventSink eventSink;
	private final OrderingConfig config;
	private final Clock clock;
	private final ConstraintDetector constraintDetector = new ConstraintDetector();
	private final PendingItemExtractor pendingItemExtractor = new PendingItemExtractor();

	public TurnOrchestrator(SessionStore store, StageRouter router, ContextSynthesizer synthesizer,
			ContextBudgeter budgeter, StageInstructions instructions, ToolCatalog toolCatalog,
			ToolDispatcher dispatcher, InferenceClient inferenceClient, EventSink eventSink,
			OrderingConfig config, Clock clock) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.router = Objects.requireNonNull(router, "router must not be null");
		this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
		this.budgeter = Objects.requireNonNull(budgeter, "budgeter must not be null");
		this.instructions = Objects.requireNonNull(instructions, "instructions must not be null");
		this.toolCatalog = Objects.requireNonNull(toolCatalog, "toolCatalog must not be null");
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
		this.inferenceClient = Objects.requireNonNull(inferenceClient, "inferenceClient must not be null");
		this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	/**
	 * Handles one customer message. Unknown session ids start a new session.
	 */
	public TurnResult handle(String sessionId, String userText) {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		String text = userText == null ? "" : userText.strip();
		return store.withSession(sessionId, session -> runTurn(session, text));
	}

	private TurnResult runTurn(SessionRecord session, String userText) {
		List<ToolResult> results = new ArrayList<>();
		if (!session.isActive()) {
			logger.debug("Session {} is {}, answering with the closing message", session.id(), session.status());
			return result(session, config.messages().closing(), results);
		}

		for (String constraint : constraintDetector.detect(userText)) {
			if (session.addConstraint(constraint)) {
				logger.info("Session {} recorded constraint '{}'", session.id(), constraint);
			}
		}

		Stage previous = session.activeStage().orElse(null);
		Stage stage = router.route(session);
		PendingHandoff handoff = session.consumePendingHandoff().orElse(null);
		if (handoff != null && handoff.to() != stage) {
			handoff = new PendingHandoff(handoff.from(), stage, handoff.lastUserUtterance());
		}
		if (previous != stage) {
			session.setActiveStage(stage);
			if (previous != null) {
				session.buffer().clear();
				emitTransition(session, previous, stage, "route");
				if (handoff == null) {
					handoff = new PendingHandoff(previous, stage, userText);
				}
			}
			else {
				logger.debug("Session {} starts in {}", session.id(), stage.wireName());
			}
		}

		String input = userText;
		String reply = "";
		int chained = 0;
		List<PendingItem> pendingBeforeRun = List.of();
		try {
			while (true) {
				pendingBeforeRun = session.pendingItems();
				StageRun run = runStage(session, stage, input, handoff, results);
				if (run.tooComplex()) {
					logger.warn("Session {} ran out of tool rounds in {}", session.id(), stage.wireName());
					appendToBuffer(session, input, config.messages().tooComplex());
					return result(session, config.messages().tooComplex(), results);
				}
				reply = run.text();
				captureFallbackPendingItem(session, stage, input, results);
				appendToBuffer(session, input, reply);

				if (!session.isActive()) {
					closeAfterCompletion(session, stage);
					break;
				}
				Stage next = router.route(session);
				if (next == stage) {
					break;
				}
				session.setActiveStage(next);
				session.buffer().clear();
				emitTransition(session, stage, next, "turn_end");
				PendingHandoff nextHandoff = new PendingHandoff(stage, next, userText);
				if (reply.isBlank() && chained < config.maxChainedHandoffs()) {
					chained++;
					logger.debug("Session {} chaining into {} ({} of {})", session.id(), next.wireName(),
							chained, config.maxChainedHandoffs());
					handoff = nextHandoff;
					stage = next;
					input = "";
					continue;
				}
				session.setPendingHandoff(nextHandoff);
				break;
			}
		}
		catch (OrderingException e) {
			if (e.kind() == ErrorKind.SESSION_CLOSED) {
				logger.info("Session {} closed during the turn", session.id());
				if (session.activeStage().orElse(null) != Stage.CLOSED) {
					closeAfterCompletion(session, stage);
				}
				return result(session, config.messages().closing(), results);
			}
			if (e.kind() == ErrorKind.INFERENCE_UNAVAILABLE) {
				logger.error("Session {} turn abandoned: {}", session.id(), e.getMessage());
				restoreHandoff(session, handoff, pendingBeforeRun);
				return result(session, config.apologyMessage(), results);
			}
			throw e;
		}
		return result(session, reply, results);
	}

	private record StageRun(String text, boolean tooComplex) {
	}

	/**
	 * Puts back what an abandoned stage run consumed, so the next turn renders the same handoff.
	 */
	private void restoreHandoff(SessionRecord session, PendingHandoff handoff, List<PendingItem> pending) {
		if (handoff == null || !session.isActive()) {
			return;
		}
		session.setPendingHandoff(handoff);
		pending.forEach(session::addPendingItem);
		logger.debug("Session {} keeps handoff {} -> {} with {} pending item(s) for the next turn",
				session.id(), handoff.from().wireName(), handoff.to().wireName(), pending.size());
	}

	private StageRun runStage(SessionRecord session, Stage stage, String userText, PendingHandoff handoff,
			List<ToolResult> results) {
		String stageInstructions = instructions.instructionsFor(stage, session.constraints());
		AssembledInput input = synthesizer.assemble(session, stage, stageInstructions, userText, handoff);
		input = budgeter.budget(session.id(), input);
		InferenceRequest request = InferenceRequest.of(session.id(), input, toolCatalog.forStage(stage));

		for (int round = 1; round <= config.maxToolRounds(); round++) {
			InferenceResponse response = inferenceClient.infer(request);
			if (!response.hasToolCalls()) {
				logger.debug("Session {} stage {} answered after {} round(s)", session.id(), stage.wireName(), round);
				return new StageRun(response.text(), false);
			}
			List<ToolCall> calls = applyOrder(response.toolCalls());
			List<ToolReply> replies = new ArrayList<>();
			for (ToolCall call : calls) {
				ToolResult result = dispatch(session, stage, call);
				results.add(result);
				replies.add(new ToolReply(call.id(), call.name(), dispatcher.toJson(result)));
			}
			request = request.withRound(new ToolRound(response.text(), calls, replies));
		}
		return new StageRun("", true);
	}

	/**
	 * Mode switches go first so ledger calls in the same batch see the new mode. Otherwise the
	 * model's order is kept.
	 */
	static List<ToolCall> applyOrder(List<ToolCall> calls) {
		List<ToolCall> ordered = new ArrayList<>(calls);
		ordered.sort(Comparator.comparingInt(call ->
				ToolName.fromWire(call.name()).map(ToolName::applyPriority).orElse(ToolName.DEFAULT_APPLY_PRIORITY)));
		return ordered;
	}

	private ToolResult dispatch(SessionRecord session, Stage stage, ToolCall call) {
		ToolResult result;
		try {
			result = dispatcher.dispatch(session, stage, call);
		}
		catch (OrderingException e) {
			emitToolCall(session, stage, call, false, e.kind(), e.getMessage());
			throw e;
		}
		emitToolCall(session, stage, call, result.success(), result.error(), result.message());
		return result;
	}

	private void captureFallbackPendingItem(SessionRecord session, Stage stage, String userText,
			List<ToolResult> results) {
		if (stage != Stage.GREETING && stage != Stage.LOCATION) {
			return;
		}
		if (!session.isActive() || !session.ledger().isEmpty() || !session.pendingItems().isEmpty()) {
			return;
		}
		boolean recordedByModel = results.stream()
				.anyMatch(r -> r.success() && ToolName.ADD_PENDING_ITEM.wireName().equals(r.tool()));
		if (recordedByModel) {
			return;
		}
		pendingItemExtractor.extract(userText).ifPresent(item -> {
			session.addPendingItem(item);
			logger.debug("Session {} captured pending item '{}' x{}", session.id(), item.text(), item.quantity());
		});
	}

	private void appendToBuffer(SessionRecord session, String userText, String reply) {
		if (!userText.isBlank()) {
			session.buffer().append(ConversationMessage.user(userText));
		}
		if (!reply.isBlank()) {
			session.buffer().append(ConversationMessage.assistant(reply));
		}
	}

	private void closeAfterCompletion(SessionRecord session, Stage stage) {
		String reason = session.orderId().isPresent() ? "order_confirmed" : "session_closed";
		session.setActiveStage(Stage.CLOSED);
		emitTransition(session, stage, Stage.CLOSED, reason);
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("status", session.status().name().toLowerCase(Locale.ROOT));
		payload.put("reason", reason);
		session.orderId().ifPresent(id -> payload.put("order_id", id));
		emit(session, EventType.SESSION_CLOSED, payload);
	}

	private void emitTransition(SessionRecord session, Stage from, Stage to, String trigger) {
		logger.info("Session {} stage {} -> {} ({})", session.id(), from.wireName(), to.wireName(), trigger);
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("from", from.wireName());
		payload.put("to", to.wireName());
		payload.put("trigger", trigger);
		emit(session, EventType.STAGE_TRANSITION, payload);
	}

	private void emitToolCall(SessionRecord session, Stage stage, ToolCall call, boolean success, ErrorKind error,
			String message) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("stage", stage.wireName());
		payload.put("tool", call.name());
		payload.put("call_id", call.id());
		payload.put("success", success);
		if (error != null) {
			payload.put("error", error.code());
		}
		payload.put("message", message);
		emit(session, EventType.TOOL_CALL, payload);
	}

	private void emit(SessionRecord session, EventType type, Map<String, Object> payload) {
		eventSink.emit(new OrderingEvent(clock.instant(), session.id(), type, payload));
	}

	private TurnResult result(SessionRecord session, String text, List<ToolResult> results) {
		Stage stage = session.activeStage().orElse(Stage.GREETING);
		return new TurnResult(session.id(), text, stage, session.status(), results);
	}
}
