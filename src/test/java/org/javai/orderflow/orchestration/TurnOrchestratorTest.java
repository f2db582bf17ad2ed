package org.javai.orderflow.orchestration;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.apache.logging.log4j.Level;
import org.javai.orderflow.config.OrderingConfig;
import org.javai.orderflow.context.ContextBudgeter;
import org.javai.orderflow.events.OrderingEvent;
import org.javai.orderflow.events.OrderingEvent.EventType;
import org.javai.orderflow.inference.InferenceRequest;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.PendingItem;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.SessionStatus;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.testsupport.LogCaptorAppender;
import org.javai.orderflow.testsupport.ScriptedInferenceClient;
import org.javai.orderflow.testsupport.TestFixtures;
import org.javai.orderflow.tools.ToolCall;
import org.javai.orderflow.tools.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.definition.ToolDefinition;

class TurnOrchestratorTest {

	private static final String SESSION = "s1";

	private final ScriptedInferenceClient model = new ScriptedInferenceClient();
	private final List<OrderingEvent> events = new ArrayList<>();
	private OrderingCore core = core(OrderingConfig.defaults());

	@AfterEach
	void close() {
		core.close();
	}

	@Test
	void firstMessageIsHandledByGreeting() {
		model.reply("أهلاً وسهلاً! توصيل ولا استلام؟");

		TurnResult result = handle("السلام عليكم");

		assertThat(result.text()).isEqualTo("أهلاً وسهلاً! توصيل ولا استلام؟");
		assertThat(result.stage()).isEqualTo(Stage.GREETING);
		assertThat(result.status()).isEqualTo(SessionStatus.ACTIVE);
		InferenceRequest request = model.lastRequest();
		assertThat(request.stage()).isEqualTo(Stage.GREETING);
		assertThat(request.tools()).extracting(ToolDefinition::name)
				.containsExactly("set_mode", "set_customer_name", "set_phone_number", "add_pending_item");
		assertThat(request.messages().get(0).role()).isEqualTo(ConversationMessage.Role.CONTEXT);
		assertThat(request.messages().get(request.messages().size() - 1).text()).isEqualTo("السلام عليكم");
	}

	@Test
	void sameStageTurnsSeeEarlierMessages() {
		model.reply("أهلاً").reply("تفضل");

		handle("مرحبا");
		handle("عندكم منيو؟");

		assertThat(model.lastRequest().messages()).extracting(ConversationMessage::text)
				.containsSubsequence("مرحبا", "أهلاً", "عندكم منيو؟");
	}

	@Test
	void stageChangeIsHandedOffOnTheNextTurn() {
		model.call("set_mode", "{\"mode\":\"pickup\"}")
				.reply("تمام، وش تحب تطلب؟")
				.reply("أبشر");

		TurnResult first = handle("استلام");

		assertThat(first.stage()).isEqualTo(Stage.ORDERING);
		assertThat(first.text()).isEqualTo("تمام، وش تحب تطلب؟");
		assertThat(session().pendingHandoff()).isPresent();
		assertThat(events).filteredOn(event -> event.type() == EventType.STAGE_TRANSITION).singleElement()
				.satisfies(event -> assertThat(event.payload())
						.containsEntry("from", "greeting")
						.containsEntry("to", "ordering")
						.containsEntry("trigger", "turn_end"));

		handle("أبي شاورما دجاج");

		InferenceRequest ordering = model.lastRequest();
		assertThat(ordering.stage()).isEqualTo(Stage.ORDERING);
		assertThat(ordering.messages()).hasSize(2);
		assertThat(ordering.messages().get(0).text())
				.contains("Task: help the customer with their order.")
				.contains("last customer message: استلام");
		assertThat(session().pendingHandoff()).isEmpty();
	}

	@Test
	void silentStageChainsIntoTheNextStage() {
		model.call("set_mode", "{\"mode\":\"pickup\"}")
				.reply("")
				.reply("حياك، وش تطلب اليوم؟");

		TurnResult result = handle("استلام من الفرع");

		assertThat(result.text()).isEqualTo("حياك، وش تطلب اليوم؟");
		assertThat(result.stage()).isEqualTo(Stage.ORDERING);
		assertThat(model.requests()).hasSize(3);
		assertThat(model.lastRequest().stage()).isEqualTo(Stage.ORDERING);
		assertThat(model.lastRequest().messages()).singleElement()
				.satisfies(message -> assertThat(message.role()).isEqualTo(ConversationMessage.Role.CONTEXT));
		assertThat(session().pendingHandoff()).isEmpty();
	}

	@Test
	void orderPhraseBeforeOrderingIsRememberedAndHandedOver() {
		model.call("set_mode", "{\"mode\":\"pickup\"}")
				.reply("تمام")
				.reply("أضفت لك الكبسة");

		handle("أبي اثنين كبسة لحم استلام");

		assertThat(session().pendingItems()).containsExactly(new PendingItem("كبسة لحم", 2));

		handle("نعم");

		assertThat(model.lastRequest().messages().get(0).text())
				.contains("the customer already asked for \"2 x كبسة لحم\"");
		assertThat(session().pendingItems()).isEmpty();
	}

	@Test
	void pendingItemRecordedByModelIsNotCapturedTwice() {
		model.call("add_pending_item", "{\"text\":\"كبسة باللحم\",\"quantity\":2}")
				.reply("أكيد، توصيل ولا استلام؟");

		handle("أبي اثنين كبسة لحم");

		assertThat(session().pendingItems()).containsExactly(new PendingItem("كبسة باللحم", 2));
	}

	@Test
	void routeChangeAtTurnStartCreatesHandoff() {
		core.store().withSession(SESSION, session -> {
			session.selectMode(FulfilmentMode.PICKUP);
			session.setActiveStage(Stage.ORDERING);
			session.selectMode(FulfilmentMode.DELIVERY);
			return null;
		});
		model.reply("لأي حي نوصل؟");

		TurnResult result = handle("غيرت رأيي، أبي توصيل");

		assertThat(result.stage()).isEqualTo(Stage.LOCATION);
		assertThat(model.lastRequest().messages().get(0).text())
				.contains("Ask for the delivery district and validate it.");
		assertThat(events).filteredOn(event -> event.type() == EventType.STAGE_TRANSITION).singleElement()
				.satisfies(event -> assertThat(event.payload()).containsEntry("trigger", "route"));
		assertThat(session().pendingItems()).isEmpty();
	}

	@Test
	void confirmationClosesTheSession() {
		readyForCheckout();
		model.call("confirm_order", "{}").reply("تم تأكيد طلبك!");

		TurnResult result = handle("أكد الطلب");

		assertThat(result.text()).isEqualTo("تم تأكيد طلبك!");
		assertThat(result.stage()).isEqualTo(Stage.CLOSED);
		assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
		assertThat(result.isClosed()).isTrue();
		assertThat(events).filteredOn(event -> event.type() == EventType.SESSION_CLOSED).singleElement()
				.satisfies(event -> assertThat(event.payload())
						.containsEntry("status", "completed")
						.containsEntry("reason", "order_confirmed")
						.containsKey("order_id"));

		TurnResult after = handle("شكراً");

		assertThat(after.text()).isEqualTo(OrderingConfig.Messages.defaults().closing());
		assertThat(model.requests()).hasSize(2);
	}

	@Test
	void mutationAfterConfirmationInSameBatchEndsTurn() {
		readyForCheckout();
		model.calls(new ToolCall("c1", "confirm_order", "{}"),
				new ToolCall("c2", "set_phone_number", "{\"phone\":\"0509999999\"}"));

		TurnResult result = handle("أكد");

		assertThat(result.text()).isEqualTo(OrderingConfig.Messages.defaults().closing());
		assertThat(result.stage()).isEqualTo(Stage.CLOSED);
		assertThat(result.toolResults()).extracting(ToolResult::tool).containsExactly("confirm_order");
		assertThat(session().phoneNumber()).contains("0551234567");
		assertThat(events).filteredOn(event -> event.type() == EventType.TOOL_CALL)
				.extracting(event -> event.payload().get("error"))
				.containsExactly(null, "session_closed");
	}

	@Test
	void modelOutageGivesApology() {
		model.fail(new OrderingException(ErrorKind.INFERENCE_UNAVAILABLE, "model down"));

		TurnResult result = handle("مرحبا");

		assertThat(result.text()).isEqualTo(OrderingConfig.defaults().apologyMessage());
		assertThat(result.status()).isEqualTo(SessionStatus.ACTIVE);
		assertThat(session().buffer().size()).isZero();
	}

	@Test
	void handoffSurvivesModelOutage() {
		model.call("set_mode", "{\"mode\":\"pickup\"}")
				.reply("تمام")
				.fail(new OrderingException(ErrorKind.INFERENCE_UNAVAILABLE, "model down"))
				.reply("أضفت لك الكبسة");

		handle("أبي اثنين كبسة لحم استلام");
		TurnResult failed = handle("نعم");

		assertThat(failed.text()).isEqualTo(OrderingConfig.defaults().apologyMessage());
		assertThat(session().pendingHandoff()).hasValueSatisfying(handoff -> {
			assertThat(handoff.from()).isEqualTo(Stage.GREETING);
			assertThat(handoff.to()).isEqualTo(Stage.ORDERING);
		});
		assertThat(session().pendingItems()).containsExactly(new PendingItem("كبسة لحم", 2));

		handle("نعم");

		assertThat(model.lastRequest().messages().get(0).text())
				.contains("the customer already asked for \"2 x كبسة لحم\"");
		assertThat(session().pendingHandoff()).isEmpty();
		assertThat(session().pendingItems()).isEmpty();
	}

	@Test
	void longOrderingConversationIsTruncatedWithShippedSettings() {
		OrderingConfig defaults = OrderingConfig.defaults();
		core.store().withSession(SESSION, session -> {
			session.selectMode(FulfilmentMode.PICKUP);
			session.setActiveStage(Stage.ORDERING);
			for (int i = 0; i < defaults.bufferCapacity(); i++) {
				String text = "message-" + i + " " + "ك".repeat(1000);
				session.buffer().append(i % 2 == 0 ? ConversationMessage.user(text) : ConversationMessage.assistant(text));
			}
			return null;
		});
		model.reply("أبشر");

		TurnResult result;
		try (LogCaptorAppender appender = LogCaptorAppender.create(ContextBudgeter.class, Level.INFO)) {
			result = handle("زيدني بيبسي");

			assertThat(appender.messagesAt(Level.INFO)).anyMatch(message -> message.contains("dropped 15 message(s)"));
		}

		assertThat(result.text()).isEqualTo("أبشر");
		List<ConversationMessage> sent = model.lastRequest().messages();
		assertThat(sent).hasSize(defaults.keepLast() + 1);
		assertThat(sent.get(0).role()).isEqualTo(ConversationMessage.Role.CONTEXT);
		assertThat(sent.get(1).text()).startsWith("message-15 ");
		assertThat(sent.get(sent.size() - 1).text()).isEqualTo("زيدني بيبسي");
		assertThat(events).filteredOn(event -> event.type() == EventType.TRUNCATION).singleElement()
				.satisfies(event -> assertThat(event.payload())
						.containsEntry("stage", "ordering")
						.containsEntry("ceiling", 12000)
						.containsEntry("dropped_messages", 15));
	}

	@Test
	void runawayToolLoopIsCutOff() {
		core.close();
		core = core(OrderingConfig.builder().maxToolRounds(2).build());
		model.call("set_customer_name", "{\"name\":\"سارة\"}")
				.call("set_customer_name", "{\"name\":\"سارة\"}");

		TurnResult result = handle("اسمي سارة");

		assertThat(result.text()).isEqualTo(OrderingConfig.Messages.defaults().tooComplex());
		assertThat(result.toolResults()).hasSize(2);
		assertThat(model.remaining()).isZero();
	}

	@Test
	void toolOutsideStageIsReportedBackToModel() {
		model.call("add_item", "{\"item_id\":\"pepsi\"}").reply("خلني أعرف أول توصيل ولا استلام");

		TurnResult result = handle("بيبسي");

		assertThat(result.toolResults()).singleElement()
				.satisfies(toolResult -> assertThat(toolResult.error()).isEqualTo(ErrorKind.TOOL_NOT_AVAILABLE));
		assertThat(model.lastRequest().rounds()).singleElement()
				.satisfies(round -> assertThat(round.replies().get(0).content()).contains("tool_not_available"));
		assertThat(session().ledger().isEmpty()).isTrue();
	}

	@Test
	void constraintsReachEveryStageInstruction() {
		model.reply("سلامتك، بنراعي هذا");

		handle("عندي حساسية من الفول السوداني");

		assertThat(session().constraints()).contains("حساسية من الفول السوداني");
		assertThat(model.lastRequest().instructions()).contains("حساسية من الفول السوداني");
	}

	@Test
	void modeSwitchIsAppliedBeforeOtherCalls() {
		List<ToolCall> ordered = TurnOrchestrator.applyOrder(List.of(
				new ToolCall("1", "add_item", "{}"),
				new ToolCall("2", "made_up", "{}"),
				new ToolCall("3", "set_mode", "{}"),
				new ToolCall("4", "remove_item", "{}")));

		assertThat(ordered).extracting(ToolCall::id).containsExactly("3", "1", "2", "4");
	}

	private void readyForCheckout() {
		core.store().withSession(SESSION, session -> {
			session.selectMode(FulfilmentMode.PICKUP);
			session.addItem("kabsa_chicken", 1, null, null);
			session.setCustomerName("خالد");
			session.setPhoneNumber("0551234567");
			session.setActiveStage(Stage.CHECKOUT);
			return null;
		});
	}

	private TurnResult handle(String text) {
		return core.orchestrator().handle(SESSION, text);
	}

	private SessionRecord session() {
		return core.store().get(SESSION).orElseThrow();
	}

	private OrderingCore core(OrderingConfig config) {
		return OrderingCore.builder()
				.config(config)
				.catalog(TestFixtures.catalog())
				.coverage(TestFixtures.coverage())
				.inferenceClient(model)
				.instructions((stage, constraints) -> "Stage " + stage.wireName() + "\n" + String.join("\n", constraints))
				.tokenEstimator(String::length)
				.eventSink(events::add)
				.clock(Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC))
				.build();
	}
}
