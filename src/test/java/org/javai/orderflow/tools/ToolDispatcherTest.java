package org.javai.orderflow.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.ZoneOffset;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.context.ContextSynthesizer;
import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

class ToolDispatcherTest {

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final ToolDispatcher dispatcher = new ToolDispatcher(
			new CatalogResolver(TestFixtures.catalog()),
			TestFixtures.coverage(),
			new ContextSynthesizer(),
			new ToolDispatcher.CheckoutSettings("15-20 دقيقة", "30-45 دقيقة", "920001234"),
			Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC),
			objectMapper);
	private final SessionRecord session = TestFixtures.session("s1");
	private int nextId = 1;

	@Test
	void toolOutsideStageSurfaceIsRefused() {
		ToolResult result = dispatch(Stage.GREETING, "add_item", "{\"item_id\":\"pepsi\"}");

		assertThat(result.success()).isFalse();
		assertThat(result.error()).isEqualTo(ErrorKind.TOOL_NOT_AVAILABLE);
		assertThat(session.ledger().isEmpty()).isTrue();
	}

	@Test
	void inventedToolIsRefused() {
		ToolResult result = dispatch(Stage.ORDERING, "apply_discount", "{}");

		assertThat(result.error()).isEqualTo(ErrorKind.TOOL_NOT_AVAILABLE);
	}

	@Test
	void malformedArgumentsAreInvalid() {
		ToolResult result = dispatch(Stage.ORDERING, "add_item", "{\"item_id\": ");

		assertThat(result.error()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
	}

	@Test
	void unknownArgumentFieldsAreIgnored() {
		ToolResult result = dispatch(Stage.ORDERING, "add_item", "{\"item_id\":\"pepsi\",\"quantity\":2,\"colour\":\"red\"}");

		assertThat(result.success()).isTrue();
		assertThat(session.ledger().total()).isEqualByComparingTo("10");
	}

	@Test
	void missingRequiredArgumentIsInvalid() {
		ToolResult result = dispatch(Stage.ORDERING, "add_item", "{}");

		assertThat(result.error()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
	}

	@Test
	void searchThenSelectOfferedItem() {
		ToolResult search = dispatch(Stage.ORDERING, "search_menu", "{\"query\":\"برجر\"}");

		assertThat(search.success()).isTrue();
		assertThat(search.data()).containsEntry("match", "keyword");
		assertThat(session.offeredItems()).hasSize(2);

		ToolResult chosen = dispatch(Stage.ORDERING, "select_offered", "{\"hint\":\"دجاج\",\"quantity\":2}");

		assertThat(chosen.success()).isTrue();
		assertThat(session.ledger().lines()).singleElement()
				.satisfies(line -> assertThat(line.catalogId()).isEqualTo("burger_chicken"));
	}

	@Test
	void selectOfferedUnderstandsTheDefiniteArticle() {
		dispatch(Stage.ORDERING, "search_menu", "{\"query\":\"برجر\"}");

		ToolResult chosen = dispatch(Stage.ORDERING, "select_offered", "{\"hint\":\"الدجاج\"}");

		assertThat(chosen.success()).isTrue();
		assertThat(session.ledger().lines()).singleElement()
				.satisfies(line -> assertThat(line.catalogId()).isEqualTo("burger_chicken"));
	}

	@Test
	void selectOfferedHintNamingEveryOfferIsRejected() {
		dispatch(Stage.ORDERING, "search_menu", "{\"query\":\"برجر\"}");

		ToolResult chosen = dispatch(Stage.ORDERING, "select_offered", "{\"hint\":\"البرجر\"}");

		assertThat(chosen.error()).isEqualTo(ErrorKind.ITEM_NOT_FOUND);
		assertThat(session.ledger().lines()).isEmpty();
	}

	@Test
	void selectOfferedWithoutSearchFails() {
		ToolResult result = dispatch(Stage.ORDERING, "select_offered", "{\"hint\":\"1\"}");

		assertThat(result.error()).isEqualTo(ErrorKind.ITEM_NOT_FOUND);
	}

	@Test
	void searchWithoutMatchSuggestsCategories() {
		ToolResult result = dispatch(Stage.ORDERING, "search_menu", "{\"query\":\"سوشي\"}");

		assertThat(result.success()).isTrue();
		assertThat(result.data()).containsEntry("match", "not_found").containsKey("available_categories");
	}

	@Test
	void uncoveredDistrictOffersAlternatives() {
		ToolResult result = dispatch(Stage.LOCATION, "check_delivery_district", "{\"district\":\"الدرعية\"}");

		assertThat(result.error()).isEqualTo(ErrorKind.DISTRICT_NOT_COVERED);
		assertThat(result.data()).containsEntry("pickup_available", true).containsKey("suggestions");
		assertThat(session.locationConfirmed()).isFalse();
	}

	@Test
	void partialAddressIsKeptAndReported() {
		dispatch(Stage.LOCATION, "check_delivery_district", "{\"district\":\"حي النرجس\"}");

		ToolResult partial = dispatch(Stage.LOCATION, "set_delivery_address", "{\"street\":\"شارع الملك فهد\"}");
		ToolResult rest = dispatch(Stage.LOCATION, "set_delivery_address", "{\"building\":\"22\"}");

		assertThat(partial.error()).isEqualTo(ErrorKind.ADDRESS_INCOMPLETE);
		assertThat(rest.success()).isTrue();
		assertThat(session.fullAddress()).isEqualTo("حي النرجس، شارع الملك فهد، مبنى 22");
	}

	@Test
	void invalidModeIsRejected() {
		ToolResult result = dispatch(Stage.GREETING, "set_mode", "{\"mode\":\"drone\"}");

		assertThat(result.error()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
		assertThat(session.modeSelected()).isFalse();
	}

	@Test
	void pendingItemIsRemembered() {
		ToolResult result = dispatch(Stage.GREETING, "add_pending_item", "{\"text\":\"كبسة لحم\",\"quantity\":2}");

		assertThat(result.success()).isTrue();
		assertThat(session.pendingItems()).singleElement()
				.satisfies(item -> assertThat(item.quantity()).isEqualTo(2));
	}

	@Test
	void totalIncludesDeliveryFee() {
		dispatch(Stage.LOCATION, "check_delivery_district", "{\"district\":\"العليا\"}");
		session.addItem("kabsa_meat", 1, null, null);

		ToolResult result = dispatch(Stage.CHECKOUT, "calculate_total", "{}");

		assertThat(result.data().get("total")).hasToString("65");
		assertThat(result.data().get("delivery_fee")).hasToString("20");
	}

	@Test
	void confirmationAsksForOneMissingThingAtATime() {
		assertThat(dispatch(Stage.CHECKOUT, "confirm_order", "{}").error()).isEqualTo(ErrorKind.EMPTY_ORDER);

		session.addItem("hummus", 1, null, null);
		ToolResult noName = dispatch(Stage.CHECKOUT, "confirm_order", "{}");
		assertThat(noName.error()).isEqualTo(ErrorKind.MISSING_CUSTOMER_INFO);
		assertThat(noName.data()).containsEntry("missing", "name");

		session.setCustomerName("خالد");
		assertThat(dispatch(Stage.CHECKOUT, "confirm_order", "{}").data()).containsEntry("missing", "phone");

		session.setPhoneNumber("0551234567");
		assertThat(dispatch(Stage.CHECKOUT, "confirm_order", "{}").error()).isEqualTo(ErrorKind.DISTRICT_NOT_CONFIRMED);

		dispatch(Stage.LOCATION, "check_delivery_district", "{\"district\":\"الياسمين\"}");
		assertThat(dispatch(Stage.CHECKOUT, "confirm_order", "{}").error()).isEqualTo(ErrorKind.ADDRESS_INCOMPLETE);
		assertThat(session.isActive()).isTrue();
	}

	@Test
	void pickupConfirmationClosesSession() {
		session.addItem("shawarma_chicken", 2, null, null);
		session.setCustomerName("خالد");
		session.setPhoneNumber("0551234567");
		session.selectMode(FulfilmentMode.PICKUP);

		ToolResult result = dispatch(Stage.CHECKOUT, "confirm_order", "{}");

		assertThat(result.success()).isTrue();
		assertThat((String) result.data().get("order_id")).matches("ORD-20250314-[0-9A-F]{4}");
		assertThat(result.data()).containsEntry("estimated_time", "15-20 دقيقة").doesNotContainKey("address");
		assertThat(session.isActive()).isFalse();
		assertThat(session.orderId()).contains((String) result.data().get("order_id"));
	}

	@Test
	void deliveryWithoutZoneEtaUsesDefault() {
		session.addItem("pepsi", 1, null, null);
		session.setCustomerName("خالد");
		session.setPhoneNumber("0551234567");
		dispatch(Stage.LOCATION, "check_delivery_district", "{\"district\":\"الصحافة\"}");
		dispatch(Stage.LOCATION, "set_delivery_address", "{\"street\":\"شارع 9\",\"building\":\"4\"}");

		ToolResult result = dispatch(Stage.CHECKOUT, "confirm_order", "{}");

		assertThat(result.data())
				.containsEntry("estimated_time", "30-45 دقيقة")
				.containsEntry("address", "حي الصحافة، شارع 9، مبنى 4");
	}

	@Test
	void closedSessionEndsTheTurn() {
		session.complete("ORD-1", TestFixtures.NOW);

		assertThatThrownBy(() -> dispatch(Stage.ORDERING, "add_item", "{\"item_id\":\"pepsi\"}"))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.SESSION_CLOSED));
	}

	@Test
	void resultJsonCarriesErrorCode() throws Exception {
		ToolResult failure = dispatch(Stage.ORDERING, "remove_item", "{\"selector\":\"1\"}");

		JsonNode json = objectMapper.readTree(dispatcher.toJson(failure));

		assertThat(json.get("success").asBoolean()).isFalse();
		assertThat(json.get("error").asText()).isEqualTo("empty_order");
		assertThat(json.get("message").asText()).isNotBlank();
	}

	@Test
	void successJsonHasNoErrorField() throws Exception {
		JsonNode json = objectMapper.readTree(dispatcher.toJson(dispatch(Stage.ORDERING, "get_order", "{}")));

		assertThat(json.has("error")).isFalse();
		assertThat(json.at("/data/summary").asText()).isEqualTo("order: empty");
	}

	private ToolResult dispatch(Stage stage, String tool, String arguments) {
		return dispatcher.dispatch(session, stage, new ToolCall("call_" + nextId++, tool, arguments));
	}
}
