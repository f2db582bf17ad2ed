package org.javai.orderflow.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.catalog.CatalogResolver;
import org.javai.orderflow.context.ContextSynthesizer;
import org.javai.orderflow.coverage.CoverageMap;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies model-issued tool calls to a session.
 *
 * <p>Each call is checked against the stage's tool surface, its JSON arguments are bound to the
 * tool's argument record, and the matching handler runs. Recoverable failures come back as a
 * failed {@link ToolResult} for the model to act on. Terminal failures
 * ({@link ErrorKind#SESSION_CLOSED}) are rethrown so the orchestrator can end the turn.</p>
 */
public class ToolDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

	private final ObjectMapper objectMapper;
	private final OrderTools orderTools;
	private final LocationTools locationTools;
	private final CustomerTools customerTools;
	private final CheckoutTools checkoutTools;

	/**
	 * Checkout settings for the dispatcher.
	 *
	 * @param pickupEta quoted time for pickup orders
	 * @param defaultDeliveryEta quoted delivery time when the zone has none
	 * @param contactNumber number customers can call
	 */
	public record CheckoutSettings(String pickupEta, String defaultDeliveryEta, String contactNumber) {
	}

	public ToolDispatcher(CatalogResolver resolver, CoverageMap coverage, ContextSynthesizer synthesizer,
			CheckoutSettings checkout, Clock clock, ObjectMapper objectMapper) {
		this(objectMapper,
				new OrderTools(resolver),
				new LocationTools(coverage),
				new CustomerTools(synthesizer),
				new CheckoutTools(clock, checkout.pickupEta(), checkout.defaultDeliveryEta(), checkout.contactNumber()));
	}

	ToolDispatcher(ObjectMapper objectMapper, OrderTools orderTools, LocationTools locationTools,
			CustomerTools customerTools, CheckoutTools checkoutTools) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
				.copy()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		this.orderTools = orderTools;
		this.locationTools = locationTools;
		this.customerTools = customerTools;
		this.checkoutTools = checkoutTools;
	}

	/**
	 * Runs one tool call.
	 *
	 * @throws OrderingException only for terminal error kinds
	 */
	public ToolResult dispatch(SessionRecord session, Stage stage, ToolCall call) {
		Objects.requireNonNull(session, "session must not be null");
		Objects.requireNonNull(call, "call must not be null");
		try {
			ToolName tool = resolve(stage, call);
			ToolOutcome outcome = apply(session, tool, call);
			logger.debug("Session {} tool {} succeeded: {}", session.id(), call.name(), outcome.message());
			return ToolResult.success(call, outcome.message(), outcome.data());
		}
		catch (OrderingException e) {
			if (e.isTerminal()) {
				logger.warn("Session {} tool {} hit terminal error {}", session.id(), call.name(), e.kind());
				throw e;
			}
			logger.warn("Session {} tool {} failed with {}: {}", session.id(), call.name(), e.kind(), e.getMessage());
			return ToolResult.failure(call, e);
		}
	}

	/**
	 * Serializes a result into the JSON the model receives.
	 */
	public String toJson(ToolResult result) {
		ObjectNode node = objectMapper.createObjectNode();
		node.put("success", result.success());
		if (result.error() != null) {
			node.put("error", result.error().code());
		}
		node.put("message", result.message());
		node.set("data", objectMapper.valueToTree(result.data()));
		try {
			return objectMapper.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Tool result for " + result.tool() + " is not serializable", e);
		}
	}

	private ToolName resolve(Stage stage, ToolCall call) {
		Optional<ToolName> tool = ToolName.fromWire(call.name());
		if (tool.isEmpty() || !ToolName.surfaceOf(stage).contains(tool.get())) {
			throw new OrderingException(ErrorKind.TOOL_NOT_AVAILABLE,
					"Tool '" + call.name() + "' is not available in the " + stage.wireName() + " stage");
		}
		return tool.get();
	}

	private ToolOutcome apply(SessionRecord session, ToolName tool, ToolCall call) {
		return switch (tool) {
			case SET_MODE -> customerTools.setMode(session, bind(call, ToolArguments.SetMode.class));
			case SET_CUSTOMER_NAME -> customerTools.setName(session, bind(call, ToolArguments.CustomerName.class));
			case SET_PHONE_NUMBER -> customerTools.setPhone(session, bind(call, ToolArguments.PhoneNumber.class));
			case ADD_PENDING_ITEM -> orderTools.addPendingItem(session, bind(call, ToolArguments.PendingRequest.class));
			case SEARCH_MENU -> orderTools.searchMenu(session, bind(call, ToolArguments.SearchMenu.class));
			case GET_ITEM_DETAILS -> orderTools.itemDetails(bind(call, ToolArguments.ItemDetails.class));
			case ADD_ITEM -> orderTools.addItem(session, bind(call, ToolArguments.AddItem.class));
			case MODIFY_ITEM -> orderTools.modifyItem(session, bind(call, ToolArguments.ModifyItem.class));
			case REMOVE_ITEM -> orderTools.removeItem(session, bind(call, ToolArguments.RemoveItem.class));
			case GET_ORDER -> orderTools.currentOrder(session);
			case SELECT_OFFERED -> orderTools.selectOffered(session, bind(call, ToolArguments.SelectOffered.class));
			case CHECK_DELIVERY_DISTRICT -> locationTools.checkDistrict(session, bind(call, ToolArguments.CheckDistrict.class));
			case SET_DELIVERY_ADDRESS -> locationTools.setAddress(session, bind(call, ToolArguments.DeliveryAddress.class));
			case CALCULATE_TOTAL -> checkoutTools.calculateTotal(session);
			case CONFIRM_ORDER -> checkoutTools.confirmOrder(session);
			case GET_SESSION_STATE -> customerTools.sessionState(session);
		};
	}

	private <T> T bind(ToolCall call, Class<T> type) {
		try {
			return objectMapper.readValue(call.arguments(), type);
		}
		catch (JsonProcessingException e) {
			throw new OrderingException(ErrorKind.INVALID_ARGUMENT,
					"Arguments for '" + call.name() + "' are not valid: " + e.getOriginalMessage(), e);
		}
	}
}
