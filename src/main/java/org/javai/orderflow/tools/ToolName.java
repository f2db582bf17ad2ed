package org.javai.orderflow.tools;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.javai.orderflow.session.Stage;

/**
 * The closed set of operations a stage may ask for. Dispatch is an exhaustive switch over this
 * enum; a name the model invents that is not listed here never reaches a handler.
 */
public enum ToolName {

	SET_MODE(ToolArguments.SetMode.class,
			"Set how the customer receives the order: delivery or pickup."),
	SET_CUSTOMER_NAME(ToolArguments.CustomerName.class,
			"Record the customer's name."),
	SET_PHONE_NUMBER(ToolArguments.PhoneNumber.class,
			"Record the customer's mobile number."),
	ADD_PENDING_ITEM(ToolArguments.PendingRequest.class,
			"Remember an item the customer mentioned before ordering has started."),
	SEARCH_MENU(ToolArguments.SearchMenu.class,
			"Search the menu. Returns matching items with ids, prices and a confidence signal."),
	GET_ITEM_DETAILS(ToolArguments.ItemDetails.class,
			"Get full details of a menu item by id."),
	ADD_ITEM(ToolArguments.AddItem.class,
			"Add a menu item to the order by its id."),
	MODIFY_ITEM(ToolArguments.ModifyItem.class,
			"Change quantity, size or notes of an item already in the order."),
	REMOVE_ITEM(ToolArguments.RemoveItem.class,
			"Remove an item from the order."),
	GET_ORDER(ToolArguments.None.class,
			"Show the current order and subtotal."),
	SELECT_OFFERED(ToolArguments.SelectOffered.class,
			"Add one of the items offered by the last search, identified by the customer's reply."),
	CHECK_DELIVERY_DISTRICT(ToolArguments.CheckDistrict.class,
			"Check whether a district is covered for delivery and get its fee and ETA."),
	SET_DELIVERY_ADDRESS(ToolArguments.DeliveryAddress.class,
			"Record street, building and directions after the district is confirmed."),
	CALCULATE_TOTAL(ToolArguments.None.class,
			"Calculate subtotal, delivery fee and total."),
	CONFIRM_ORDER(ToolArguments.None.class,
			"Place the order after the customer's final confirmation."),
	GET_SESSION_STATE(ToolArguments.None.class,
			"Show everything known about the customer and the order.");

	/** Priority of every call that is not a mode switch, including names the model invented. */
	public static final int DEFAULT_APPLY_PRIORITY = 1;

	private final Class<?> argumentType;
	private final String description;

	ToolName(Class<?> argumentType, String description) {
		this.argumentType = argumentType;
		this.description = description;
	}

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public Class<?> argumentType() {
		return argumentType;
	}

	public String description() {
		return description;
	}

	public static Optional<ToolName> fromWire(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return Arrays.stream(values()).filter(tool -> tool.wireName().equals(name)).findFirst();
	}

	/**
	 * Tools the given stage may call.
	 */
	public static Set<ToolName> surfaceOf(Stage stage) {
		return switch (stage) {
			case GREETING -> EnumSet.of(SET_MODE, SET_CUSTOMER_NAME, SET_PHONE_NUMBER, ADD_PENDING_ITEM);
			case LOCATION -> EnumSet.of(CHECK_DELIVERY_DISTRICT, SET_DELIVERY_ADDRESS, SET_MODE, GET_ORDER);
			case ORDERING -> EnumSet.of(SEARCH_MENU, GET_ITEM_DETAILS, ADD_ITEM, MODIFY_ITEM, REMOVE_ITEM, GET_ORDER,
					SELECT_OFFERED, SET_MODE, SET_CUSTOMER_NAME, SET_PHONE_NUMBER);
			case CHECKOUT -> EnumSet.of(CALCULATE_TOTAL, CONFIRM_ORDER, SET_CUSTOMER_NAME, SET_PHONE_NUMBER, SET_MODE,
					GET_SESSION_STATE, GET_ORDER);
			case CLOSED -> EnumSet.noneOf(ToolName.class);
		};
	}

	/**
	 * Mode switches are applied ahead of ledger mutations issued in the same response.
	 */
	public int applyPriority() {
		return this == SET_MODE ? 0 : DEFAULT_APPLY_PRIORITY;
	}
}
