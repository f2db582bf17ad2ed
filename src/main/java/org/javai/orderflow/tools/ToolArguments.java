package org.javai.orderflow.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Typed argument records, one per tool. Each record is both the JSON schema source for the
 * tool definition and the Jackson binding target for the model's arguments.
 */
public final class ToolArguments {

	private ToolArguments() {
	}

	public record None() {
	}

	public record SetMode(
			@ToolParam(description = "Fulfilment mode: delivery or pickup") String mode) {
	}

	public record CustomerName(
			@ToolParam(description = "Customer's name as they gave it") String name) {
	}

	public record PhoneNumber(
			@ToolParam(description = "Customer's mobile number") String phone) {
	}

	public record PendingRequest(
			@ToolParam(description = "What the customer asked for, in their words") String text,
			@ToolParam(description = "How many, default 1", required = false) Integer quantity) {
	}

	public record SearchMenu(
			@ToolParam(description = "Free-text menu query, e.g. برجر لحم") String query) {
	}

	public record ItemDetails(
			@JsonProperty("item_id") @ToolParam(description = "Catalog item id from search results") String itemId) {
	}

	public record AddItem(
			@JsonProperty("item_id") @ToolParam(description = "Catalog item id from search results") String itemId,
			@ToolParam(description = "Quantity between 1 and 10", required = false) Integer quantity,
			@ToolParam(description = "Size name for sized items", required = false) String size,
			@ToolParam(description = "Preparation notes", required = false) String notes) {
	}

	public record ModifyItem(
			@ToolParam(description = "Line number (1-based) or item name in the current order") String selector,
			@ToolParam(description = "New quantity between 1 and 10", required = false) Integer quantity,
			@ToolParam(description = "New size", required = false) String size,
			@ToolParam(description = "New notes", required = false) String notes) {
	}

	public record RemoveItem(
			@ToolParam(description = "Line number (1-based) or item name in the current order") String selector) {
	}

	public record SelectOffered(
			@ToolParam(description = "Customer's reply identifying one of the offered items") String hint,
			@ToolParam(description = "Quantity between 1 and 10", required = false) Integer quantity) {
	}

	public record CheckDistrict(
			@ToolParam(description = "District name as the customer said it") String district) {
	}

	public record DeliveryAddress(
			@ToolParam(description = "Street name", required = false) String street,
			@ToolParam(description = "Building or villa number", required = false) String building,
			@ToolParam(description = "Extra directions", required = false) String notes) {
	}
}
