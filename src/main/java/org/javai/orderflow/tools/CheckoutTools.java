package org.javai.orderflow.tools;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Totals and order confirmation.
 *
 * <p>Confirmation checks run in a fixed order so the customer is asked for one missing thing
 * at a time: items, name, phone, then for delivery the district and the address.</p>
 */
class CheckoutTools {

	private static final Logger logger = LoggerFactory.getLogger(CheckoutTools.class);
	private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

	private final Clock clock;
	private final Random random;
	private final String pickupEta;
	private final String defaultDeliveryEta;
	private final String contactNumber;

	CheckoutTools(Clock clock, String pickupEta, String defaultDeliveryEta, String contactNumber) {
		this(clock, new SecureRandom(), pickupEta, defaultDeliveryEta, contactNumber);
	}

	CheckoutTools(Clock clock, Random random, String pickupEta, String defaultDeliveryEta, String contactNumber) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.random = Objects.requireNonNull(random, "random must not be null");
		this.pickupEta = pickupEta;
		this.defaultDeliveryEta = defaultDeliveryEta;
		this.contactNumber = contactNumber;
	}

	ToolOutcome calculateTotal(SessionRecord session) {
		return ToolOutcome.of("Order total", totals(session));
	}

	ToolOutcome confirmOrder(SessionRecord session) {
		session.ensureActive();
		if (session.ledger().isEmpty()) {
			throw new OrderingException(ErrorKind.EMPTY_ORDER, "Cannot confirm an empty order");
		}
		if (session.customerName().isEmpty()) {
			throw new OrderingException(ErrorKind.MISSING_CUSTOMER_INFO, "Customer name is required",
					Map.of("missing", "name"));
		}
		if (session.phoneNumber().isEmpty()) {
			throw new OrderingException(ErrorKind.MISSING_CUSTOMER_INFO, "Phone number is required",
					Map.of("missing", "phone"));
		}
		boolean delivery = session.mode() == FulfilmentMode.DELIVERY;
		if (delivery && !session.locationConfirmed()) {
			throw new OrderingException(ErrorKind.DISTRICT_NOT_CONFIRMED, "Delivery district has not been confirmed");
		}
		if (delivery && !session.addressComplete()) {
			throw new OrderingException(ErrorKind.ADDRESS_INCOMPLETE, "Street and building are required for delivery",
					Map.of("missing", session.street().isEmpty() ? "street" : "building"));
		}

		Map<String, Object> data = totals(session);
		String orderId = nextOrderId();
		session.complete(orderId, clock.instant());
		data.put("order_id", orderId);
		data.put("customer_name", session.customerName().orElse(""));
		data.put("phone", session.phoneNumber().orElse(""));
		data.put("items", session.ledger().lines().stream().map(ToolViews::line).toList());
		if (delivery) {
			data.put("address", session.fullAddress());
			data.put("estimated_time", session.estimatedTime().filter(eta -> !eta.isBlank()).orElse(defaultDeliveryEta));
		}
		else {
			data.put("estimated_time", pickupEta);
		}
		data.put("contact", contactNumber);
		logger.info("Session {} confirmed order {} ({} items, total {})",
				session.id(), orderId, session.ledger().size(), data.get("total"));
		return ToolOutcome.of("Order " + orderId + " confirmed", data);
	}

	private Map<String, Object> totals(SessionRecord session) {
		BigDecimal subtotal = session.ledger().total();
		BigDecimal fee = session.mode() == FulfilmentMode.DELIVERY
				? session.deliveryFee().orElse(BigDecimal.ZERO)
				: BigDecimal.ZERO;
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("mode", session.mode().wireName());
		data.put("subtotal", subtotal);
		data.put("delivery_fee", fee);
		data.put("total", subtotal.add(fee));
		return data;
	}

	private String nextOrderId() {
		byte[] suffix = new byte[2];
		random.nextBytes(suffix);
		return "ORD-" + LocalDate.now(clock).format(ORDER_DATE) + "-"
				+ HexFormat.of().formatHex(suffix).toUpperCase(Locale.ROOT);
	}
}
