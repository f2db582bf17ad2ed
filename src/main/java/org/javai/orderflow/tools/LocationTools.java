package org.javai.orderflow.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.coverage.CoverageMap;
import org.javai.orderflow.coverage.CoverageZone;
import org.javai.orderflow.session.SessionRecord;

/**
 * Delivery coverage and address handlers.
 */
class LocationTools {

	static final int SUGGESTION_COUNT = 4;

	private final CoverageMap coverage;

	LocationTools(CoverageMap coverage) {
		this.coverage = Objects.requireNonNull(coverage, "coverage must not be null");
	}

	ToolOutcome checkDistrict(SessionRecord session, ToolArguments.CheckDistrict args) {
		String district = OrderTools.required(args.district(), "district");
		session.ensureActive();
		CoverageZone zone = coverage.match(district).orElseThrow(() -> new OrderingException(
				ErrorKind.DISTRICT_NOT_COVERED,
				"We do not deliver to '" + district + "'",
				Map.of("suggestions", coverage.suggestions(SUGGESTION_COUNT), "pickup_available", true)));
		session.confirmLocation(zone);
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("district", zone.district());
		data.put("delivery_fee", zone.deliveryFee());
		data.put("estimated_time", zone.estimatedTime());
		return ToolOutcome.of("Delivery available to " + zone.district(), data);
	}

	ToolOutcome setAddress(SessionRecord session, ToolArguments.DeliveryAddress args) {
		List<String> missing = session.updateAddress(args.street(), args.building(), args.notes());
		if (!missing.isEmpty()) {
			throw new OrderingException(ErrorKind.ADDRESS_INCOMPLETE,
					"Address still needs: " + String.join(", ", missing),
					Map.of("missing", missing));
		}
		return ToolOutcome.of("Address recorded", Map.of("full_address", session.fullAddress()));
	}
}
