package org.javai.orderflow.coverage;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A delivery district with its fee and quoted delivery time.
 *
 * @param district canonical district name as listed in coverage data
 * @param deliveryFee fee added to the order total for delivery
 * @param estimatedTime human-readable ETA, e.g. "30-45 دقيقة"
 */
public record CoverageZone(String district, BigDecimal deliveryFee, String estimatedTime) {

	public CoverageZone {
		Objects.requireNonNull(district, "district must not be null");
		Objects.requireNonNull(deliveryFee, "deliveryFee must not be null");
		estimatedTime = estimatedTime != null ? estimatedTime : "";
	}
}
