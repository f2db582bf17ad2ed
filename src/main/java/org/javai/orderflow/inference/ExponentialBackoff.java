package org.javai.orderflow.inference;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before retry {@code n} is {@code min(base * 2^(n-1), max)}.
 */
public final class ExponentialBackoff {

	private final Duration base;
	private final Duration max;

	public ExponentialBackoff(Duration base, Duration max) {
		Objects.requireNonNull(base, "base must not be null");
		Objects.requireNonNull(max, "max must not be null");
		if (base.isNegative() || base.isZero()) {
			throw new IllegalArgumentException("base must be positive");
		}
		if (max.compareTo(base) < 0) {
			throw new IllegalArgumentException("max must be >= base");
		}
		this.base = base;
		this.max = max;
	}

	/**
	 * @param failureCount failures so far, at least 1
	 */
	public Duration delayAfter(int failureCount) {
		if (failureCount < 1) {
			throw new IllegalArgumentException("failureCount must be >= 1");
		}
		// shift capped so the multiplication cannot overflow
		int shift = Math.min(failureCount - 1, 30);
		long millis = base.toMillis() * (1L << shift);
		return millis >= max.toMillis() || millis < 0 ? max : Duration.ofMillis(millis);
	}

	public Duration base() {
		return base;
	}

	public Duration max() {
		return max;
	}
}
