package org.javai.orderflow.inference;

/**
 * Record of a single model call, passed to attempt listeners.
 *
 * @param sessionId session the call was made for
 * @param attempt 1-based attempt number within the round
 * @param outcome result of the attempt
 * @param durationMillis time taken for this attempt in milliseconds
 * @param errorDetails error message if outcome is not SUCCESS, null otherwise
 */
public record AttemptRecord(
		String sessionId,
		int attempt,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails) {

	public AttemptRecord {
		if (attempt < 1) {
			throw new IllegalArgumentException("attempt must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
