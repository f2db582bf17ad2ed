package org.javai.orderflow.inference;

/**
 * Outcome of a single model call.
 */
public enum AttemptOutcome {
	SUCCESS,

	/**
	 * Failure worth retrying: timeouts, rate limits, server errors.
	 */
	TRANSIENT_FAILURE,

	/**
	 * Failure that will not go away on retry, such as a rejected request or bad credentials.
	 */
	PERMANENT_FAILURE
}
