package org.javai.orderflow.inference;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;

/**
 * Retries a delegate client with exponential backoff.
 *
 * <p>{@link NonTransientAiException} is not retried. When all attempts fail the caller gets an
 * {@link ErrorKind#INFERENCE_UNAVAILABLE} error and the session is left untouched by this round.</p>
 */
public class RetryingInferenceClient implements InferenceClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingInferenceClient.class);

	private final InferenceClient delegate;
	private final int maxAttempts;
	private final ExponentialBackoff backoff;
	private final Sleeper sleeper;
	private final Consumer<AttemptRecord> attemptListener;

	/**
	 * Blocks the calling thread between attempts.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(Duration duration) throws InterruptedException;

		static Sleeper threadSleep() {
			return duration -> Thread.sleep(duration.toMillis());
		}
	}

	public RetryingInferenceClient(InferenceClient delegate, int maxAttempts, ExponentialBackoff backoff) {
		this(delegate, maxAttempts, backoff, Sleeper.threadSleep(), attempt -> { });
	}

	public RetryingInferenceClient(InferenceClient delegate, int maxAttempts, ExponentialBackoff backoff,
			Sleeper sleeper, Consumer<AttemptRecord> attemptListener) {
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
		this.maxAttempts = maxAttempts;
		this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.attemptListener = Objects.requireNonNull(attemptListener, "attemptListener must not be null");
	}

	@Override
	public InferenceResponse infer(InferenceRequest request) {
		RuntimeException lastFailure = null;
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			long started = System.nanoTime();
			try {
				InferenceResponse response = delegate.infer(request);
				attemptListener.accept(new AttemptRecord(request.sessionId(), attempt, AttemptOutcome.SUCCESS,
						elapsedMillis(started), null));
				return response;
			}
			catch (NonTransientAiException e) {
				attemptListener.accept(new AttemptRecord(request.sessionId(), attempt, AttemptOutcome.PERMANENT_FAILURE,
						elapsedMillis(started), e.getMessage()));
				logger.error("Session {} model call rejected, not retrying: {}", request.sessionId(), e.getMessage());
				throw unavailable(request, e);
			}
			catch (RuntimeException e) {
				lastFailure = e;
				attemptListener.accept(new AttemptRecord(request.sessionId(), attempt, AttemptOutcome.TRANSIENT_FAILURE,
						elapsedMillis(started), e.getMessage()));
				if (attempt < maxAttempts) {
					Duration delay = backoff.delayAfter(attempt);
					logger.warn("Session {} model call failed (attempt {}/{}), retrying in {} ms: {}",
							request.sessionId(), attempt, maxAttempts, delay.toMillis(), e.getMessage());
					pause(request, delay, e);
				}
			}
		}
		logger.error("Session {} model unavailable after {} attempts", request.sessionId(), maxAttempts, lastFailure);
		throw unavailable(request, lastFailure);
	}

	private void pause(InferenceRequest request, Duration delay, RuntimeException cause) {
		try {
			sleeper.sleep(delay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw unavailable(request, cause);
		}
	}

	private static OrderingException unavailable(InferenceRequest request, Throwable cause) {
		return new OrderingException(ErrorKind.INFERENCE_UNAVAILABLE,
				"Model unavailable for session " + request.sessionId() + " in stage " + request.stage().wireName(), cause);
	}

	private static long elapsedMillis(long startedNanos) {
		return Math.max(0, (System.nanoTime() - startedNanos) / 1_000_000);
	}
}
