package org.javai.orderflow.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.testsupport.LogCaptorAppender;
import org.javai.orderflow.testsupport.ScriptedInferenceClient;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

class RetryingInferenceClientTest {

	private static final InferenceRequest REQUEST = new InferenceRequest("s1", Stage.ORDERING, "instructions",
			List.of(ConversationMessage.user("أبي برجر")), List.of(), List.of());

	private final ScriptedInferenceClient model = new ScriptedInferenceClient();
	private final List<Duration> sleeps = new ArrayList<>();
	private final List<AttemptRecord> attempts = new ArrayList<>();
	private final RetryingInferenceClient client = new RetryingInferenceClient(model, 3,
			new ExponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(8)), sleeps::add, attempts::add);

	@Test
	void firstSuccessIsReturnedWithoutSleeping() {
		model.reply("أهلاً");

		assertThat(client.infer(REQUEST).text()).isEqualTo("أهلاً");
		assertThat(sleeps).isEmpty();
		assertThat(attempts).singleElement().satisfies(attempt -> assertThat(attempt.isSuccess()).isTrue());
	}

	@Test
	void transientFailuresAreRetriedWithBackoff() {
		model.fail(new TransientAiException("503"))
				.fail(new IllegalStateException("connection reset"))
				.reply("تم");

		assertThat(client.infer(REQUEST).text()).isEqualTo("تم");
		assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofSeconds(1));
		assertThat(attempts).extracting(AttemptRecord::outcome).containsExactly(
				AttemptOutcome.TRANSIENT_FAILURE, AttemptOutcome.TRANSIENT_FAILURE, AttemptOutcome.SUCCESS);
	}

	@Test
	void exhaustedAttemptsReportInferenceUnavailable() {
		model.fail(new TransientAiException("503"))
				.fail(new TransientAiException("503"))
				.fail(new TransientAiException("503"));

		try (LogCaptorAppender appender = LogCaptorAppender.create(RetryingInferenceClient.class, Level.WARN)) {
			assertThatThrownBy(() -> client.infer(REQUEST))
					.isInstanceOfSatisfying(OrderingException.class, e -> {
						assertThat(e.kind()).isEqualTo(ErrorKind.INFERENCE_UNAVAILABLE);
						assertThat(e.getCause()).isInstanceOf(TransientAiException.class);
					});
			assertThat(appender.messagesAt(Level.WARN)).hasSize(2);
			assertThat(appender.messagesAt(Level.ERROR)).singleElement()
					.satisfies(message -> assertThat(message).contains("after 3 attempts"));
		}
		assertThat(sleeps).hasSize(2);
	}

	@Test
	void nonTransientFailureIsNotRetried() {
		model.fail(new NonTransientAiException("401 unauthorized"));

		assertThatThrownBy(() -> client.infer(REQUEST))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.INFERENCE_UNAVAILABLE));
		assertThat(model.requests()).hasSize(1);
		assertThat(attempts).extracting(AttemptRecord::outcome).containsExactly(AttemptOutcome.PERMANENT_FAILURE);
		assertThat(sleeps).isEmpty();
	}

	@Test
	void interruptedBackoffGivesUp() {
		model.fail(new TransientAiException("503")).reply("unused");
		RetryingInferenceClient interrupted = new RetryingInferenceClient(model, 3,
				new ExponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(8)),
				duration -> {
					throw new InterruptedException();
				},
				attempt -> {
				});

		try {
			assertThatThrownBy(() -> interrupted.infer(REQUEST)).isInstanceOf(OrderingException.class);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
		assertThat(model.remaining()).isEqualTo(1);
	}
}
