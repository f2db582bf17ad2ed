package org.javai.orderflow.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.javai.orderflow.events.EventSink;
import org.javai.orderflow.events.OrderingEvent;
import org.javai.orderflow.session.SessionRecord;
import org.javai.orderflow.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically evicts idle sessions from a {@link SessionStore}. Sessions in the middle of a
 * turn are skipped by the store and picked up on a later sweep.
 */
public class SessionSweeper implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SessionSweeper.class);

	private final SessionStore store;
	private final EventSink eventSink;
	private final Clock clock;
	private final Duration interval;
	private final ScheduledExecutorService scheduler;

	public SessionSweeper(SessionStore store, EventSink eventSink, Clock clock, Duration interval) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.interval = Objects.requireNonNull(interval, "interval must not be null");
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "orderflow-session-sweeper");
			thread.setDaemon(true);
			return thread;
		});
	}

	public void start() {
		long millis = interval.toMillis();
		scheduler.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
		logger.info("Session sweeper started, interval {}", interval);
	}

	/**
	 * Evicts expired sessions now and emits a {@code SESSION_CLOSED} event for each.
	 *
	 * @return number of sessions evicted
	 */
	public int sweep() {
		List<SessionRecord> evicted = store.evictExpired(clock.instant());
		for (SessionRecord session : evicted) {
			Map<String, Object> payload = new LinkedHashMap<>();
			payload.put("status", session.status().name().toLowerCase(Locale.ROOT));
			payload.put("reason", "inactivity_timeout");
			payload.put("last_activity", session.lastActivity().toString());
			eventSink.emit(new OrderingEvent(clock.instant(), session.id(), OrderingEvent.EventType.SESSION_CLOSED, payload));
		}
		return evicted.size();
	}

	private void sweepQuietly() {
		try {
			sweep();
		}
		catch (RuntimeException e) {
			// an exception would cancel the schedule; log and wait for the next run
			logger.error("Session sweep failed", e);
		}
	}

	@Override
	public void close() {
		scheduler.shutdownNow();
	}
}
