package org.javai.orderflow.session;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.javai.orderflow.catalog.CatalogIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-resident session store with one {@link ReentrantLock} per session.
 *
 * <p>Eviction takes each candidate's lock with {@code tryLock}; a session whose turn is in
 * progress is skipped and reconsidered on the next sweep. A caller that looked a session up
 * just before it was evicted notices the replaced entry after locking and retries against a
 * fresh session.</p>
 */
public class InMemorySessionStore implements SessionStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySessionStore.class);
	private static final SecureRandom RANDOM = new SecureRandom();

	private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
	private final CatalogIndex catalog;
	private final Clock clock;
	private final Duration timeout;
	private final int bufferCapacity;

	private record Entry(SessionRecord session, ReentrantLock lock) {
	}

	public InMemorySessionStore(CatalogIndex catalog, Clock clock, Duration timeout, int bufferCapacity) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.bufferCapacity = bufferCapacity;
	}

	@Override
	public Optional<SessionRecord> get(String sessionId) {
		Entry entry = sessionId == null ? null : sessions.get(sessionId);
		if (entry == null) {
			return Optional.empty();
		}
		entry.session().touch(clock.instant());
		return Optional.of(entry.session());
	}

	@Override
	public SessionRecord create() {
		String id;
		Entry entry;
		do {
			id = "sess_" + randomHex();
			entry = newEntry(id);
		}
		while (sessions.putIfAbsent(id, entry) != null);
		logger.debug("Created session {}", id);
		return entry.session();
	}

	@Override
	public SessionRecord create(String sessionId) {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Entry entry = newEntry(sessionId);
		if (sessions.putIfAbsent(sessionId, entry) != null) {
			throw new IllegalStateException("Session " + sessionId + " already exists");
		}
		logger.debug("Created session {}", sessionId);
		return entry.session();
	}

	@Override
	public void setActive(String sessionId, Stage stage) {
		Entry entry = sessions.get(sessionId);
		if (entry == null) {
			throw new IllegalArgumentException("Unknown session " + sessionId);
		}
		entry.session().setActiveStage(stage);
	}

	@Override
	public List<SessionRecord> evictExpired(Instant now) {
		List<SessionRecord> evicted = new ArrayList<>();
		for (Map.Entry<String, Entry> candidate : sessions.entrySet()) {
			Entry entry = candidate.getValue();
			if (!isExpired(entry.session(), now)) {
				continue;
			}
			if (!entry.lock().tryLock()) {
				logger.debug("Session {} is busy, skipping eviction", candidate.getKey());
				continue;
			}
			try {
				// re-check under the lock: a turn may have finished just before we got it
				if (isExpired(entry.session(), now) && sessions.remove(candidate.getKey(), entry)) {
					entry.session().markTimedOut();
					evicted.add(entry.session());
				}
			}
			finally {
				entry.lock().unlock();
			}
		}
		if (!evicted.isEmpty()) {
			logger.info("Evicted {} idle session(s)", evicted.size());
		}
		return List.copyOf(evicted);
	}

	@Override
	public <T> T withSession(String sessionId, Function<SessionRecord, T> work) {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(work, "work must not be null");
		while (true) {
			Entry entry = sessions.computeIfAbsent(sessionId, this::newEntry);
			entry.lock().lock();
			try {
				if (sessions.get(sessionId) != entry) {
					continue;
				}
				entry.session().touch(clock.instant());
				return work.apply(entry.session());
			}
			finally {
				entry.lock().unlock();
			}
		}
	}

	public int size() {
		return sessions.size();
	}

	private boolean isExpired(SessionRecord session, Instant now) {
		return session.lastActivity().plus(timeout).isBefore(now);
	}

	private Entry newEntry(String sessionId) {
		return new Entry(new SessionRecord(sessionId, clock.instant(), catalog, bufferCapacity), new ReentrantLock());
	}

	private static String randomHex() {
		byte[] bytes = new byte[4];
		RANDOM.nextBytes(bytes);
		return HexFormat.of().formatHex(bytes);
	}
}
