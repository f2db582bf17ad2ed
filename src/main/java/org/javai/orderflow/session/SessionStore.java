package org.javai.orderflow.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed store of session records, injected into the orchestrator.
 *
 * <p>Implementations guarantee mutual exclusion per session id: {@link #withSession} runs the
 * work while holding that session's lock, and {@link #evictExpired} never removes a session
 * whose lock is held. Different sessions never block each other.</p>
 */
public interface SessionStore {

	/**
	 * Looks up a session and refreshes its last-activity time.
	 */
	Optional<SessionRecord> get(String sessionId);

	/**
	 * Creates a session with a generated id.
	 */
	SessionRecord create();

	/**
	 * Creates a session with the given id.
	 *
	 * @throws IllegalStateException if the id is already in use
	 */
	SessionRecord create(String sessionId);

	/**
	 * Records the stage that owns the next turn of a session.
	 *
	 * @throws IllegalArgumentException if the session does not exist
	 */
	void setActive(String sessionId, Stage stage);

	/**
	 * Removes sessions idle longer than the timeout, skipping any whose turn is in progress.
	 * Evicted active sessions are marked {@link SessionStatus#TIMED_OUT}.
	 *
	 * @return the evicted sessions
	 */
	List<SessionRecord> evictExpired(Instant now);

	/**
	 * Runs work against a session while holding its lock, creating the session if unknown.
	 */
	<T> T withSession(String sessionId, Function<SessionRecord, T> work);
}
