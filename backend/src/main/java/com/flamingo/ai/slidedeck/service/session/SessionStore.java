package com.flamingo.ai.slidedeck.service.session;

import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Authoritative map from session id to {@link GuidedSession}, with idle expiry.
 *
 * <p>All writes to a given session are serialized; writes to different sessions never wait on each
 * other. Readers always receive immutable snapshots.
 */
public interface SessionStore {

  /**
   * Creates a new session in the collecting state with an empty history.
   *
   * @param templateKey the template the conversation follows
   * @return the new session's id
   */
  UUID create(String templateKey);

  /**
   * Gets the current snapshot of a session. A read counts as activity and refreshes the session's
   * idle clock.
   *
   * @param sessionId the session ID
   * @return the session snapshot
   * @throws com.flamingo.ai.slidedeck.exception.SessionNotFoundException if absent or expired
   */
  GuidedSession get(UUID sessionId);

  /**
   * Applies an atomic read-modify-write to a session. If {@code fn} throws, the session is left
   * unchanged and the exception propagates.
   *
   * @param sessionId the session ID
   * @param fn produces the next snapshot from the current one
   * @return the stored snapshot
   * @throws com.flamingo.ai.slidedeck.exception.SessionNotFoundException if absent or expired
   */
  GuidedSession mutate(UUID sessionId, UnaryOperator<GuidedSession> fn);

  /**
   * Acquires exclusive access to a session for an operation spanning an external call. The lease
   * must be closed; until then every other write to the same session waits.
   *
   * @param sessionId the session ID
   * @return an open lease
   * @throws com.flamingo.ai.slidedeck.exception.SessionNotFoundException if absent or expired
   * @throws com.flamingo.ai.slidedeck.exception.SessionBusyException if access is not obtained in
   *     time
   */
  SessionLease lease(UUID sessionId);

  /**
   * Removes a session. Deleting an unknown session is a no-op.
   *
   * @param sessionId the session ID
   */
  void delete(UUID sessionId);

  /**
   * Removes every session idle for longer than the configured timeout. Sessions held by a lease
   * are in use and are skipped.
   *
   * @param now the reference time
   * @return number of sessions removed
   */
  int sweep(Instant now);

  /** Number of sessions currently held, expired or not. */
  int activeCount();
}
