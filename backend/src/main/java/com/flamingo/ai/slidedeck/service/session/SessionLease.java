package com.flamingo.ai.slidedeck.service.session;

import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import java.util.function.UnaryOperator;

/** Exclusive, closeable access to one session. */
public interface SessionLease extends AutoCloseable {

  /**
   * Current snapshot of the leased session.
   *
   * @throws com.flamingo.ai.slidedeck.exception.SessionNotFoundException if the session was
   *     deleted meanwhile
   */
  GuidedSession session();

  /**
   * Replaces the leased session with {@code fn}'s result and refreshes its last activity.
   *
   * @throws com.flamingo.ai.slidedeck.exception.SessionNotFoundException if the session was
   *     deleted meanwhile
   */
  GuidedSession update(UnaryOperator<GuidedSession> fn);

  /** Releases the lease. Closing twice is a no-op. */
  @Override
  void close();
}
