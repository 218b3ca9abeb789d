package com.flamingo.ai.slidedeck.exception;

import java.util.UUID;

/** Exception thrown when a session is unknown, deleted, or expired. */
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SessionNotFoundException(UUID sessionId) {
    super("Session not found or expired: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
