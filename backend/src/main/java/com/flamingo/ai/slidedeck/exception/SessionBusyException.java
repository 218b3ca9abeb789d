package com.flamingo.ai.slidedeck.exception;

import java.util.UUID;

/** Exception thrown when exclusive access to a session could not be obtained in time. */
public class SessionBusyException extends RuntimeException {

  private final UUID sessionId;

  public SessionBusyException(UUID sessionId) {
    super("Session is busy with another operation: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
