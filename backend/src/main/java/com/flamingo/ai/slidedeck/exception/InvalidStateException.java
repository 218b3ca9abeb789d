package com.flamingo.ai.slidedeck.exception;

import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import java.util.Set;
import java.util.UUID;

/**
 * Exception thrown when an operation is attempted in a state that does not allow it. The session is
 * left unmodified.
 */
public class InvalidStateException extends RuntimeException {

  private final UUID sessionId;
  private final SessionState currentState;
  private final Set<SessionState> requiredStates;

  public InvalidStateException(
      UUID sessionId, String operation, SessionState currentState, Set<SessionState> required) {
    super(
        String.format(
            "Cannot %s session %s in state %s (requires one of %s)",
            operation, sessionId, currentState, required));
    this.sessionId = sessionId;
    this.currentState = currentState;
    this.requiredStates = Set.copyOf(required);
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public SessionState getCurrentState() {
    return currentState;
  }

  public Set<SessionState> getRequiredStates() {
    return requiredStates;
  }
}
