package com.flamingo.ai.slidedeck.exception;

import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import java.util.EnumSet;
import java.util.UUID;

/** Exception thrown when final generation is requested without a pending draft. */
public class NoDraftException extends InvalidStateException {

  public NoDraftException(UUID sessionId, SessionState currentState) {
    super(sessionId, "generate", currentState, EnumSet.of(SessionState.DRAFT_CREATED));
  }
}
