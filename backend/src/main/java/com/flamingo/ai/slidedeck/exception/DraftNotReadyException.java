package com.flamingo.ai.slidedeck.exception;

import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import java.util.EnumSet;
import java.util.UUID;

/** Exception thrown when a draft is requested before the assistant signalled readiness. */
public class DraftNotReadyException extends InvalidStateException {

  public DraftNotReadyException(UUID sessionId, SessionState currentState) {
    super(
        sessionId,
        "create a draft for",
        currentState,
        EnumSet.of(SessionState.READY_FOR_DRAFT, SessionState.DRAFT_CREATED));
  }
}
