package com.flamingo.ai.slidedeck.domain.enums;

/**
 * Lifecycle of a guided conversation.
 *
 * <p>States only move forward. {@link #READY_FOR_DRAFT} keeps accepting messages like {@link
 * #COLLECTING}; it additionally unlocks draft creation.
 */
public enum SessionState {
  /** Initial state: the assistant is still gathering information. */
  COLLECTING,

  /** The assistant signalled it has enough information for a draft. */
  READY_FOR_DRAFT,

  /** A draft outline is stored on the session. */
  DRAFT_CREATED,

  /** The final presentation has been rendered. Terminal. */
  COMPLETED;

  /** Whether the draft operation has been unlocked in this state. */
  public boolean isDraftUnlocked() {
    return this != COLLECTING;
  }

  /** Whether a session in this state may carry a draft outline. */
  public boolean holdsDraft() {
    return this == DRAFT_CREATED || this == COMPLETED;
  }
}
