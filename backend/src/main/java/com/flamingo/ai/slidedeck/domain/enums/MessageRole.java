package com.flamingo.ai.slidedeck.domain.enums;

/** Defines the role of a conversation turn's author. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Message from the AI assistant. */
  ASSISTANT
}
