package com.flamingo.ai.slidedeck.domain.model;

import com.flamingo.ai.slidedeck.domain.enums.MessageRole;
import java.time.Instant;

/** One turn of a guided conversation, replayed verbatim to the model backend. */
public record ConversationTurn(MessageRole role, String text, Instant timestamp) {

  public static ConversationTurn user(String text, Instant timestamp) {
    return new ConversationTurn(MessageRole.USER, text, timestamp);
  }

  public static ConversationTurn assistant(String text, Instant timestamp) {
    return new ConversationTurn(MessageRole.ASSISTANT, text, timestamp);
  }
}
