package com.flamingo.ai.slidedeck.domain.model;

import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one guided conversation.
 *
 * <p>Snapshots are handed out by the session store; every change produces a new snapshot through
 * {@link #toBuilder()} and is written back by the store under the session's exclusive access.
 */
@Value
@Builder(toBuilder = true)
public class GuidedSession {

  UUID id;

  String templateKey;

  @Builder.Default List<ConversationTurn> history = List.of();

  @Builder.Default SessionState state = SessionState.COLLECTING;

  /** Present only in {@link SessionState#DRAFT_CREATED} and {@link SessionState#COMPLETED}. */
  PresentationOutline draft;

  /** Identifier of the rendered deck, set once the session is completed. */
  String artifactId;

  Instant createdAt;

  Instant lastActivity;

  /** Creates a fresh session in {@link SessionState#COLLECTING} with an empty history. */
  public static GuidedSession start(UUID id, String templateKey, Instant now) {
    return GuidedSession.builder()
        .id(id)
        .templateKey(templateKey)
        .createdAt(now)
        .lastActivity(now)
        .build();
  }

  public int getMessageCount() {
    return history.size();
  }

  public boolean hasDraft() {
    return draft != null;
  }

  /** Whether the session has been idle for longer than {@code idleTimeout} at {@code now}. */
  public boolean isExpired(Instant now, Duration idleTimeout) {
    return Duration.between(lastActivity, now).compareTo(idleTimeout) > 0;
  }
}
