package com.flamingo.ai.slidedeck.service.conversation;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.exception.DraftNotReadyException;
import com.flamingo.ai.slidedeck.exception.InvalidStateException;
import com.flamingo.ai.slidedeck.exception.NoDraftException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Transition rules of a guided conversation.
 *
 * <p>Stateless: checks throw without touching anything, transitions return a new snapshot.
 * Persisting the result is up to the caller.
 */
@Component
@RequiredArgsConstructor
public class ConversationStateMachine {

  private final PresentationConfig config;

  public void requireAcceptsMessages(GuidedSession session) {
    SessionState state = session.getState();
    boolean accepts =
        switch (state) {
          case COLLECTING, READY_FOR_DRAFT -> true;
          case DRAFT_CREATED -> config.getConversation().isAllowMessagesAfterDraft();
          case COMPLETED -> false;
        };
    if (!accepts) {
      throw new InvalidStateException(
          session.getId(), "send a message to", state, messageStates());
    }
  }

  /**
   * Appends a completed exchange. {@code COLLECTING} moves to {@code READY_FOR_DRAFT} when the
   * marker was seen; no other state changes.
   */
  public GuidedSession recordExchange(
      GuidedSession session,
      ConversationTurn userTurn,
      ConversationTurn assistantTurn,
      boolean markerSeen) {
    SessionState next =
        markerSeen && session.getState() == SessionState.COLLECTING
            ? SessionState.READY_FOR_DRAFT
            : session.getState();
    return session.toBuilder()
        .history(append(session.getHistory(), userTurn, assistantTurn))
        .state(next)
        .build();
  }

  /** Appends a user turn whose answer never completed. */
  public GuidedSession recordUserTurn(GuidedSession session, ConversationTurn userTurn) {
    return session.toBuilder().history(append(session.getHistory(), userTurn)).build();
  }

  /** Appends the template greeting to a fresh session. */
  public GuidedSession recordGreeting(GuidedSession session, ConversationTurn greeting) {
    return session.toBuilder().history(append(session.getHistory(), greeting)).build();
  }

  public void requireDraftAllowed(GuidedSession session) {
    SessionState state = session.getState();
    if (state == SessionState.COLLECTING) {
      throw new DraftNotReadyException(session.getId(), state);
    }
    if (state == SessionState.COMPLETED) {
      throw new InvalidStateException(
          session.getId(),
          "create a draft for",
          state,
          EnumSet.of(SessionState.READY_FOR_DRAFT, SessionState.DRAFT_CREATED));
    }
  }

  /** Stores the outline; a newer draft replaces an older one. */
  public GuidedSession attachDraft(GuidedSession session, PresentationOutline outline) {
    requireDraftAllowed(session);
    Objects.requireNonNull(outline, "outline");
    return session.toBuilder().draft(outline).state(SessionState.DRAFT_CREATED).build();
  }

  public void requireGeneratable(GuidedSession session) {
    if (session.getState() != SessionState.DRAFT_CREATED || !session.hasDraft()) {
      throw new NoDraftException(session.getId(), session.getState());
    }
  }

  public GuidedSession complete(GuidedSession session, String artifactId) {
    requireGeneratable(session);
    return session.toBuilder().state(SessionState.COMPLETED).artifactId(artifactId).build();
  }

  private Set<SessionState> messageStates() {
    return config.getConversation().isAllowMessagesAfterDraft()
        ? EnumSet.of(
            SessionState.COLLECTING, SessionState.READY_FOR_DRAFT, SessionState.DRAFT_CREATED)
        : EnumSet.of(SessionState.COLLECTING, SessionState.READY_FOR_DRAFT);
  }

  private List<ConversationTurn> append(List<ConversationTurn> history, ConversationTurn... turns) {
    List<ConversationTurn> next = new ArrayList<>(history.size() + turns.length);
    next.addAll(history);
    next.addAll(List.of(turns));
    int max = config.getSession().getMaxHistoryTurns();
    if (max > 0 && next.size() > max) {
      return List.copyOf(next.subList(next.size() - max, next.size()));
    }
    return List.copyOf(next);
  }
}
