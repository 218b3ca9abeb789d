package com.flamingo.ai.slidedeck.service.conversation;

import com.flamingo.ai.slidedeck.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Service driving guided conversations from first message to rendered presentation. */
public interface GuidedConversationService {

  /**
   * Starts a guided conversation.
   *
   * @param templateKey template to follow
   * @return the new session id and the greeting
   * @throws com.flamingo.ai.slidedeck.exception.TemplateNotFoundException if the template is
   *     unknown
   * @throws com.flamingo.ai.slidedeck.exception.GuidedModeNotSupportedException if the template has
   *     no guided mode
   */
  StartedConversation start(String templateKey);

  /**
   * Sends a user message and streams the assistant's answer.
   *
   * <p>Unknown sessions and states that do not accept messages fail immediately. Once streaming
   * has started, failures are reported as a final {@code error} event and the session is left
   * unchanged.
   *
   * @param sessionId the session ID
   * @param message the user's message
   * @return token events followed by exactly one terminal event
   */
  Flux<StreamChunkResponse> sendMessage(UUID sessionId, String message);

  /**
   * Creates or replaces the draft outline for a session.
   *
   * @param sessionId the session ID
   * @return the stored outline
   * @throws com.flamingo.ai.slidedeck.exception.DraftNotReadyException if still collecting
   */
  PresentationOutline createDraft(UUID sessionId);

  /**
   * Renders the current draft and completes the session.
   *
   * @param sessionId the session ID
   * @return the rendered artifact
   * @throws com.flamingo.ai.slidedeck.exception.NoDraftException if there is no pending draft
   */
  GeneratedArtifact generate(UUID sessionId);

  /**
   * Gets a session snapshot.
   *
   * @param sessionId the session ID
   * @return the session
   */
  GuidedSession getSession(UUID sessionId);

  /**
   * Deletes a session. Unknown ids are ignored.
   *
   * @param sessionId the session ID
   */
  void deleteSession(UUID sessionId);
}
