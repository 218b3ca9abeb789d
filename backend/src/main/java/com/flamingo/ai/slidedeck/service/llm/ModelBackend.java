package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import java.util.List;
import reactor.core.publisher.Flux;

/** Port to the language model that drives the guided conversation and writes drafts. */
public interface ModelBackend {

  /**
   * Streams the model's answer to a conversation.
   *
   * <p>The returned flux is cold: the call starts on subscription and is abandoned on cancel.
   * Failures are signalled as {@link
   * com.flamingo.ai.slidedeck.exception.BackendUnavailableException}.
   *
   * @param turns conversation so far, oldest first, ending with the turn to answer
   * @param systemPrompt system instructions for this call
   * @return text fragments in generation order
   */
  Flux<String> streamComplete(List<ConversationTurn> turns, String systemPrompt);

  /**
   * Requests a complete answer in one blocking call.
   *
   * @param turns conversation so far, oldest first
   * @param systemPrompt system instructions for this call
   * @return the model's full answer
   * @throws com.flamingo.ai.slidedeck.exception.BackendUnavailableException if the model could not
   *     be reached
   */
  String complete(List<ConversationTurn> turns, String systemPrompt);

  /**
   * Like {@link #complete(List, String)}, with a sampling temperature for this call only.
   *
   * @param temperature sampling temperature overriding the model default
   */
  String complete(List<ConversationTurn> turns, String systemPrompt, double temperature);
}
