package com.flamingo.ai.slidedeck.service.conversation;

import com.flamingo.ai.slidedeck.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.config.PresentationConfig.Template;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.exception.BackendUnavailableException;
import com.flamingo.ai.slidedeck.exception.InvalidStateException;
import com.flamingo.ai.slidedeck.exception.SessionBusyException;
import com.flamingo.ai.slidedeck.exception.SessionNotFoundException;
import com.flamingo.ai.slidedeck.service.draft.DraftOrchestrator;
import com.flamingo.ai.slidedeck.service.llm.ModelBackend;
import com.flamingo.ai.slidedeck.service.render.ArtifactStorage;
import com.flamingo.ai.slidedeck.service.render.RenderedArtifact;
import com.flamingo.ai.slidedeck.service.session.SessionLease;
import com.flamingo.ai.slidedeck.service.session.SessionStore;
import com.flamingo.ai.slidedeck.service.stream.FilteredChunk;
import com.flamingo.ai.slidedeck.service.stream.MarkerFilteringProcessor;
import com.flamingo.ai.slidedeck.service.template.TemplateCatalog;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/** Implementation of GuidedConversationService over the in-process session store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuidedConversationServiceImpl implements GuidedConversationService {

  private final SessionStore sessionStore;
  private final ConversationStateMachine stateMachine;
  private final MarkerFilteringProcessor markerFilteringProcessor;
  private final ModelBackend modelBackend;
  private final DraftOrchestrator draftOrchestrator;
  private final ArtifactStorage artifactStorage;
  private final TemplateCatalog templateCatalog;
  private final PresentationConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  public StartedConversation start(String templateKey) {
    Template template = templateCatalog.requireGuided(templateKey);
    String greeting = template.getGuidedMode().getGreeting().strip();

    UUID sessionId = sessionStore.create(templateKey);
    sessionStore.mutate(
        sessionId,
        session ->
            stateMachine.recordGreeting(
                session, ConversationTurn.assistant(greeting, clock.instant())));

    log.info("Started guided conversation {} with template '{}'", sessionId, templateKey);
    return new StartedConversation(sessionId, greeting);
  }

  @Override
  @Timed(value = "guided.message.stream", description = "Time to set up a guided exchange")
  public Flux<StreamChunkResponse> sendMessage(UUID sessionId, String message) {
    GuidedSession snapshot = sessionStore.get(sessionId);
    stateMachine.requireAcceptsMessages(snapshot);
    String systemPrompt = conversationSystemPrompt(snapshot.getTemplateKey());

    return Flux.using(
            () -> sessionStore.lease(sessionId),
            lease -> exchange(lease, message, systemPrompt),
            SessionLease::close)
        .onErrorResume(error -> Flux.just(errorEvent(sessionId, error)));
  }

  private Flux<StreamChunkResponse> exchange(
      SessionLease lease, String message, String systemPrompt) {
    GuidedSession session = lease.session();
    // Another exchange may have moved the state while this one waited for the lease.
    stateMachine.requireAcceptsMessages(session);

    ConversationTurn userTurn = ConversationTurn.user(message, clock.instant());
    List<ConversationTurn> turns = new ArrayList<>(session.getHistory());
    turns.add(userTurn);

    AtomicBoolean settled = new AtomicBoolean(false);
    log.debug("Streaming answer for session {} ({} turns)", session.getId(), turns.size());

    return markerFilteringProcessor
        .filter(modelBackend.streamComplete(turns, systemPrompt))
        .timeout(config.getConversation().getStreamTimeout())
        .<StreamChunkResponse>handle(
            (chunk, sink) -> {
              if (!chunk.terminal()) {
                sink.next(StreamChunkResponse.token(chunk.fragment()));
              } else if (settled.compareAndSet(false, true)) {
                GuidedSession updated = commitExchange(lease, userTurn, chunk);
                sink.next(
                    StreamChunkResponse.done(
                        chunk.fragment(), updated.getState().isDraftUnlocked()));
              }
            })
        .doOnCancel(
            () -> {
              if (settled.compareAndSet(false, true)) {
                try {
                  lease.update(current -> stateMachine.recordUserTurn(current, userTurn));
                  log.info(
                      "Exchange on session {} cancelled, kept user turn only", session.getId());
                } catch (SessionNotFoundException e) {
                  log.debug(
                      "Session {} removed before cancelled exchange was recorded",
                      e.getSessionId());
                }
              }
            });
  }

  private GuidedSession commitExchange(
      SessionLease lease, ConversationTurn userTurn, FilteredChunk terminal) {
    ConversationTurn assistantTurn =
        ConversationTurn.assistant(terminal.fullText().strip(), clock.instant());
    GuidedSession before = lease.session();
    GuidedSession updated =
        lease.update(
            current ->
                stateMachine.recordExchange(
                    current, userTurn, assistantTurn, terminal.markerSeen()));

    meterRegistry.counter("guided.messages.exchanged").increment();
    if (terminal.markerSeen()) {
      meterRegistry.counter("guided.marker.detected").increment();
    }
    if (before.getState() != updated.getState()) {
      log.info(
          "Session {} moved from {} to {}", updated.getId(), before.getState(), updated.getState());
    }
    return updated;
  }

  private StreamChunkResponse errorEvent(UUID sessionId, Throwable error) {
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    String message;
    if (error instanceof BackendUnavailableException backend) {
      message = backend.getUserMessage();
      log.error("Model error [{}] on session {}: {}", errorId, sessionId, error.getMessage());
    } else if (error instanceof TimeoutException) {
      message = "The AI took too long to answer. Please try again.";
      log.error("Model stream timed out [{}] on session {}", errorId, sessionId);
    } else if (error instanceof SessionNotFoundException) {
      message = "Session not found or expired";
      log.warn("Session {} vanished during exchange [{}]", sessionId, errorId);
    } else if (error instanceof SessionBusyException) {
      message = "The session is busy with another request. Please try again.";
      log.warn("Session {} busy [{}]", sessionId, errorId);
    } else if (error instanceof InvalidStateException) {
      message = "Messages are no longer accepted in this conversation";
      log.warn("Rejected message [{}]: {}", errorId, error.getMessage());
    } else {
      message = "An unexpected error occurred. Please try again later.";
      log.error(
          "Exchange failed [{}] on session {}: {}", errorId, sessionId, error.getMessage(), error);
    }
    meterRegistry.counter("guided.messages.failed").increment();
    return StreamChunkResponse.error(errorId, message);
  }

  @Override
  @Timed(value = "guided.draft.create", description = "Time to create a draft")
  public PresentationOutline createDraft(UUID sessionId) {
    stateMachine.requireDraftAllowed(sessionStore.get(sessionId));

    try (SessionLease lease = sessionStore.lease(sessionId)) {
      GuidedSession session = lease.session();
      stateMachine.requireDraftAllowed(session);

      PresentationOutline outline =
          draftOrchestrator.buildDraft(session.getHistory(), session.getTemplateKey());
      lease.update(current -> stateMachine.attachDraft(current, outline));

      meterRegistry.counter("guided.draft.created").increment();
      log.info("Stored draft with {} slides on session {}", outline.slides().size(), sessionId);
      return outline;
    }
  }

  @Override
  @Timed(value = "guided.generate", description = "Time to generate a presentation")
  public GeneratedArtifact generate(UUID sessionId) {
    stateMachine.requireGeneratable(sessionStore.get(sessionId));

    try (SessionLease lease = sessionStore.lease(sessionId)) {
      GuidedSession session = lease.session();
      stateMachine.requireGeneratable(session);

      PresentationOutline outline = session.getDraft();
      RenderedArtifact artifact = draftOrchestrator.buildArtifact(outline);
      lease.update(current -> stateMachine.complete(current, artifact.artifactId()));

      meterRegistry.counter("guided.artifact.generated").increment();
      log.info("Session {} completed with file {}", sessionId, artifact.artifactId());
      return new GeneratedArtifact(
          artifact.artifactId(), artifactStorage.downloadUrl(artifact.artifactId()), outline);
    }
  }

  @Override
  public GuidedSession getSession(UUID sessionId) {
    return sessionStore.get(sessionId);
  }

  @Override
  public void deleteSession(UUID sessionId) {
    sessionStore.delete(sessionId);
  }

  String conversationSystemPrompt(String templateKey) {
    Template template = templateCatalog.requireGuided(templateKey);
    Template.GuidedMode guided = template.getGuidedMode();

    StringBuilder prompt = new StringBuilder();
    if (!guided.getConversationSystemPrompt().isBlank()) {
      prompt.append(guided.getConversationSystemPrompt().strip()).append("\n\n");
    }
    if (!guided.getRequiredInfo().isEmpty()) {
      prompt.append("Information to gather:\n");
      guided.getRequiredInfo().forEach(item -> prompt.append("- ").append(item).append('\n'));
      prompt.append('\n');
    }
    prompt
        .append("Acknowledge what you understand, identify missing information and make helpful ")
        .append("suggestions. Keep responses concise (at most 2-3 paragraphs).\n\n")
        .append("When you have gathered all necessary information, end your response with ")
        .append("exactly this phrase on its own line:\n")
        .append(markerFilteringProcessor.getMarker());
    return prompt.toString();
  }
}
