package com.flamingo.ai.slidedeck.api.sse;

import com.flamingo.ai.slidedeck.api.dto.request.ChatMessageRequest;
import com.flamingo.ai.slidedeck.api.dto.request.StartChatRequest;
import com.flamingo.ai.slidedeck.api.dto.response.DraftResponse;
import com.flamingo.ai.slidedeck.api.dto.response.GenerateResponse;
import com.flamingo.ai.slidedeck.api.dto.response.SessionInfoResponse;
import com.flamingo.ai.slidedeck.api.dto.response.StartChatResponse;
import com.flamingo.ai.slidedeck.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.service.conversation.GeneratedArtifact;
import com.flamingo.ai.slidedeck.service.conversation.GuidedConversationService;
import com.flamingo.ai.slidedeck.service.conversation.StartedConversation;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for guided conversations, with SSE streaming of assistant answers. */
@RestController
@RequestMapping("/api/v1/chat")
@Slf4j
public class GuidedChatController {

  private final GuidedConversationService conversationService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public GuidedChatController(
      GuidedConversationService conversationService, MeterRegistry meterRegistry) {
    this.conversationService = conversationService;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /** Starts a guided conversation for a template. */
  @PostMapping("/start")
  public ResponseEntity<StartChatResponse> start(@Valid @RequestBody StartChatRequest request) {
    StartedConversation started = conversationService.start(request.getTemplate());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            StartChatResponse.builder()
                .sessionId(started.sessionId())
                .message(started.greeting())
                .build());
  }

  /**
   * Streams the assistant's answer to a message using Server-Sent Events.
   *
   * @param sessionId the session ID
   * @param request the message
   * @return a Flux of SSE events ending with a single {@code done=true} event
   */
  @PostMapping(value = "/{sessionId}/message", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> sendMessage(
      @PathVariable UUID sessionId, @Valid @RequestBody ChatMessageRequest request) {

    Flux<StreamChunkResponse> stream =
        conversationService.sendMessage(sessionId, request.getMessage());

    log.info("Starting guided stream for session {}", sessionId);
    return stream
        .doOnSubscribe(s -> activeConnections.incrementAndGet())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Guided stream completed for session {}", sessionId);
            })
        .doOnNext(
            event -> {
              // Failures arrive as a terminal error event, never as an error signal.
              if (StreamChunkResponse.ERROR.equals(event.getEventType())) {
                log.warn(
                    "Guided stream for session {} ended with error {}",
                    sessionId,
                    event.getErrorId());
                meterRegistry.counter("sse.errors").increment();
              }
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Guided stream cancelled for session {}", sessionId);
            });
  }

  /** Creates (or replaces) the draft outline once the conversation is ready. */
  @PostMapping("/{sessionId}/draft")
  public ResponseEntity<DraftResponse> createDraft(@PathVariable UUID sessionId) {
    PresentationOutline draft = conversationService.createDraft(sessionId);
    return ResponseEntity.ok(DraftResponse.builder().sessionId(sessionId).draft(draft).build());
  }

  /** Renders the draft into a presentation file. */
  @PostMapping("/{sessionId}/generate")
  public ResponseEntity<GenerateResponse> generate(@PathVariable UUID sessionId) {
    GeneratedArtifact artifact = conversationService.generate(sessionId);
    return ResponseEntity.ok(GenerateResponse.from(artifact));
  }

  /** Gets session details. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionInfoResponse> getSession(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(
        SessionInfoResponse.fromSession(conversationService.getSession(sessionId)));
  }

  /** Deletes a session. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable UUID sessionId) {
    conversationService.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
