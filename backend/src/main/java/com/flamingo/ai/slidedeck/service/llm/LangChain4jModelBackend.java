package com.flamingo.ai.slidedeck.service.llm;

import com.flamingo.ai.slidedeck.domain.enums.MessageRole;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.exception.BackendUnavailableException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/** {@link ModelBackend} over LangChain4j chat models. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jModelBackend implements ModelBackend {

  private final StreamingChatModel streamingChatModel;
  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  @Override
  public Flux<String> streamComplete(List<ConversationTurn> turns, String systemPrompt) {
    return Flux.create(
        sink -> {
          AtomicBoolean cancelled = new AtomicBoolean(false);
          // The handler API offers no way to abort the HTTP call, so a cancelled call runs to
          // completion and everything it delivers afterwards is dropped here.
          sink.onCancel(
              () -> {
                cancelled.set(true);
                log.debug("Model stream cancelled by subscriber");
              });

          List<ChatMessage> messages = toMessages(turns, systemPrompt);
          log.debug("Streaming model call with {} messages", messages.size());

          streamingChatModel.chat(
              messages,
              new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                  if (!cancelled.get() && partialResponse != null) {
                    sink.next(partialResponse);
                  }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                  if (cancelled.get()) {
                    log.debug("Model stream finished after cancel, answer discarded");
                    return;
                  }
                  log.debug("Model stream completed");
                  sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                  if (cancelled.get()) {
                    log.debug("Model stream failed after cancel: {}", error.getMessage());
                    return;
                  }
                  meterRegistry.counter("llm.errors", "mode", "stream").increment();
                  log.error("Error during model streaming: {}", error.getMessage(), error);
                  sink.error(
                      new BackendUnavailableException(
                          "Model stream failed: " + error.getMessage(),
                          error,
                          isRateLimited(error)));
                }
              });
        });
  }

  @Override
  @Timed(value = "llm.complete", description = "Time for a blocking model call")
  @CircuitBreaker(name = "llm", fallbackMethod = "completeFallback")
  @Retry(name = "llm")
  public String complete(List<ConversationTurn> turns, String systemPrompt) {
    List<ChatMessage> messages = toMessages(turns, systemPrompt);
    log.debug("Blocking model call with {} messages", messages.size());

    return textOf(chatModel.chat(messages));
  }

  @Override
  @Timed(value = "llm.complete", description = "Time for a blocking model call")
  @CircuitBreaker(name = "llm", fallbackMethod = "completeFallback")
  @Retry(name = "llm")
  public String complete(List<ConversationTurn> turns, String systemPrompt, double temperature) {
    List<ChatMessage> messages = toMessages(turns, systemPrompt);
    log.debug(
        "Blocking model call with {} messages at temperature {}", messages.size(), temperature);

    ChatRequest request = ChatRequest.builder().messages(messages).temperature(temperature).build();
    return textOf(chatModel.chat(request));
  }

  @SuppressWarnings("unused")
  private String completeFallback(List<ConversationTurn> turns, String systemPrompt, Throwable t) {
    return failAfterRetries(t);
  }

  @SuppressWarnings("unused")
  private String completeFallback(
      List<ConversationTurn> turns, String systemPrompt, double temperature, Throwable t) {
    return failAfterRetries(t);
  }

  private String failAfterRetries(Throwable t) {
    meterRegistry.counter("llm.errors", "mode", "complete").increment();
    log.error("Model call failed after retries: {}", t.getMessage());
    throw new BackendUnavailableException(
        "Model call failed: " + t.getMessage(), t, isRateLimited(t));
  }

  private static String textOf(ChatResponse response) {
    if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
      throw new IllegalStateException("Model returned an empty response");
    }
    return response.aiMessage().text();
  }

  static List<ChatMessage> toMessages(List<ConversationTurn> turns, String systemPrompt) {
    List<ChatMessage> messages = new ArrayList<>(turns.size() + 1);
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.add(SystemMessage.from(systemPrompt));
    }
    for (ConversationTurn turn : turns) {
      if (turn.role() == MessageRole.USER) {
        messages.add(UserMessage.from(turn.text()));
      } else if (turn.role() == MessageRole.ASSISTANT) {
        messages.add(AiMessage.from(turn.text()));
      }
    }
    return messages;
  }

  private static boolean isRateLimited(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t.getClass().getSimpleName().contains("RateLimit")) {
        return true;
      }
      String message = t.getMessage();
      if (message != null && message.contains("429")) {
        return true;
      }
    }
    return false;
  }
}
