package com.flamingo.ai.slidedeck.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The base URL may point at any OpenAI-compatible endpoint, for example a local Ollama server
 * at {@code http://localhost:11434/v1}.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.15}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:PT60S}")
  private Duration timeout;

  @Value("${langchain4j.openai.streaming-chat-model.timeout:PT120S}")
  private Duration streamingTimeout;

  /** Blocking model used for draft outlines; answers are forced into a JSON object. */
  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(timeout)
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public StreamingChatModel streamingChatModel() {
    validateApiKey();

    return OpenAiStreamingChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(streamingTimeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
