package com.flamingo.ai.slidedeck.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for the guided conversation SSE streams. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final PresentationConfig presentationConfig;

  /**
   * Runs SSE responses on a bounded pool. The async timeout comes from {@code
   * presentation.conversation.sse-timeout}; an exchange that stalls is ended earlier by the stream
   * timeout, which still reaches the client as an error event.
   */
  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(sseTaskExecutor());
    configurer.setDefaultTimeout(presentationConfig.getConversation().getSseTimeout().toMillis());
  }

  /**
   * Executor for writing conversation streams.
   *
   * <ul>
   *   <li>Core pool size: 5 - typical concurrent conversations
   *   <li>Max pool size: 20 - burst traffic
   *   <li>Queue capacity: 50
   * </ul>
   *
   * @return configured thread pool task executor
   */
  @Bean(name = "sseTaskExecutor")
  public AsyncTaskExecutor sseTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(20);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("guided-sse-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
