package com.flamingo.ai.slidedeck.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables {@code @Timed} on the model, draft and render calls.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Publishes how many templates are configured, split by guided mode. */
  @Bean
  public MeterBinder templateMetrics(PresentationConfig config) {
    return registry -> {
      Gauge.builder("presentation.templates", config, c -> countTemplates(c, true))
          .tag("guided", "true")
          .description("Configured templates with guided mode")
          .register(registry);
      Gauge.builder("presentation.templates", config, c -> countTemplates(c, false))
          .tag("guided", "false")
          .description("Configured templates without guided mode")
          .register(registry);
    };
  }

  private static double countTemplates(PresentationConfig config, boolean guided) {
    return config.getTemplates().values().stream()
        .filter(t -> t.getGuidedMode().isEnabled() == guided)
        .count();
  }
}
