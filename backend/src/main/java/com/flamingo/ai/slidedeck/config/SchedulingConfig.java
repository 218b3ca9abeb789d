package com.flamingo.ai.slidedeck.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Configuration for scheduled housekeeping such as the session expiry sweep. */
@Configuration
@EnableScheduling
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
