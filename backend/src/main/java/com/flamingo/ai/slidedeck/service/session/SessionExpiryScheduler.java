package com.flamingo.ai.slidedeck.service.session;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes idle sessions from the {@link SessionStore}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionExpiryScheduler {

  private final SessionStore sessionStore;
  private final Clock clock;

  @Scheduled(
      fixedDelayString = "${presentation.session.sweep-interval:PT60S}",
      initialDelayString = "${presentation.session.sweep-interval:PT60S}")
  public void sweepExpiredSessions() {
    int removed = sessionStore.sweep(clock.instant());
    log.debug("Expiry sweep removed {} sessions, {} remain", removed, sessionStore.activeCount());
  }
}
