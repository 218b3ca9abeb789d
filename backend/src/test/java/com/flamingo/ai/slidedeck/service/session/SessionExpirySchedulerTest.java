package com.flamingo.ai.slidedeck.service.session;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionExpirySchedulerTest {

  @Mock private SessionStore sessionStore;

  @Test
  @DisplayName("should sweep the store at the current instant")
  void shouldSweepAtCurrentInstant() {
    Instant now = Instant.parse("2025-01-01T10:30:00Z");
    SessionExpiryScheduler scheduler =
        new SessionExpiryScheduler(sessionStore, Clock.fixed(now, ZoneOffset.UTC));
    when(sessionStore.sweep(now)).thenReturn(2);

    scheduler.sweepExpiredSessions();

    verify(sessionStore).sweep(now);
  }
}
