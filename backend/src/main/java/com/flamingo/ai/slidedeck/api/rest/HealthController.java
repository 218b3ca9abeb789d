package com.flamingo.ai.slidedeck.api.rest;

import com.flamingo.ai.slidedeck.service.session.SessionStore;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final SessionStore sessionStore;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "slidedeck");
    health.put("activeSessions", sessionStore.activeCount());
    return ResponseEntity.ok(health);
  }
}
