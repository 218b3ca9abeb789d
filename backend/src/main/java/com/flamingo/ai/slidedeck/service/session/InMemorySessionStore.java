package com.flamingo.ai.slidedeck.service.session;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import com.flamingo.ai.slidedeck.exception.SessionBusyException;
import com.flamingo.ai.slidedeck.exception.SessionNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link SessionStore}.
 *
 * <p>Each session lives in its own slot guarded by a single-permit semaphore. A semaphore rather
 * than a reentrant lock because a streamed exchange acquires on the request thread and releases
 * from the model client's callback thread.
 */
@Component
@Slf4j
public class InMemorySessionStore implements SessionStore {

  private final Map<UUID, SessionSlot> slots = new ConcurrentHashMap<>();
  private final Clock clock;
  private final PresentationConfig config;
  private final MeterRegistry meterRegistry;

  public InMemorySessionStore(
      Clock clock, PresentationConfig config, MeterRegistry meterRegistry) {
    this.clock = clock;
    this.config = config;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("guided.sessions.active", slots, Map::size);
  }

  @Override
  public UUID create(String templateKey) {
    Instant now = clock.instant();
    while (true) {
      UUID sessionId = UUID.randomUUID();
      SessionSlot slot = new SessionSlot(GuidedSession.start(sessionId, templateKey, now));
      if (slots.putIfAbsent(sessionId, slot) == null) {
        meterRegistry.counter("guided.session.created").increment();
        log.info("Created session {} for template '{}'", sessionId, templateKey);
        return sessionId;
      }
      log.warn("Session id collision on {}, regenerating", sessionId);
    }
  }

  @Override
  public GuidedSession get(UUID sessionId) {
    SessionSlot slot = requireSlot(sessionId);
    if (!slot.permit.tryAcquire()) {
      // Held by an in-flight operation, so not idle; its own writes stamp the activity.
      return slot.session;
    }
    try {
      GuidedSession current = slot.session;
      Instant now = clock.instant();
      if (slot.retired) {
        throw new SessionNotFoundException(sessionId);
      }
      if (current.isExpired(now, idleTimeout())) {
        retire(sessionId, slot);
        throw new SessionNotFoundException(sessionId);
      }
      if (!now.equals(current.getLastActivity())) {
        current = current.toBuilder().lastActivity(now).build();
        slot.session = current;
      }
      return current;
    } finally {
      slot.permit.release();
    }
  }

  @Override
  public GuidedSession mutate(UUID sessionId, UnaryOperator<GuidedSession> fn) {
    try (SessionLease lease = lease(sessionId)) {
      return lease.update(fn);
    }
  }

  @Override
  public SessionLease lease(UUID sessionId) {
    SessionSlot slot = requireSlot(sessionId);
    Duration timeout = config.getSession().getLeaseTimeout();
    boolean acquired;
    try {
      acquired = slot.permit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SessionBusyException(sessionId);
    }
    if (!acquired) {
      log.warn("Timed out after {} waiting for session {}", timeout, sessionId);
      throw new SessionBusyException(sessionId);
    }

    if (slot.retired) {
      slot.permit.release();
      throw new SessionNotFoundException(sessionId);
    }
    if (slot.session.isExpired(clock.instant(), idleTimeout())) {
      // The permit is held, so nothing else can be writing to this session.
      retire(sessionId, slot);
      slot.permit.release();
      throw new SessionNotFoundException(sessionId);
    }
    return new SlotLease(sessionId, slot);
  }

  @Override
  public void delete(UUID sessionId) {
    SessionSlot slot = slots.remove(sessionId);
    if (slot == null) {
      log.debug("Delete of unknown session {} ignored", sessionId);
      return;
    }
    slot.retired = true;
    meterRegistry.counter("guided.session.deleted").increment();
    log.info("Deleted session {}", sessionId);
  }

  @Override
  public int sweep(Instant now) {
    Duration idleTimeout = idleTimeout();
    int removed = 0;
    for (Map.Entry<UUID, SessionSlot> entry : slots.entrySet()) {
      SessionSlot slot = entry.getValue();
      if (!slot.session.isExpired(now, idleTimeout)) {
        continue;
      }
      if (!slot.permit.tryAcquire()) {
        log.debug("Session {} is in use, skipping expiry", entry.getKey());
        continue;
      }
      try {
        if (slot.session.isExpired(now, idleTimeout) && retire(entry.getKey(), slot)) {
          removed++;
        }
      } finally {
        slot.permit.release();
      }
    }
    if (removed > 0) {
      log.info("Cleaned up {} expired sessions", removed);
    }
    return removed;
  }

  @Override
  public int activeCount() {
    return slots.size();
  }

  private SessionSlot requireSlot(UUID sessionId) {
    SessionSlot slot = slots.get(sessionId);
    if (slot == null || slot.retired) {
      log.debug("Session {} not found", sessionId);
      throw new SessionNotFoundException(sessionId);
    }
    return slot;
  }

  /** Must be called with the slot's permit held. */
  private boolean retire(UUID sessionId, SessionSlot slot) {
    if (!slots.remove(sessionId, slot)) {
      return false;
    }
    slot.retired = true;
    meterRegistry.counter("guided.session.expired").increment();
    log.info("Session {} has expired, removed", sessionId);
    return true;
  }

  private Duration idleTimeout() {
    return config.getSession().getIdleTimeout();
  }

  private static final class SessionSlot {
    private final Semaphore permit = new Semaphore(1);
    private volatile GuidedSession session;
    private volatile boolean retired;

    private SessionSlot(GuidedSession session) {
      this.session = session;
    }
  }

  /** Update and close are mutually exclusive; no write lands after the permit is released. */
  private final class SlotLease implements SessionLease {
    private final UUID sessionId;
    private final SessionSlot slot;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SlotLease(UUID sessionId, SessionSlot slot) {
      this.sessionId = sessionId;
      this.slot = slot;
    }

    @Override
    public GuidedSession session() {
      ensureUsable();
      return slot.session;
    }

    @Override
    public synchronized GuidedSession update(UnaryOperator<GuidedSession> fn) {
      ensureUsable();
      GuidedSession next = fn.apply(slot.session);
      GuidedSession stamped = next.toBuilder().lastActivity(clock.instant()).build();
      slot.session = stamped;
      return stamped;
    }

    @Override
    public synchronized void close() {
      if (closed.compareAndSet(false, true)) {
        slot.permit.release();
      }
    }

    private void ensureUsable() {
      if (closed.get()) {
        throw new IllegalStateException("Lease on session " + sessionId + " is already closed");
      }
      if (slot.retired) {
        throw new SessionNotFoundException(sessionId);
      }
    }
  }
}
