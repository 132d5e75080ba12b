package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import com.codeheadsystems.keyrelay.server.model.SessionPresence;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link SessionDirectory}. Presence is transient by nature, so this is also the
 * production implementation for a single node.
 */
public class InMemorySessionDirectory implements SessionDirectory {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionDirectory.class);

  private final ConcurrentHashMap<String, SessionPresence> presences = new ConcurrentHashMap<>();
  private final List<PresenceListener> listeners = new CopyOnWriteArrayList<>();
  private final Clock clock;

  public InMemorySessionDirectory() {
    this(Clock.systemUTC());
  }

  public InMemorySessionDirectory(final Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<ConnectionHandle> markOnline(String sessionId, ConnectionHandle handle) {
    SessionPresence previous = presences.put(sessionId,
        new SessionPresence(sessionId, handle, clock.instant()));
    log.debug("markOnline(sessionId={}, superseded={})", sessionId, previous != null);
    for (PresenceListener listener : listeners) {
      try {
        listener.onOnline(sessionId);
      } catch (RuntimeException e) {
        log.warn("Presence listener failed for sessionId={}", sessionId, e);
      }
    }
    return Optional.ofNullable(previous).map(SessionPresence::connectionHandle);
  }

  @Override
  public void markOffline(String sessionId) {
    if (presences.remove(sessionId) != null) {
      log.debug("markOffline(sessionId={})", sessionId);
    }
  }

  @Override
  public boolean markOffline(String sessionId, ConnectionHandle handle) {
    boolean[] cleared = {false};
    presences.computeIfPresent(sessionId, (key, current) -> {
      if (current.connectionHandle().equals(handle)) {
        cleared[0] = true;
        return null;
      }
      return current;
    });
    if (cleared[0]) {
      log.debug("markOffline(sessionId={}) for stale or closed handle", sessionId);
    }
    return cleared[0];
  }

  @Override
  public boolean isOnline(String sessionId) {
    return presences.containsKey(sessionId);
  }

  @Override
  public Optional<ConnectionHandle> handleFor(String sessionId) {
    return presence(sessionId).map(SessionPresence::connectionHandle);
  }

  @Override
  public Optional<SessionPresence> presence(String sessionId) {
    return Optional.ofNullable(presences.get(sessionId));
  }

  @Override
  public void addListener(PresenceListener listener) {
    listeners.add(listener);
  }
}
