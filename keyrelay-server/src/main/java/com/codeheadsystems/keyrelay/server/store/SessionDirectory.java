package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import com.codeheadsystems.keyrelay.server.model.SessionPresence;
import java.util.Optional;

/**
 * Authoritative online/offline state for sessions.
 * <p>
 * A session holds at most one live connection handle. Updates are atomic per session.
 * The transport layer calls {@link #markOnline} and {@link #markOffline} as connections open and
 * close; the notification dispatcher reads {@link #handleFor}.
 */
public interface SessionDirectory {

  /**
   * Records a new connection, superseding any previous handle for the session.
   *
   * @param sessionId the session
   * @param handle    the new handle
   * @return the handle that was superseded, if any
   */
  Optional<ConnectionHandle> markOnline(String sessionId, ConnectionHandle handle);

  /**
   * Clears the session's handle. Idempotent.
   *
   * @param sessionId the session
   */
  void markOffline(String sessionId);

  /**
   * Clears the session's handle only if it is still {@code handle}.
   *
   * @param sessionId the session
   * @param handle    the handle the caller believes is current
   * @return true if the session was marked offline
   */
  boolean markOffline(String sessionId, ConnectionHandle handle);

  boolean isOnline(String sessionId);

  Optional<ConnectionHandle> handleFor(String sessionId);

  Optional<SessionPresence> presence(String sessionId);

  /**
   * Registers a listener fired after every {@link #markOnline}.
   *
   * @param listener the listener
   */
  void addListener(PresenceListener listener);
}
