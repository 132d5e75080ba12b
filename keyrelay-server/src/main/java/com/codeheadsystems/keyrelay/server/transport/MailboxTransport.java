package com.codeheadsystems.keyrelay.server.transport;

import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.model.presence.EventEnvelope;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import com.codeheadsystems.keyrelay.server.store.SessionDirectory;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link ConnectionTransport} where each open connection owns a bounded mailbox that
 * the client drains by polling.
 * <p>
 * {@link #open} registers the connection with the {@link SessionDirectory}, superseding and
 * discarding any previous mailbox for the session. {@link #close} removes the mailbox and marks
 * the session offline only if the closed handle is still the current one.
 */
public class MailboxTransport implements ConnectionTransport {

  private static final Logger log = LoggerFactory.getLogger(MailboxTransport.class);

  private final SessionDirectory sessionDirectory;
  private final Clock clock;
  private final int capacity;
  private final ConcurrentHashMap<ConnectionHandle, Mailbox> mailboxes = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Mailbox transport.
   *
   * @param sessionDirectory the session directory
   * @param clock            clock used to stamp queued events
   * @param capacity         maximum undrained events per connection
   */
  public MailboxTransport(final SessionDirectory sessionDirectory,
                          final Clock clock,
                          final int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.sessionDirectory = sessionDirectory;
    this.clock = clock;
    this.capacity = capacity;
    log.info("MailboxTransport(capacity={})", capacity);
  }

  /**
   * Opens a connection for a session.
   *
   * @param sessionId the session
   * @return the new handle
   */
  public ConnectionHandle open(String sessionId) {
    ConnectionHandle handle = ConnectionHandle.random();
    // Mailbox first so an event sent right after markOnline has somewhere to go.
    mailboxes.put(handle, new Mailbox(sessionId, new ArrayBlockingQueue<>(capacity)));
    sessionDirectory.markOnline(sessionId, handle)
        .ifPresent(superseded -> {
          mailboxes.remove(superseded);
          log.debug("open(sessionId={}) superseded previous connection", sessionId);
        });
    return handle;
  }

  /**
   * Closes a connection. Unknown or already-closed handles are ignored.
   *
   * @param sessionId the session
   * @param handle    the handle to close
   */
  public void close(String sessionId, ConnectionHandle handle) {
    Mailbox mailbox = mailboxes.get(handle);
    if (mailbox != null && mailbox.sessionId().equals(sessionId)) {
      mailboxes.remove(handle, mailbox);
    }
    if (sessionDirectory.markOffline(sessionId, handle)) {
      log.debug("close(sessionId={})", sessionId);
    }
  }

  /**
   * Drains every queued event for a connection.
   *
   * @param sessionId the session
   * @param handle    its current handle
   * @return queued events in delivery order, possibly empty
   * @throws KeyRelayException with {@code STALE_CONNECTION} if the handle is not the session's
   *                           current connection
   */
  public List<EventEnvelope> poll(String sessionId, ConnectionHandle handle) {
    Mailbox mailbox = mailboxes.get(handle);
    if (mailbox == null || !mailbox.sessionId().equals(sessionId)) {
      throw KeyRelayException.staleConnection(sessionId);
    }
    List<EventEnvelope> events = new ArrayList<>();
    mailbox.queue().drainTo(events);
    return events;
  }

  @Override
  public boolean send(ConnectionHandle handle, EventKind kind, Map<String, String> payload) {
    Mailbox mailbox = mailboxes.get(handle);
    if (mailbox == null) {
      log.debug("send(kind={}) to closed connection", kind.wireName());
      return false;
    }
    EventEnvelope envelope = new EventEnvelope(kind, Map.copyOf(payload), clock.millis());
    if (!mailbox.queue().offer(envelope)) {
      log.warn("Mailbox full for sessionId={}, dropping {}", mailbox.sessionId(), kind.wireName());
      return false;
    }
    return true;
  }

  private record Mailbox(String sessionId, BlockingQueue<EventEnvelope> queue) {
  }
}
