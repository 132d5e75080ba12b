package com.codeheadsystems.keyrelay.server.transport;

import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import java.util.Map;

/**
 * Sends events over live connections. Owned by whatever layer terminates client connections
 * (long-poll mailboxes, WebSockets, a message broker).
 */
public interface ConnectionTransport {

  /**
   * Sends an event over a connection.
   *
   * @param handle  the connection handle
   * @param kind    the event kind
   * @param payload event fields
   * @return false if the handle is stale or the send failed; never throws for those cases
   */
  boolean send(ConnectionHandle handle, EventKind kind, Map<String, String> payload);
}
