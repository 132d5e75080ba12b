package com.codeheadsystems.keyrelay.server.dispatch;

import com.codeheadsystems.keyrelay.model.EventKind;
import java.util.Map;
import java.util.Objects;

/**
 * One event addressed to one session.
 *
 * @param sessionId the target session
 * @param kind      the event kind
 * @param payload   event fields, copied on construction
 */
public record Delivery(String sessionId, EventKind kind, Map<String, String> payload) {

  public Delivery {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(kind, "kind");
    payload = Map.copyOf(payload);
  }
}
