package com.codeheadsystems.keyrelay.server.manager;

import com.codeheadsystems.keyrelay.server.store.PresenceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-delivers pending key exchange requests to a session when it comes online.
 * <p>
 * Not installed by default; clients may also fetch {@code GET /key-exchange/pending/{id}}.
 */
public class PendingRequestReplayer implements PresenceListener {

  private static final Logger log = LoggerFactory.getLogger(PendingRequestReplayer.class);

  private final KeyExchangeManager manager;

  public PendingRequestReplayer(final KeyExchangeManager manager) {
    this.manager = manager;
  }

  @Override
  public void onOnline(String sessionId) {
    int replayed = manager.redeliverPending(sessionId);
    if (replayed > 0) {
      log.debug("Replayed {} pending request(s) to sessionId={}", replayed, sessionId);
    }
  }
}
