package com.codeheadsystems.keyrelay.server.dispatch;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import com.codeheadsystems.keyrelay.server.store.SessionDirectory;
import com.codeheadsystems.keyrelay.server.transport.ConnectionTransport;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers over the session's live connection when it has one.
 * <p>
 * A failed send means the handle is stale; it is dropped from the {@link SessionDirectory}
 * (only if nobody has reconnected since) and the delivery falls through to the next stage.
 */
public class DirectDeliveryStage implements DeliveryStage {

  private static final Logger log = LoggerFactory.getLogger(DirectDeliveryStage.class);

  private final SessionDirectory sessionDirectory;
  private final ConnectionTransport transport;

  public DirectDeliveryStage(final SessionDirectory sessionDirectory,
                             final ConnectionTransport transport) {
    this.sessionDirectory = sessionDirectory;
    this.transport = transport;
    log.info("DirectDeliveryStage({})", transport.getClass().getSimpleName());
  }

  @Override
  public Optional<DeliveryOutcome> attempt(Delivery delivery) {
    Optional<ConnectionHandle> handle = sessionDirectory.handleFor(delivery.sessionId());
    if (handle.isEmpty()) {
      return Optional.empty();
    }
    if (transport.send(handle.get(), delivery.kind(), delivery.payload())) {
      log.debug("Delivered {} directly to sessionId={}", delivery.kind().wireName(),
          delivery.sessionId());
      return Optional.of(DeliveryOutcome.DELIVERED);
    }
    sessionDirectory.markOffline(delivery.sessionId(), handle.get());
    log.debug("Direct send failed for sessionId={}, falling back", delivery.sessionId());
    return Optional.empty();
  }
}
