package com.codeheadsystems.keyrelay.server.dispatch;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import com.codeheadsystems.keyrelay.model.EventKind;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes an event to a session through an ordered chain of {@link DeliveryStage}s, normally
 * direct delivery followed by push.
 * <p>
 * Holds no state of its own. The first stage to return an outcome settles the delivery; if
 * every stage passes, the outcome is {@link DeliveryOutcome#UNDELIVERABLE}.
 */
@Singleton
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<DeliveryStage> stages;

  /**
   * Instantiates a new Notification dispatcher.
   *
   * @param stages the stages, tried in order
   */
  @Inject
  public NotificationDispatcher(final List<DeliveryStage> stages) {
    this.stages = List.copyOf(stages);
    log.info("NotificationDispatcher({} stages)", this.stages.size());
  }

  /**
   * Delivers an event.
   *
   * @param sessionId the target session
   * @param kind      the event kind
   * @param payload   event fields
   * @return how the event was delivered
   */
  public DeliveryOutcome deliver(String sessionId, EventKind kind, Map<String, String> payload) {
    Delivery delivery = new Delivery(sessionId, kind, payload);
    for (DeliveryStage stage : stages) {
      Optional<DeliveryOutcome> outcome = stage.attempt(delivery);
      if (outcome.isPresent()) {
        return outcome.get();
      }
    }
    return DeliveryOutcome.UNDELIVERABLE;
  }

  /**
   * Shuts down every stage.
   */
  public void shutdown() {
    stages.forEach(DeliveryStage::shutdown);
  }
}
