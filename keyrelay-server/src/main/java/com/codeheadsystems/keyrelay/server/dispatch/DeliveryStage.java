package com.codeheadsystems.keyrelay.server.dispatch;

import com.codeheadsystems.keyrelay.model.DeliveryOutcome;
import java.util.Optional;

/**
 * One step in the dispatcher's delivery chain.
 * <p>
 * A stage either settles the delivery by returning an outcome or passes it on by returning
 * empty. Stages never throw for delivery problems.
 */
public interface DeliveryStage {

  Optional<DeliveryOutcome> attempt(Delivery delivery);

  /**
   * Releases any threads held by the stage.
   */
  default void shutdown() {
  }
}
