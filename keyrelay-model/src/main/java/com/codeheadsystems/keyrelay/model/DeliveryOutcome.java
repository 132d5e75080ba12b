package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregated result of delivering one event to one session.
 * <p>
 * Outcomes are reported, never thrown: a handshake that could not be delivered still exists
 * and can be picked up later by polling.
 */
public enum DeliveryOutcome {

  /** Delivered over a live connection, or every push token was accepted by the provider. */
  DELIVERED("delivered"),

  /** Some push tokens were accepted and some were not. */
  PARTIAL_FAILURE("partial_failure"),

  /** Every push token was rejected, timed out, or the provider was unreachable. */
  FAILED("failed"),

  /** The session is offline and has no linked push tokens. */
  UNDELIVERABLE("undeliverable");

  private final String wireName;

  DeliveryOutcome(String wireName) {
    this.wireName = wireName;
  }

  @JsonCreator
  public static DeliveryOutcome fromWire(String value) {
    for (DeliveryOutcome outcome : values()) {
      if (outcome.wireName.equals(value)) {
        return outcome;
      }
    }
    throw new IllegalArgumentException("Unknown delivery outcome: " + value);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
