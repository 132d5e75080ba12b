package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a key exchange request. {@link #PENDING} is the only non-terminal state.
 */
public enum KeyExchangeStatus {
  PENDING("pending"),
  ACCEPTED("accepted"),
  REJECTED("rejected"),
  EXPIRED("expired");

  private final String wireName;

  KeyExchangeStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonCreator
  public static KeyExchangeStatus fromWire(String value) {
    for (KeyExchangeStatus status : values()) {
      if (status.wireName.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown status: " + value);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }
}
