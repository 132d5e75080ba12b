package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Events the server delivers to a session, either directly over a live connection or by push.
 * <p>
 * The wire names match the {@code type} values the mobile client already switches on.
 */
public enum EventKind {

  /** A peer has offered a key exchange; carries the sender's public key. */
  KEY_EXCHANGE_REQUEST("key_exchange_request"),

  /** The recipient accepted; carries the recipient's reciprocal payload when supplied. */
  KEY_EXCHANGE_ACCEPTED("key_exchange_accepted"),

  /** The recipient declined. No payload beyond the request identifier. */
  KEY_EXCHANGE_REJECTED("key_exchange_rejected");

  private final String wireName;

  EventKind(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Parses a wire name.
   *
   * @param value the wire name, e.g. {@code key_exchange_request}
   * @return the matching kind
   * @throws IllegalArgumentException for an unknown name
   */
  @JsonCreator
  public static EventKind fromWire(String value) {
    for (EventKind kind : values()) {
      if (kind.wireName.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown event kind: " + value);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
