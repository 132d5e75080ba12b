package com.codeheadsystems.keyrelay.server.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque reference to a live connection. Owned by the transport layer; the core only stores
 * and compares it.
 *
 * @param value the handle value
 */
public record ConnectionHandle(String value) {

  public ConnectionHandle {
    Objects.requireNonNull(value, "value");
  }

  public static ConnectionHandle random() {
    return new ConnectionHandle(UUID.randomUUID().toString());
  }
}
