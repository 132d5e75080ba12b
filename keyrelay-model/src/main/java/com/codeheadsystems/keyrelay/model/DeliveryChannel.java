package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Push delivery channel for a device token.
 * <p>
 * {@link #DEFAULT} pushes carry a visible alert. {@link #SILENT} pushes are data-only
 * wake-ups ({@code content-available} on iOS, data messages on Android).
 */
public enum DeliveryChannel {
  DEFAULT("default"),
  SILENT("silent");

  private final String wireName;

  DeliveryChannel(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Parses a wire name. A null or blank value selects {@link #DEFAULT}.
   *
   * @param value the channel name
   * @return the channel
   * @throws IllegalArgumentException for an unknown, non-blank name
   */
  @JsonCreator
  public static DeliveryChannel fromWire(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (DeliveryChannel channel : values()) {
      if (channel.wireName.equals(normalized)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("Unknown channel: " + value);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
