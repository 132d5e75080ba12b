package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Device platform a push token was issued by.
 */
public enum Platform {
  IOS("ios"),
  ANDROID("android");

  private final String wireName;

  Platform(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Parses a wire name case-insensitively.
   *
   * @param value {@code ios} or {@code android}
   * @return the platform
   * @throws IllegalArgumentException if the value is null or unknown
   */
  @JsonCreator
  public static Platform fromWire(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Platform platform : values()) {
        if (platform.wireName.equals(normalized)) {
          return platform;
        }
      }
    }
    throw new IllegalArgumentException("Unknown platform: " + value);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
