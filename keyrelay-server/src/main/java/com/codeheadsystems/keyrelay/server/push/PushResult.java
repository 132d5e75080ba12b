package com.codeheadsystems.keyrelay.server.push;

import java.util.Objects;

/**
 * Outcome of handing one event to a push provider for one token.
 *
 * @param accepted whether the provider took the notification
 * @param reason   why it was not accepted, null when accepted
 */
public record PushResult(boolean accepted, Reason reason) {

  private static final PushResult ACCEPTED = new PushResult(true, null);

  /**
   * Rejection reasons. Only {@link #INVALID_TOKEN} is permanent.
   */
  public enum Reason {
    /** The platform reports the token as unregistered or malformed. */
    INVALID_TOKEN,
    /** The provider refused the message for some other reason. */
    REJECTED,
    /** The provider could not be reached. */
    UNAVAILABLE,
    /** The provider did not answer within the configured timeout. */
    TIMEOUT
  }

  public PushResult {
    if (!accepted) {
      Objects.requireNonNull(reason, "reason");
    }
  }

  public static PushResult ok() {
    return ACCEPTED;
  }

  public static PushResult rejected(Reason reason) {
    return new PushResult(false, reason);
  }
}
