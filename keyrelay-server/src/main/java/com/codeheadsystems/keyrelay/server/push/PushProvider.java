package com.codeheadsystems.keyrelay.server.push;

import com.codeheadsystems.keyrelay.model.EventKind;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import java.util.Map;

/**
 * External push service seam (APNs, FCM, or a relay in front of them).
 * <p>
 * Implementations report every failure as a {@link PushResult}; they should not throw. The
 * dispatcher calls them from a worker pool and enforces its own timeout, so a blocking
 * implementation is fine.
 */
public interface PushProvider {

  /**
   * Sends one event to one device token.
   *
   * @param token   the target device
   * @param kind    the event kind
   * @param payload event fields
   * @return whether the provider accepted the notification
   */
  PushResult push(DeviceTokenRecord token, EventKind kind, Map<String, String> payload);
}
