package com.codeheadsystems.keyrelay.server.model;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.Platform;
import java.util.Objects;

/**
 * A registered push token and the session it is currently linked to.
 *
 * @param token     opaque token from APNs/FCM, unique in the directory
 * @param sessionId linked session, or null when unlinked
 * @param platform  issuing platform
 * @param channel   delivery channel
 */
public record DeviceTokenRecord(
    String token,
    String sessionId,
    Platform platform,
    DeliveryChannel channel) {

  public DeviceTokenRecord {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(channel, "channel");
  }

  public boolean isLinked() {
    return sessionId != null;
  }

  public DeviceTokenRecord withSession(String newSessionId) {
    return new DeviceTokenRecord(token, newSessionId, platform, channel);
  }

  public DeviceTokenRecord withRegistration(Platform newPlatform, DeliveryChannel newChannel) {
    return new DeviceTokenRecord(token, sessionId, newPlatform, newChannel);
  }
}
