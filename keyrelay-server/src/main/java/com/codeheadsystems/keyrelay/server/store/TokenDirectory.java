package com.codeheadsystems.keyrelay.server.store;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.Platform;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import java.util.Optional;
import java.util.Set;

/**
 * Maps session identifiers to the device tokens that can wake them.
 * <p>
 * Implementations must be thread-safe. Updates are atomic per token; there is no ordering
 * guarantee across different tokens. A token is linked to at most one session, and a session
 * may hold any number of tokens (one per installed device).
 */
public interface TokenDirectory {

  /**
   * Registers a token, or updates the platform and channel of an existing one. Never changes
   * the token's session link.
   *
   * @param token    the device token
   * @param platform issuing platform
   * @param channel  delivery channel
   * @return the stored record
   */
  DeviceTokenRecord register(String token, Platform platform, DeliveryChannel channel);

  /**
   * Links a registered token to a session, moving it off any session it was linked to before.
   * Linking to the session it is already linked to is a no-op.
   *
   * @param token     a registered token
   * @param sessionId the session to link to
   * @return the stored record
   * @throws com.codeheadsystems.keyrelay.server.exception.KeyRelayException with
   *                                                                         {@code UNKNOWN_TOKEN}
   *                                                                         if never registered
   */
  DeviceTokenRecord link(String token, String sessionId);

  /**
   * Clears a token's session link, keeping its registration.
   *
   * @param token a registered token
   * @return the stored record
   * @throws com.codeheadsystems.keyrelay.server.exception.KeyRelayException with
   *                                                                         {@code UNKNOWN_TOKEN}
   *                                                                         if never registered
   */
  DeviceTokenRecord unlink(String token);

  /**
   * Deletes a token entirely.
   *
   * @param token the device token
   * @return true if a record was removed
   */
  boolean remove(String token);

  Optional<DeviceTokenRecord> find(String token);

  /**
   * Tokens currently linked to a session. Never null; empty means the session cannot be reached
   * by push.
   *
   * @param sessionId the session
   * @return an immutable snapshot
   */
  Set<DeviceTokenRecord> tokensFor(String sessionId);
}
