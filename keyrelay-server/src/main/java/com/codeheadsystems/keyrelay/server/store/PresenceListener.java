package com.codeheadsystems.keyrelay.server.store;

/**
 * Callback fired by a {@link SessionDirectory} after a session comes online.
 * <p>
 * Invoked on the thread that called {@link SessionDirectory#markOnline}, after the new handle
 * is visible. Listeners must not throw; failures are logged and do not affect the connect.
 */
@FunctionalInterface
public interface PresenceListener {

  void onOnline(String sessionId);
}
