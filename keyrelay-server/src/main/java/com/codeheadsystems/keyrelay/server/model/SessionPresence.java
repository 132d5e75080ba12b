package com.codeheadsystems.keyrelay.server.model;

import java.time.Instant;

/**
 * The live connection currently held by a session.
 *
 * @param sessionId        the session
 * @param connectionHandle its only valid handle
 * @param lastSeenAt       when the connection was opened
 */
public record SessionPresence(
    String sessionId,
    ConnectionHandle connectionHandle,
    Instant lastSeenAt) {
}
