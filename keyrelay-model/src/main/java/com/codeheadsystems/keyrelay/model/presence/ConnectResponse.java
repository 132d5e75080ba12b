package com.codeheadsystems.keyrelay.model.presence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned when a session opens a connection. The handle must be quoted when polling for
 * events and when disconnecting. Opening a new connection invalidates the previous handle.
 *
 * @param sessionId        the connected session
 * @param connectionHandle opaque handle for this connection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("connectionHandle") String connectionHandle) {
}
