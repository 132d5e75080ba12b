package com.codeheadsystems.keyrelay.model.presence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Online status of a session.
 *
 * @param sessionId  the session
 * @param online     whether it holds a live connection
 * @param lastSeenAt epoch millis of the last connect, null if never seen or offline
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresenceView(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("online") boolean online,
    @JsonProperty("lastSeenAt") Long lastSeenAt) {
}
