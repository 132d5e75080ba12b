package com.codeheadsystems.keyrelay.model.presence;

import com.codeheadsystems.keyrelay.model.EventKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One event delivered over a live connection.
 *
 * @param kind     the event kind
 * @param payload  event fields, e.g. {@code requestId}, {@code senderId}, {@code publicKey}
 * @param queuedAt epoch millis when the server queued the event
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
    @JsonProperty("kind") EventKind kind,
    @JsonProperty("payload") Map<String, String> payload,
    @JsonProperty("queuedAt") long queuedAt) {
}
