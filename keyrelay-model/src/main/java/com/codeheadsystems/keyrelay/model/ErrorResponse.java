package com.codeheadsystems.keyrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every 4xx response produced for a {@code KeyRelayException}.
 *
 * @param code    the error code
 * @param message human-readable detail, safe to log on the client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(
    @JsonProperty("code") ErrorCode code,
    @JsonProperty("message") String message) {
}
