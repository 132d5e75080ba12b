package com.codeheadsystems.keyrelay.model.keyexchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Pending requests addressed to one session, oldest first.
 *
 * @param sessionId the recipient session
 * @param requests  the pending requests
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingKeyExchangesResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("requests") List<KeyExchangeView> requests) {
}
