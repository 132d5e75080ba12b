package com.codeheadsystems.keyrelay.model.keyexchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the recipient declining a pending key exchange.
 * <p>
 * Used by: {@code POST /key-exchange/reject}
 *
 * @param requestId   the identifier returned when the request was initiated
 * @param recipientId the declining session; must match the stored recipient
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeRejectRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("recipientId") String recipientId) {
}
