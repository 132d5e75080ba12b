package com.codeheadsystems.keyrelay.model.keyexchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the recipient accepting a pending key exchange.
 * <p>
 * Only {@code requestId} and {@code recipientId} are required. Older clients also send
 * {@code publicKey} and {@code timestamp} here; those fields are ignored rather than rejected.
 * <p>
 * Used by: {@code POST /key-exchange/accept}
 *
 * @param requestId         the identifier returned when the request was initiated
 * @param recipientId       the accepting session; must match the stored recipient
 * @param encryptedUserData optional reciprocal payload delivered back to the sender
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyExchangeAcceptRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("recipientId") String recipientId,
    @JsonProperty("encryptedUserData") String encryptedUserData) {
}
